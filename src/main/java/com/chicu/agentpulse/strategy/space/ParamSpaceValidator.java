package com.chicu.agentpulse.strategy.space;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Проверка значений, пришедших извне (ответ модели, БД).
 * Приводим тип только когда это точно: "7" -> 7, 7.0 -> 7, но не 7.5 -> 7 и не "seven".
 */
public final class ParamSpaceValidator {

    private ParamSpaceValidator() {}

    public static void validateOrThrow(ParamSpaceItem item) {
        if (item == null) throw new IllegalArgumentException("ParamSpace: item is null");
        if (item.name() == null || item.name().trim().isEmpty()) {
            throw new IllegalArgumentException("ParamSpace: name пустой");
        }
        if (item.type() == null) {
            throw new IllegalArgumentException("ParamSpace: type не задан для " + item.name());
        }

        if (item.type() == ParamValueType.ENUM) {
            if (item.allowed() == null || item.allowed().isEmpty()) {
                throw new IllegalArgumentException("ParamSpace: пустой список значений для " + item.name());
            }
            return;
        }

        BigDecimal min = item.min();
        BigDecimal max = item.max();
        if (min == null || max == null) {
            throw new IllegalArgumentException("ParamSpace: min/max должны быть заданы для " + item.name());
        }
        if (min.compareTo(max) > 0) {
            throw new IllegalArgumentException("ParamSpace: min > max для " + item.name());
        }
        if (item.type() == ParamValueType.INT
                && (min.stripTrailingZeros().scale() > 0 || max.stripTrailingZeros().scale() > 0)) {
            throw new IllegalArgumentException("ParamSpace: INT параметр требует целые min/max: " + item.name());
        }
    }

    /**
     * Имя из allow-list + значение в домене -> нормализованное значение
     * (Integer для INT, Double для DECIMAL, строка нижнего регистра для ENUM).
     */
    public static ValidatedParam validate(String name, Object raw) {
        ParamSpaceItem item = ParamSpace.item(name).orElse(null);
        if (item == null) {
            return ValidatedParam.deny(String.valueOf(name), "parameter is not adaptable");
        }
        if (raw == null) {
            return ValidatedParam.deny(name, "value is null");
        }

        return switch (item.type()) {
            case ENUM -> validateEnum(item, raw);
            case INT -> validateInt(item, raw);
            case DECIMAL -> validateDecimal(item, raw);
        };
    }

    private static ValidatedParam validateEnum(ParamSpaceItem item, Object raw) {
        if (!(raw instanceof CharSequence)) {
            return ValidatedParam.deny(item.name(), "expected one of " + item.allowed());
        }
        String v = raw.toString().trim().toLowerCase(Locale.ROOT);
        if (!item.allowed().contains(v)) {
            return ValidatedParam.deny(item.name(), "'" + shrink(raw) + "' is not one of " + item.allowed());
        }
        return ValidatedParam.ok(item.name(), v);
    }

    private static ValidatedParam validateInt(ParamSpaceItem item, Object raw) {
        BigDecimal d = toDecimal(raw);
        if (d == null) {
            return ValidatedParam.deny(item.name(), "'" + shrink(raw) + "' is not a number");
        }
        if (d.stripTrailingZeros().scale() > 0) {
            return ValidatedParam.deny(item.name(), d.toPlainString() + " is not an integer");
        }
        if (d.compareTo(item.min()) < 0 || d.compareTo(item.max()) > 0) {
            return ValidatedParam.deny(item.name(), d.toPlainString() + " outside [" + item.min() + "," + item.max() + "]");
        }
        return ValidatedParam.ok(item.name(), d.intValueExact());
    }

    private static ValidatedParam validateDecimal(ParamSpaceItem item, Object raw) {
        BigDecimal d = toDecimal(raw);
        if (d == null) {
            return ValidatedParam.deny(item.name(), "'" + shrink(raw) + "' is not a number");
        }
        if (d.compareTo(item.min()) < 0 || d.compareTo(item.max()) > 0) {
            return ValidatedParam.deny(item.name(), d.toPlainString() + " outside [" + item.min() + "," + item.max() + "]");
        }
        return ValidatedParam.ok(item.name(), d.doubleValue());
    }

    /**
     * null если не число или не конечное.
     */
    static BigDecimal toDecimal(Object raw) {
        if (raw instanceof Boolean) return null;
        if (raw instanceof BigDecimal bd) return bd;
        if (raw instanceof Double || raw instanceof Float) {
            double v = ((Number) raw).doubleValue();
            if (Double.isNaN(v) || Double.isInfinite(v)) return null;
            return BigDecimal.valueOf(v);
        }
        if (raw instanceof Number n) {
            return new BigDecimal(n.toString());
        }
        if (raw instanceof CharSequence cs) {
            String s = cs.toString().trim();
            if (s.isEmpty() || s.length() > 32) return null;
            try {
                return new BigDecimal(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String shrink(Object raw) {
        String s = String.valueOf(raw);
        return s.length() <= 40 ? s : s.substring(0, 40) + "...";
    }
}
