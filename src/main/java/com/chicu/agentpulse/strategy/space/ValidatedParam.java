package com.chicu.agentpulse.strategy.space;

/**
 * Результат проверки одного значения: либо нормализованное value, либо отказ с причиной.
 */
public record ValidatedParam(
        String name,
        Object value,
        boolean allowed,
        String reason
) {
    public static ValidatedParam ok(String name, Object value) {
        return new ValidatedParam(name, value, true, "OK");
    }

    public static ValidatedParam deny(String name, String reason) {
        return new ValidatedParam(name, null, false, reason);
    }
}
