package com.chicu.agentpulse.strategy;

import com.chicu.agentpulse.strategy.space.ParamSpace;
import com.chicu.agentpulse.strategy.space.ParamSpaceValidator;
import com.chicu.agentpulse.strategy.space.ValidatedParam;
import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Текущий набор адаптивных параметров. Неизменяем; "изменение" = новая копия через {@link #with}.
 */
@Builder(toBuilder = true)
public record StrategyParameters(
        PostingTone postingTone,
        InsightFocus insightFocus,
        int minQualityScore,
        int maxDailyActions,
        int optimalHour,
        double minVoteScore
) {

    /**
     * Значение в нормализованном виде (как его выдаёт {@link ParamSpaceValidator}).
     */
    public Object get(String name) {
        return switch (name) {
            case ParamSpace.POSTING_TONE -> postingTone.code();
            case ParamSpace.INSIGHT_FOCUS -> insightFocus.code();
            case ParamSpace.MIN_QUALITY_SCORE -> minQualityScore;
            case ParamSpace.MAX_DAILY_ACTIONS -> maxDailyActions;
            case ParamSpace.OPTIMAL_HOUR -> optimalHour;
            case ParamSpace.MIN_VOTE_SCORE -> minVoteScore;
            default -> throw new IllegalArgumentException("unknown parameter: " + name);
        };
    }

    /**
     * @param value уже прошедшее {@link ParamSpaceValidator#validate} значение
     */
    public StrategyParameters with(String name, Object value) {
        return switch (name) {
            case ParamSpace.POSTING_TONE -> toBuilder()
                    .postingTone(PostingTone.valueOf(value.toString().toUpperCase(Locale.ROOT))).build();
            case ParamSpace.INSIGHT_FOCUS -> toBuilder()
                    .insightFocus(InsightFocus.valueOf(value.toString().toUpperCase(Locale.ROOT))).build();
            case ParamSpace.MIN_QUALITY_SCORE -> toBuilder().minQualityScore(((Number) value).intValue()).build();
            case ParamSpace.MAX_DAILY_ACTIONS -> toBuilder().maxDailyActions(((Number) value).intValue()).build();
            case ParamSpace.OPTIMAL_HOUR -> toBuilder().optimalHour(((Number) value).intValue()).build();
            case ParamSpace.MIN_VOTE_SCORE -> toBuilder().minVoteScore(((Number) value).doubleValue()).build();
            default -> throw new IllegalArgumentException("unknown parameter: " + name);
        };
    }

    public Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        for (String name : ParamSpace.names()) {
            m.put(name, get(name));
        }
        return m;
    }

    /**
     * Каждый параметр лежит в своём домене.
     */
    public boolean withinDomain() {
        if (postingTone == null || insightFocus == null) return false;
        for (String name : ParamSpace.names()) {
            if (!ParamSpaceValidator.validate(name, get(name)).allowed()) return false;
        }
        return true;
    }

    /**
     * Восстановление из сохранённой map: невалидные/отсутствующие значения берутся из fallback.
     */
    public static StrategyParameters fromMap(Map<String, Object> values, StrategyParameters fallback) {
        StrategyParameters p = fallback;
        if (values == null) return p;
        for (String name : ParamSpace.names()) {
            ValidatedParam v = ParamSpaceValidator.validate(name, values.get(name));
            if (v.allowed()) p = p.with(name, v.value());
        }
        return p;
    }
}
