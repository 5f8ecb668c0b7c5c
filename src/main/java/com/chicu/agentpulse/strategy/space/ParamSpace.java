package com.chicu.agentpulse.strategy.space;

import com.chicu.agentpulse.strategy.InsightFocus;
import com.chicu.agentpulse.strategy.PostingTone;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Allow-list адаптивных параметров. Всё, чего здесь нет, внешняя рекомендация менять не может.
 */
public final class ParamSpace {

    public static final String POSTING_TONE = "postingTone";
    public static final String INSIGHT_FOCUS = "insightFocus";
    public static final String MIN_QUALITY_SCORE = "minQualityScore";
    public static final String MAX_DAILY_ACTIONS = "maxDailyActions";
    public static final String OPTIMAL_HOUR = "optimalHour";
    public static final String MIN_VOTE_SCORE = "minVoteScore";

    private static final Map<String, ParamSpaceItem> ITEMS;

    static {
        Map<String, ParamSpaceItem> m = new LinkedHashMap<>();
        put(m, enumItem(POSTING_TONE, Arrays.stream(PostingTone.values()).map(PostingTone::code)
                .collect(Collectors.toUnmodifiableSet())));
        put(m, enumItem(INSIGHT_FOCUS, Arrays.stream(InsightFocus.values()).map(InsightFocus::code)
                .collect(Collectors.toUnmodifiableSet())));
        put(m, range(MIN_QUALITY_SCORE, ParamValueType.INT, "4", "8"));
        put(m, range(MAX_DAILY_ACTIONS, ParamValueType.INT, "2", "8"));
        put(m, range(OPTIMAL_HOUR, ParamValueType.INT, "0", "23"));
        put(m, range(MIN_VOTE_SCORE, ParamValueType.DECIMAL, "4.0", "9.0"));
        ITEMS = Collections.unmodifiableMap(m);
    }

    private ParamSpace() {}

    public static Optional<ParamSpaceItem> item(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(ITEMS.get(name));
    }

    public static Set<String> names() {
        return ITEMS.keySet();
    }

    public static Map<String, ParamSpaceItem> items() {
        return ITEMS;
    }

    private static void put(Map<String, ParamSpaceItem> m, ParamSpaceItem item) {
        ParamSpaceValidator.validateOrThrow(item);
        m.put(item.name(), item);
    }

    private static ParamSpaceItem enumItem(String name, Set<String> allowed) {
        return ParamSpaceItem.builder().name(name).type(ParamValueType.ENUM).allowed(allowed).build();
    }

    private static ParamSpaceItem range(String name, ParamValueType type, String min, String max) {
        return ParamSpaceItem.builder()
                .name(name)
                .type(type)
                .min(new BigDecimal(min))
                .max(new BigDecimal(max))
                .build();
    }
}
