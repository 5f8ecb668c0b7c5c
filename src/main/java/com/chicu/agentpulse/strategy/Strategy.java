package com.chicu.agentpulse.strategy;

import java.time.Instant;
import java.util.List;

/**
 * Снимок стратегии. Читатели берут его один раз на решение и не держат ссылку дольше.
 */
public record Strategy(
        int version,
        StrategyParameters parameters,
        Instant lastAdaptedAt,
        List<AdaptationRecord> history
) {
    public Strategy {
        if (version < 1) throw new IllegalArgumentException("strategy version must be >= 1");
        history = history == null ? List.of() : List.copyOf(history);
    }
}
