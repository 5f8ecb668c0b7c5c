package com.chicu.agentpulse.strategy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Единственная живая стратегия процесса.
 * Чтение — из любого потока, запись — только из пакета strategy (AdaptationService), под одним монитором.
 */
@Slf4j
@Component
public class StrategyHolder {

    private final AtomicReference<Strategy> current;
    private final int historyCap;

    public StrategyHolder(StrategyProperties props) {
        StrategyParameters initial = props.initialParameters();
        if (!initial.withinDomain()) {
            throw new IllegalStateException("initial strategy parameters are outside their domain: " + initial.asMap());
        }
        this.historyCap = Math.max(1, props.getHistoryCap());
        this.current = new AtomicReference<>(new Strategy(1, initial, null, List.of()));
    }

    public Strategy current() {
        return current.get();
    }

    public StrategyParameters parameters() {
        return current.get().parameters();
    }

    /**
     * Применяет уже проверенный набор. Версия +1, запись в историю.
     */
    synchronized Strategy apply(StrategyParameters next, AdaptationRecord record) {
        if (next == null || !next.withinDomain()) {
            throw new IllegalStateException("refusing to apply parameters outside their domain");
        }

        Strategy prev = current.get();
        if (record.fromVersion() != prev.version()) {
            throw new IllegalStateException("adaptation built for v" + record.fromVersion() + " but current is v" + prev.version());
        }

        List<AdaptationRecord> history = new ArrayList<>(prev.history());
        history.add(record);
        while (history.size() > historyCap) history.remove(0);

        Strategy updated = new Strategy(prev.version() + 1, next, record.createdAt(), history);
        current.set(updated);

        log.info("🧬 Strategy v{} -> v{} params={}", prev.version(), updated.version(), next.asMap());
        return updated;
    }

    /**
     * Восстановление после рестарта (версия из БД).
     */
    synchronized void restore(int version, StrategyParameters params, Instant lastAdaptedAt, List<AdaptationRecord> history) {
        List<AdaptationRecord> h = new ArrayList<>(history == null ? List.of() : history);
        while (h.size() > historyCap) h.remove(0);
        current.set(new Strategy(Math.max(1, version), params, lastAdaptedAt, h));
        log.info("🧬 Strategy restored v{} params={}", version, params.asMap());
    }
}
