package com.chicu.agentpulse.strategy;

import com.chicu.agentpulse.common.enums.ActionOutcome;
import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.journal.ActionDraft;
import com.chicu.agentpulse.journal.ActionJournalService;
import com.chicu.agentpulse.journal.ActionRecord;
import com.chicu.agentpulse.ledger.LedgerCommitService;
import com.chicu.agentpulse.strategy.persistence.AdaptationRecordEntity;
import com.chicu.agentpulse.strategy.persistence.AdaptationRecordRepository;
import com.chicu.agentpulse.strategy.space.ParamSpaceValidator;
import com.chicu.agentpulse.strategy.space.ValidatedParam;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Цикл адаптации: метрики -> рекомендация -> проверка -> новая версия -> журнал/леджер.
 * <p>
 * Рекомендация модели — недоверенный ввод: применяется только то, что прошло {@link ParamSpaceValidator}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdaptationService {

    private final StrategyHolder holder;
    private final MetricsCollector metricsCollector;
    private final StrategyAdvisor advisor;
    private final AdaptationRecordRepository repo;
    private final ActionJournalService journal;
    private final LedgerCommitService ledgerCommit;
    private final StrategyProperties props;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Один цикл одновременно.
     */
    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    // =====================================================
    // STARTUP
    // =====================================================

    @PostConstruct
    public void restoreLatest() {
        Optional<AdaptationRecordEntity> latest;
        try {
            latest = repo.findTopByOrderByToVersionDesc();
        } catch (RuntimeException e) {
            log.error("🧬 Strategy restore failed, starting from v1: {}", e.getMessage());
            return;
        }
        if (latest.isEmpty()) {
            log.info("🧬 Strategy: no persisted adaptations, starting from v1");
            return;
        }

        AdaptationRecordEntity e = latest.get();
        StrategyParameters params = StrategyParameters.fromMap(readMap(e.getParametersJson()), props.initialParameters());

        List<AdaptationRecord> history = new ArrayList<>();
        for (AdaptationRecordEntity h : repo.findByOrderByToVersionDesc(PageRequest.of(0, Math.max(1, props.getHistoryCap())))) {
            history.add(toRecord(h));
        }
        Collections.reverse(history);

        holder.restore(e.getToVersion(), params, e.getCreatedAt(), history);
    }

    // =====================================================
    // CYCLE
    // =====================================================

    public AdaptationResult runCycle() {
        if (!inFlight.compareAndSet(false, true)) {
            log.info("🧬 ADAPT SKIP: cycle already running");
            Strategy s = holder.current();
            return AdaptationResult.builder()
                    .applied(false)
                    .reason("adaptation cycle already running")
                    .fromVersion(s.version())
                    .toVersion(s.version())
                    .changes(List.of())
                    .dropped(List.of())
                    .performanceScore(StrategyRecommendation.NEUTRAL_SCORE)
                    .build();
        }

        long started = System.currentTimeMillis();
        try {
            Strategy before = holder.current();
            log.info("🧬 ADAPT START v{}", before.version());

            // 1. метрики
            MetricsSnapshot metrics = metricsCollector.collect();

            // 2. рекомендация
            StrategyRecommendation rec = advisor.recommend(metrics, before);

            // 3. проверка каждого кортежа
            List<String> dropped = new ArrayList<>();
            Map<String, RecommendationTuple> accepted = new LinkedHashMap<>();
            Map<String, Object> values = new LinkedHashMap<>();

            for (RecommendationTuple t : rec.recommendations()) {
                ValidatedParam v = ParamSpaceValidator.validate(t.parameter(), t.suggestedValue());
                if (!v.allowed()) {
                    log.warn("🧬 ADAPT DROP param={} value={} reason={}",
                            t.parameter(), shrink(t.suggestedValue()), v.reason());
                    dropped.add(t.parameter() + ": " + v.reason());
                    continue;
                }
                // более поздний кортеж по тому же параметру побеждает
                accepted.remove(v.name());
                values.remove(v.name());
                accepted.put(v.name(), t);
                values.put(v.name(), v.value());
            }

            StrategyParameters next = before.parameters();
            List<ParameterChange> changes = new ArrayList<>();
            for (Map.Entry<String, Object> e : values.entrySet()) {
                Object old = next.get(e.getKey());
                if (Objects.equals(old, e.getValue())) {
                    log.info("🧬 ADAPT no-op param={} value={}", e.getKey(), old);
                    continue;
                }
                changes.add(new ParameterChange(e.getKey(), old, e.getValue(), accepted.get(e.getKey()).reason()));
                next = next.with(e.getKey(), e.getValue());
            }

            // 4. новая версия
            Strategy after = before;
            if (!changes.isEmpty()) {
                AdaptationRecord record = AdaptationRecord.builder()
                        .fromVersion(before.version())
                        .toVersion(before.version() + 1)
                        .changes(List.copyOf(changes))
                        .metrics(metrics)
                        .performanceScore(rec.performanceScore())
                        .summary(rec.summary())
                        .createdAt(clock.instant())
                        .build();

                // сначала в БД: если сохранение упало, живая стратегия не меняется
                repo.save(toEntity(record, next));
                after = holder.apply(next, record);
            }

            // 5. журнал + леджер, независимо от того, было ли изменение
            String actionId = null;
            String sig = null;
            try {
                Optional<ActionRecord> logged = journal.record(ActionDraft.builder()
                        .type(ActionType.SELF_IMPROVEMENT)
                        .summary(changes.isEmpty()
                                ? "Strategy v" + before.version() + " kept (score " + rec.performanceScore() + ")"
                                : "Strategy v" + before.version() + " -> v" + after.version() + ": " + describe(changes))
                        .metadata(cycleMetadata(before, after, changes, dropped, rec))
                        .reasoning(rec.summary())
                        .outcome(ActionOutcome.SUCCESS)
                        .build());
                if (logged.isPresent()) {
                    actionId = logged.get().getActionId();
                    sig = ledgerCommit.commit(logged.get()).orElse(null);
                }
            } catch (RuntimeException ex) {
                log.error("🧬 ADAPT journal write failed (strategy kept at v{}): {}", after.version(), ex.getMessage());
            }

            log.info("🧬 ADAPT DONE v{} -> v{} applied={} dropped={} tookMs={}",
                    before.version(), after.version(), changes.size(), dropped.size(), System.currentTimeMillis() - started);

            return AdaptationResult.builder()
                    .applied(!changes.isEmpty())
                    .reason(changes.isEmpty()
                            ? (rec.fallback() ? rec.summary() : "no valid changes")
                            : "applied " + changes.size() + " change(s)")
                    .fromVersion(before.version())
                    .toVersion(after.version())
                    .changes(List.copyOf(changes))
                    .dropped(List.copyOf(dropped))
                    .performanceScore(rec.performanceScore())
                    .actionId(actionId)
                    .ledgerSignature(sig)
                    .build();

        } finally {
            inFlight.set(false);
        }
    }

    public boolean isRunning() {
        return inFlight.get();
    }

    // =====================================================
    // mapping
    // =====================================================

    private Map<String, Object> cycleMetadata(Strategy before,
                                              Strategy after,
                                              List<ParameterChange> changes,
                                              List<String> dropped,
                                              StrategyRecommendation rec) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("fromVersion", before.version());
        m.put("toVersion", after.version());
        m.put("changes", changes.stream().map(c -> {
            Map<String, Object> x = new LinkedHashMap<>();
            x.put("name", c.name());
            x.put("old", c.oldValue());
            x.put("new", c.newValue());
            return x;
        }).toList());
        m.put("dropped", dropped.size());
        m.put("performanceScore", rec.performanceScore());
        m.put("fallback", rec.fallback());
        return m;
    }

    private AdaptationRecordEntity toEntity(AdaptationRecord r, StrategyParameters params) {
        return AdaptationRecordEntity.builder()
                .fromVersion(r.fromVersion())
                .toVersion(r.toVersion())
                .changesJson(write(r.changes()))
                .metricsJson(write(r.metrics()))
                .parametersJson(write(params.asMap()))
                .performanceScore(BigDecimal.valueOf(r.performanceScore()).setScale(2, RoundingMode.HALF_UP))
                .summary(r.summary())
                .createdAt(r.createdAt())
                .build();
    }

    private AdaptationRecord toRecord(AdaptationRecordEntity e) {
        List<ParameterChange> changes = read(e.getChangesJson(), new TypeReference<List<ParameterChange>>() {}, List.of());
        MetricsSnapshot metrics = read(e.getMetricsJson(), new TypeReference<MetricsSnapshot>() {}, null);
        return AdaptationRecord.builder()
                .fromVersion(e.getFromVersion())
                .toVersion(e.getToVersion())
                .changes(changes)
                .metrics(metrics)
                .performanceScore(e.getPerformanceScore() == null ? StrategyRecommendation.NEUTRAL_SCORE : e.getPerformanceScore().doubleValue())
                .summary(e.getSummary())
                .createdAt(e.getCreatedAt())
                .build();
    }

    private Map<String, Object> readMap(String json) {
        return read(json, new TypeReference<Map<String, Object>>() {}, Map.of());
    }

    private <T> T read(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) return fallback;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("🧬 stored adaptation json unreadable: {}", e.getOriginalMessage());
            return fallback;
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("adaptation json write failed: " + e.getOriginalMessage(), e);
        }
    }

    private static String describe(List<ParameterChange> changes) {
        StringBuilder sb = new StringBuilder();
        for (ParameterChange c : changes) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(c.name()).append(' ').append(c.oldValue()).append("->").append(c.newValue());
        }
        return sb.toString();
    }

    private static String shrink(Object v) {
        String s = String.valueOf(v);
        return s.length() <= 60 ? s : s.substring(0, 60) + "...";
    }
}
