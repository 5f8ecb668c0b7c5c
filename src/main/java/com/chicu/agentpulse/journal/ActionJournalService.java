package com.chicu.agentpulse.journal;

import com.chicu.agentpulse.common.enums.ActionOutcome;
import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.ledger.ActionHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only журнал автономных действий.
 * Записи никогда не удаляются; меняются только ledgerTxRef и outcome (один раз).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionJournalService {

    private static final int ERROR_MAX = 1000;

    private final ActionRecordRepository repo;
    private final ActionHasher hasher;
    private final Clock clock;

    /**
     * Создаёт запись. Если subjectKey уже занят — это повтор того же действия, возвращаем empty
     * и ничего не пишем.
     * <p>
     * Без @Transactional: нарушение уникальности должно откатить только save, а не весь вызов.
     */
    public Optional<ActionRecord> record(ActionDraft draft) {
        Objects.requireNonNull(draft, "draft");
        Objects.requireNonNull(draft.type(), "type");

        if (draft.subjectKey() != null && repo.existsBySubjectKey(draft.subjectKey())) {
            log.info("🧾 Journal: duplicate subject {} -> no-op", draft.subjectKey());
            return Optional.empty();
        }

        Instant createdAt = ActionHasher.normalizeTimestamp(clock.instant());
        String summary = ActionHasher.normalizeSummary(draft.summary());
        String metadataJson = hasher.canonicalMetadataJson(draft.metadata());
        // хэшируем то, что реально лежит в БД, чтобы verify() по записи сходился
        Map<String, Object> metadata = hasher.parseMetadata(metadataJson);

        ActionRecord e = ActionRecord.builder()
                .actionId(ActionCorrelation.newActionId())
                .subjectKey(draft.subjectKey())
                .type(draft.type())
                .summary(summary)
                .metadataJson(metadataJson)
                .reasoning(draft.reasoning())
                .createdAt(createdAt)
                .contentHash(hasher.hash(draft.type(), summary, createdAt, metadata))
                .outcome(draft.outcome() == null ? ActionOutcome.PENDING : draft.outcome())
                .errorMessage(shrink(draft.errorMessage()))
                .build();

        try {
            ActionRecord saved = repo.saveAndFlush(e);
            if (saved.getOutcome() == ActionOutcome.FAILED) {
                log.warn("🧾 Action: {} FAILED id={} err={}", saved.getType(), saved.getActionId(), safe(saved.getErrorMessage()));
            } else {
                log.debug("🧾 Action: {} {} id={} hash={}", saved.getType(), saved.getOutcome(),
                        saved.getActionId(), ActionHasher.prefix(saved.getContentHash()));
            }
            return Optional.of(saved);
        } catch (DataIntegrityViolationException dup) {
            // гонка двух итераций за один subjectKey: вторая — no-op
            log.info("🧾 Journal: concurrent duplicate subject {} -> no-op", draft.subjectKey());
            return Optional.empty();
        }
    }

    /**
     * Занимает subjectKey PENDING-записью до внешнего вызова.
     * empty: субъект уже занят, внешний вызов делать нельзя.
     */
    public Optional<ActionRecord> claim(ActionDraft draft) {
        Objects.requireNonNull(draft, "draft");
        if (draft.subjectKey() == null || draft.subjectKey().isBlank()) {
            throw new IllegalArgumentException("claim requires a subject key");
        }
        if (draft.outcome() != null && draft.outcome() != ActionOutcome.PENDING) {
            throw new IllegalArgumentException("claim must start PENDING, got " + draft.outcome());
        }
        return record(draft);
    }

    public ActionRecord recordFailure(ActionType type, String summary, Throwable error) {
        String msg = error == null ? "unknown error"
                : (error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        return recordFailure(type, summary, msg);
    }

    public ActionRecord recordFailure(ActionType type, String summary, String error) {
        return record(ActionDraft.builder()
                .type(type)
                .summary(summary)
                .metadata(Map.of("error", safe(error)))
                .outcome(ActionOutcome.FAILED)
                .errorMessage(error)
                .build())
                .orElseThrow(() -> new IllegalStateException("failure record without subject key must not be deduplicated"));
    }

    @Transactional
    public Optional<ActionRecord> attachLedgerRef(String actionId, String signature) {
        if (actionId == null || actionId.isBlank()) return Optional.empty();
        return repo.findByActionId(actionId).map(e -> {
            e.attachLedgerRef(signature, clock.instant());
            return repo.save(e);
        });
    }

    @Transactional
    public Optional<ActionRecord> resolveOutcome(String actionId, ActionOutcome outcome, String error) {
        if (actionId == null || actionId.isBlank()) return Optional.empty();
        return repo.findByActionId(actionId).map(e -> {
            e.resolveOutcome(outcome, shrink(error));
            return repo.save(e);
        });
    }

    // ==========================
    // чтение
    // ==========================

    public Optional<ActionRecord> findByActionId(String actionId) {
        return repo.findByActionId(actionId);
    }

    public Optional<ActionRecord> findBySubject(String subjectKey) {
        if (subjectKey == null || subjectKey.isBlank()) return Optional.empty();
        return repo.findBySubjectKey(subjectKey.trim());
    }

    public boolean existsSubject(String subjectKey) {
        return subjectKey != null && repo.existsBySubjectKey(subjectKey);
    }

    /**
     * Если префикс неоднозначен (теоретически), берём самую раннюю запись.
     */
    public Optional<ActionRecord> findByHashPrefix(String hashPrefix) {
        if (hashPrefix == null || hashPrefix.isBlank()) return Optional.empty();
        return repo.findByContentHashStartingWith(hashPrefix.trim().toLowerCase()).stream()
                .min((a, b) -> a.getCreatedAt().compareTo(b.getCreatedAt()));
    }

    public Optional<ActionRecord> latestSuccess(ActionType type) {
        return repo.findTopByTypeAndOutcomeOrderByCreatedAtDesc(type, ActionOutcome.SUCCESS);
    }

    public Optional<Instant> lastSuccessAt(ActionType type) {
        return latestSuccess(type).map(ActionRecord::getCreatedAt);
    }

    public List<ActionRecord> successesWithin(ActionType type, Duration window) {
        return repo.findByTypeAndOutcomeAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
                type, ActionOutcome.SUCCESS, clock.instant().minus(window));
    }

    public long countSuccessesWithin(ActionType type, Duration window) {
        return repo.countByTypeAndOutcomeAndCreatedAtGreaterThanEqual(type, ActionOutcome.SUCCESS, clock.instant().minus(window));
    }

    public long countAll() {
        return repo.count();
    }

    public long countCommitted() {
        return repo.countByLedgerTxRefIsNotNull();
    }

    public long countSince(Instant from) {
        return repo.countByCreatedAtGreaterThanEqual(from);
    }

    public long countFailedSince(Instant from) {
        return repo.countByOutcomeAndCreatedAtGreaterThanEqual(ActionOutcome.FAILED, from);
    }

    public long countSuccessesSince(ActionType type, Instant from) {
        return repo.countByTypeAndOutcomeAndCreatedAtGreaterThanEqual(type, ActionOutcome.SUCCESS, from);
    }

    public long countCommittedSince(Instant from) {
        return repo.countByLedgerTxRefIsNotNullAndCreatedAtGreaterThanEqual(from);
    }

    private static String shrink(String s) {
        if (s == null) return null;
        String x = s.trim();
        return x.length() > ERROR_MAX ? x.substring(0, ERROR_MAX) : x;
    }

    private static String safe(String s) {
        return (s == null || s.isBlank()) ? "—" : s;
    }
}
