package com.chicu.agentpulse.journal;

import com.chicu.agentpulse.common.enums.ActionOutcome;
import com.chicu.agentpulse.common.enums.ActionType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ActionRecordRepository extends JpaRepository<ActionRecord, Long> {

    Optional<ActionRecord> findByActionId(String actionId);

    Optional<ActionRecord> findBySubjectKey(String subjectKey);

    boolean existsBySubjectKey(String subjectKey);

    // ✅ склейка proof -> запись по префиксу хэша
    List<ActionRecord> findByContentHashStartingWith(String hashPrefix);

    Optional<ActionRecord> findTopByTypeAndOutcomeOrderByCreatedAtDesc(ActionType type, ActionOutcome outcome);

    List<ActionRecord> findByTypeAndOutcomeAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
            ActionType type,
            ActionOutcome outcome,
            Instant from
    );

    long countByCreatedAtGreaterThanEqual(Instant from);

    long countByOutcomeAndCreatedAtGreaterThanEqual(ActionOutcome outcome, Instant from);

    long countByTypeAndOutcomeAndCreatedAtGreaterThanEqual(ActionType type, ActionOutcome outcome, Instant from);

    long countByLedgerTxRefIsNotNullAndCreatedAtGreaterThanEqual(Instant from);

    long countByLedgerTxRefIsNotNull();
}
