package com.chicu.agentpulse.decision.evaluation;

import com.chicu.agentpulse.decision.voting.ProjectEvaluation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationService {

    private final EvaluationRepository repo;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Upsert по subjectId. ACTED строка не перезаписывается и возвращается как есть.
     */
    @Transactional
    public EvaluationEntity upsert(ProjectEvaluation e) {
        EvaluationEntity row = repo.findBySubjectId(e.subjectId()).orElse(null);

        if (row != null && row.getState() == EvaluationState.ACTED) {
            log.info("⚖ Evaluation subject={} already ACTED -> kept", e.subjectId());
            return row;
        }
        if (row == null) {
            row = EvaluationEntity.builder()
                    .subjectId(e.subjectId())
                    .state(EvaluationState.EVALUATED)
                    .build();
        }

        row.setSubjectName(e.subjectName());
        row.setObjectiveScore(dec(e.objectiveScore()));
        row.setModelScore(dec(e.modelScore()));
        row.setFinalScore(dec(e.finalScore()));
        row.setBreakdownJson(write(e.breakdown()));
        row.setReasoning(e.reasoning());
        row.setDecision(e.decision());
        row.setThresholdUsed(dec(e.threshold()));
        row.setStrategyVersion(e.strategyVersion());
        row.setConfidence(e.confidence());
        row.setEvaluatedAt(clock.instant());

        return repo.save(row);
    }

    /**
     * EVALUATED -> ACTED. Повторный вызов — no-op (false).
     */
    @Transactional
    public boolean markActed(String subjectId, String actionId) {
        EvaluationEntity row = repo.findBySubjectId(subjectId)
                .orElseThrow(() -> new IllegalStateException("no evaluation for subject " + subjectId));

        if (row.getState() == EvaluationState.ACTED) return false;

        row.setState(EvaluationState.ACTED);
        row.setActedAt(clock.instant());
        row.setActionId(actionId);
        repo.save(row);
        return true;
    }

    public boolean isActed(String subjectId) {
        return repo.existsBySubjectIdAndState(subjectId, EvaluationState.ACTED);
    }

    public Set<String> actedSubjectIds() {
        return new HashSet<>(repo.findSubjectIdsByState(EvaluationState.ACTED));
    }

    public Optional<EvaluationEntity> find(String subjectId) {
        return repo.findBySubjectId(subjectId);
    }

    public long countActed() {
        return repo.countByState(EvaluationState.ACTED);
    }

    private String write(Object v) {
        try {
            return objectMapper.writeValueAsString(v);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("breakdown json write failed: " + ex.getOriginalMessage(), ex);
        }
    }

    private static BigDecimal dec(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP);
    }
}
