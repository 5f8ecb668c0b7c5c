package com.chicu.agentpulse.decision.voting;

import com.chicu.agentpulse.common.enums.Decision;
import lombok.Builder;

import java.util.Map;

/**
 * Результат одного прохода оценки проекта (ещё не сохранён).
 */
@Builder
public record ProjectEvaluation(
        String subjectId,
        String subjectName,
        double objectiveScore,
        double modelScore,
        double finalScore,
        Map<String, Double> breakdown,
        String reasoning,
        Decision decision,
        int confidence,          // проценты
        double threshold,
        int strategyVersion,
        boolean modelFallback
) {
    public boolean act() {
        return decision == Decision.ACT;
    }
}
