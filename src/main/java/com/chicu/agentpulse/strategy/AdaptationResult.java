package com.chicu.agentpulse.strategy;

import lombok.Builder;

import java.util.List;

@Builder
public record AdaptationResult(
        boolean applied,                 // появилась ли новая версия
        String reason,
        int fromVersion,
        int toVersion,
        List<ParameterChange> changes,
        List<String> dropped,            // "param: причина"
        double performanceScore,
        String actionId,                 // SELF_IMPROVEMENT запись
        String ledgerSignature
) {}
