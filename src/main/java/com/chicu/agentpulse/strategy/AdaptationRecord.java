package com.chicu.agentpulse.strategy;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder
public record AdaptationRecord(
        int fromVersion,
        int toVersion,
        List<ParameterChange> changes,
        MetricsSnapshot metrics,
        double performanceScore,
        String summary,
        Instant createdAt
) {}
