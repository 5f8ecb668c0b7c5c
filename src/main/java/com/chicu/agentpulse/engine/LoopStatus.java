package com.chicu.agentpulse.engine;

import lombok.Builder;

import java.time.Duration;
import java.time.Instant;

@Builder
public record LoopStatus(
        String name,
        Duration interval,
        int priority,
        boolean inFlight,
        boolean scheduled,
        Instant lastStartedAt,
        Instant lastFinishedAt,
        LoopRunResult lastResult,
        String lastError,
        long runs,
        long failures
) {}
