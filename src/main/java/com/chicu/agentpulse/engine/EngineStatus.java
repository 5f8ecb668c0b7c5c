package com.chicu.agentpulse.engine;

import java.util.List;

public record EngineStatus(
        boolean running,
        List<LoopStatus> loops
) {}
