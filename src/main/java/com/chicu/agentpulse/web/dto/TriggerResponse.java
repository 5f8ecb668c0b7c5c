package com.chicu.agentpulse.web.dto;

import com.chicu.agentpulse.engine.LoopRunResult;

public record TriggerResponse(
        String loop,
        LoopRunResult result
) {}
