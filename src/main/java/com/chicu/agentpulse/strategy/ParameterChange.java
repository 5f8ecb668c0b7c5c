package com.chicu.agentpulse.strategy;

public record ParameterChange(
        String name,
        Object oldValue,
        Object newValue,
        String reason
) {}
