package com.chicu.agentpulse.strategy.space;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.Set;

@Builder
public record ParamSpaceItem(
        String name,
        ParamValueType type,
        BigDecimal min,
        BigDecimal max,
        Set<String> allowed   // только для ENUM, в нижнем регистре
) {}
