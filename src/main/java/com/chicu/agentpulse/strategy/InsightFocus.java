package com.chicu.agentpulse.strategy;

import java.util.Locale;

public enum InsightFocus {
    TRENDS,
    PREDICTIONS,
    COMMUNITY,
    TECHNICAL;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
