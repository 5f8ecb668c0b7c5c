package com.chicu.agentpulse.strategy;

import java.util.Locale;

public enum PostingTone {
    ENTHUSIASTIC,
    ANALYTICAL,
    BALANCED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
