package com.chicu.agentpulse.common.enums;

public enum Decision {
    ACT,
    SKIP
}
