package com.chicu.agentpulse.common.enums;

public enum ActionOutcome {
    SUCCESS,
    FAILED,
    /**
     * Действие начато, итог ещё не известен.
     */
    PENDING
}
