package com.chicu.agentpulse.engine;

public enum LoopRunResult {
    RAN,
    SKIPPED_OVERLAP,
    SKIPPED_STOPPED,
    FAILED,
    UNKNOWN_LOOP
}
