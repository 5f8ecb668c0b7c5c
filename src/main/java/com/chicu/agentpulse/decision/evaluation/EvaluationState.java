package com.chicu.agentpulse.decision.evaluation;

/**
 * UNEVALUATED = строки нет.
 */
public enum EvaluationState {
    EVALUATED,
    ACTED
}
