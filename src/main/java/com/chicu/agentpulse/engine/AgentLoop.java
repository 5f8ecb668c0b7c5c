package com.chicu.agentpulse.engine;

import com.chicu.agentpulse.common.enums.ActionType;

import java.time.Duration;

/**
 * Независимо планируемый цикл агента.
 * Одна итерация = один проход gather -> decide -> act -> persist -> commit.
 */
public interface AgentLoop {

    String name();

    /**
     * Тип FAILED записи, если итерация упала.
     */
    ActionType actionType();

    Duration interval();

    /**
     * Больше = важнее. Самый приоритетный цикл start() прогоняет синхронно.
     */
    int priority();

    void runIteration() throws Exception;
}
