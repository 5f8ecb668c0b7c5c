package com.chicu.agentpulse.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Чистый планировщик задач по строковому ключу.
 * Ничего не знает про циклы агента: только крутит Runnable по таймеру.
 */
public interface SchedulerService {

    /**
     * Повторный вызов с тем же ключом отменяет прежнюю задачу.
     */
    ScheduledFuture<?> scheduleAtFixedRate(String key, Runnable task, Duration initialDelay, Duration interval);

    void cancel(String key);

    boolean isActive(String key);

    Optional<Instant> getStartedAt(String key);
}
