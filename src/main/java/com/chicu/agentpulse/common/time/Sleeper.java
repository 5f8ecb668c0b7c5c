package com.chicu.agentpulse.common.time;

import java.time.Duration;

/**
 * Пауза между шагами (лимиты внешних API).
 * Отдельный интерфейс: в тестах не ждём.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return d -> {
            if (d == null || d.isZero() || d.isNegative()) return;
            Thread.sleep(d.toMillis());
        };
    }

    static Sleeper noop() {
        return d -> { };
    }
}
