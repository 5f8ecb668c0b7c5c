package com.chicu.agentpulse.engine;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.*;

@Slf4j
@Service
public class SchedulerServiceImpl implements SchedulerService {

    /**
     * daemon=true, чтобы не держать JVM при остановке.
     */
    private final ScheduledExecutorService executor =
            Executors.newScheduledThreadPool(
                    Math.max(2, Runtime.getRuntime().availableProcessors()),
                    r -> {
                        Thread t = new Thread(r);
                        t.setDaemon(true);
                        t.setName("AgentLoop-" + t.getId());
                        return t;
                    }
            );

    /** key → future задачи */
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    /** key → время постановки */
    private final Map<String, Instant> startedAt = new ConcurrentHashMap<>();


    // ==============================================================
    // ▶️ SCHEDULE
    // ==============================================================
    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(String key, Runnable task, Duration initialDelay, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0 for '" + key + "'");
        }
        long delayMs = (initialDelay == null || initialDelay.isNegative()) ? 0 : initialDelay.toMillis();

        cancel(key);

        ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                task,
                delayMs,
                interval.toMillis(),
                TimeUnit.MILLISECONDS
        );

        tasks.put(key, future);
        startedAt.put(key, Instant.now());

        log.info("⏱ Scheduler: '{}' every {} (first in {})", key, interval, Duration.ofMillis(delayMs));
        return future;
    }


    // ==============================================================
    // ⏹ CANCEL
    // ==============================================================
    @Override
    public void cancel(String key) {
        ScheduledFuture<?> future = tasks.remove(key);

        if (future != null) {
            future.cancel(false);
            log.info("🛑 Scheduler: cancelled '{}'", key);
        }

        startedAt.remove(key);
    }


    // ==============================================================
    // ℹ STATUS
    // ==============================================================
    @Override
    public boolean isActive(String key) {
        ScheduledFuture<?> future = tasks.get(key);
        return future != null && !future.isCancelled() && !future.isDone();
    }

    @Override
    public Optional<Instant> getStartedAt(String key) {
        return Optional.ofNullable(startedAt.get(key));
    }


    // ==============================================================
    // 🛑 SHUTDOWN
    // ==============================================================
    @PreDestroy
    public void shutdown() {
        log.info("💤 Scheduler shutting down…");
        // текущие итерации не прерываем: shutdown, а не shutdownNow
        executor.shutdown();
    }
}
