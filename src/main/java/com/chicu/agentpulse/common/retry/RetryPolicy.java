package com.chicu.agentpulse.common.retry;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Единая политика повторов для внешних вызовов, которые могут упереться в rate limit.
 * Повторяем только то, что подходит под {@code retryable}; остальное летит сразу.
 */
@Slf4j
public class RetryPolicy {

    private final int maxRetries;
    private final Duration backoff;
    private final Predicate<Throwable> retryable;

    public RetryPolicy(int maxRetries, Duration backoff, Predicate<Throwable> retryable) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.backoff = (backoff == null || backoff.isNegative()) ? Duration.ZERO : backoff;
        this.retryable = retryable;
    }

    public static RetryPolicy rateLimited(RetryProperties props) {
        return new RetryPolicy(props.getMaxRetries(), props.getBackoff(), RateLimitedException.class::isInstance);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public <T> T execute(String name, Supplier<T> call) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts())
                .waitDuration(backoff)
                .retryOnException(retryable)
                .failAfterMaxAttempts(false)
                .build();

        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(e ->
                log.warn("🔁 RETRY {} attempt={}/{} after={}ms : {}",
                        name, e.getNumberOfRetryAttempts(), maxRetries,
                        e.getWaitInterval().toMillis(),
                        e.getLastThrowable() != null ? e.getLastThrowable().getMessage() : "—"));

        return Retry.decorateSupplier(retry, call).get();
    }

    public void run(String name, Runnable call) {
        execute(name, () -> {
            call.run();
            return null;
        });
    }
}
