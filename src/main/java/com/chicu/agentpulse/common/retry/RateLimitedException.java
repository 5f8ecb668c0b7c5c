package com.chicu.agentpulse.common.retry;

/**
 * Внешний API ответил "слишком часто" (HTTP 429).
 * Единственная ошибка, которую {@link RetryPolicy} повторяет.
 */
public class RateLimitedException extends RuntimeException {

    public RateLimitedException(String message) {
        super(message);
    }
}
