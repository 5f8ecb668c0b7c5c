package com.chicu.agentpulse.ecosystem;

/**
 * Любой сбой API экосистемы, кроме 429 (для него {@link com.chicu.agentpulse.common.retry.RateLimitedException}).
 */
public class EcosystemException extends RuntimeException {

    private final int status;

    public EcosystemException(String message, int status) {
        super(message);
        this.status = status;
    }

    public EcosystemException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /**
     * HTTP код или -1 для IO ошибок.
     */
    public int getStatus() {
        return status;
    }
}
