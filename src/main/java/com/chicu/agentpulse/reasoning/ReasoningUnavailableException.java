package com.chicu.agentpulse.reasoning;

/**
 * Внешняя модель недоступна (сеть, HTTP, пустой ответ).
 * Каждый вызывающий подменяет результат своим нейтральным fallback'ом.
 */
public class ReasoningUnavailableException extends RuntimeException {

    public ReasoningUnavailableException(String message) {
        super(message);
    }

    public ReasoningUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
