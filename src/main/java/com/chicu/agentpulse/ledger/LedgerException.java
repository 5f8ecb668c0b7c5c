package com.chicu.agentpulse.ledger;

/**
 * RPC ошибка, таймаут подтверждения или ошибка подписи.
 * Коммит в леджер best-effort: вызывающий код это исключение не пробрасывает дальше цикла.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
