package com.chicu.agentpulse.ledger;

import java.time.Instant;

/**
 * Транзакция кошелька в том виде, в каком её отдаёт история подписей.
 * memo = null, если у транзакции нет memo-инструкции.
 */
public record LedgerTransaction(
        String signature,
        long slot,
        Instant blockTime,
        String memo,
        boolean failed
) {}
