package com.chicu.agentpulse.ledger;

import lombok.Builder;

import java.time.Instant;

/**
 * Реконструкция действия из леджера + локальной записи. Не хранится.
 * verified=true только если найдена соответствующая транзакция в леджере.
 */
@Builder
public record Proof(
        String ledgerTxSignature,
        String contentHashPrefix,
        String declaredType,
        String declaredSummary,
        Instant declaredAt,
        String actionId,
        String fullReasoning,
        boolean verified,
        String explorerUrl
) {}
