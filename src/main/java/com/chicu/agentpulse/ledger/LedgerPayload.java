package com.chicu.agentpulse.ledger;

import lombok.Builder;

import java.time.Instant;

/**
 * То, что реально лежит в memo транзакции.
 */
@Builder
public record LedgerPayload(
        String namespace,
        String type,
        String summary,
        String hashPrefix,
        Instant timestamp
) {}
