package com.chicu.agentpulse.ledger;

import lombok.Builder;

import java.util.Map;

@Builder
public record ProofStats(
        long totalActions,
        long committedActions,
        long uncommittedActions,
        int onLedgerProofs,
        int correlatedProofs,
        Map<String, Long> proofsByType
) {}
