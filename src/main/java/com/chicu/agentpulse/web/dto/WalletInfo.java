package com.chicu.agentpulse.web.dto;

import com.chicu.agentpulse.ledger.LedgerNetworkStatus;

public record WalletInfo(
        String address,
        String network,
        boolean canWrite,
        Long balanceLamports,
        Double balanceSol,
        LedgerNetworkStatus status
) {}
