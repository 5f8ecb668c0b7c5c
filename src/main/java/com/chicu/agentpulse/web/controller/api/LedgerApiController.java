package com.chicu.agentpulse.web.controller.api;

import com.chicu.agentpulse.ledger.LedgerClient;
import com.chicu.agentpulse.web.dto.WalletInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.OptionalLong;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/ledger")
public class LedgerApiController {

    private static final double LAMPORTS_PER_SOL = 1_000_000_000d;

    private final LedgerClient ledger;

    @GetMapping("/wallet")
    public WalletInfo wallet() {
        OptionalLong lamports = ledger.balanceLamports();
        return new WalletInfo(
                ledger.address().orElse(null),
                ledger.network(),
                ledger.canWrite(),
                lamports.isPresent() ? lamports.getAsLong() : null,
                lamports.isPresent() ? lamports.getAsLong() / LAMPORTS_PER_SOL : null,
                ledger.networkStatus()
        );
    }
}
