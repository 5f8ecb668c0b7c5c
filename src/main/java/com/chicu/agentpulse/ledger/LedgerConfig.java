package com.chicu.agentpulse.ledger;

import com.chicu.agentpulse.common.time.Sleeper;
import com.chicu.agentpulse.ledger.solana.SolanaLedgerClient;
import com.chicu.agentpulse.ledger.solana.SolanaRpcClient;
import com.chicu.agentpulse.ledger.solana.SolanaWallet;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfig {

    /**
     * Без ключа или с выключенным леджером агент продолжает работать, просто без proof'ов.
     */
    @Bean
    public LedgerClient ledgerClient(LedgerProperties props,
                                     OkHttpClient okHttpClient,
                                     ObjectMapper objectMapper,
                                     Clock clock) {
        if (!props.isEnabled()) {
            log.info("⛓ Ledger disabled (agentpulse.ledger.enabled=false)");
            return new DisabledLedgerClient(props.getNetwork(), "disabled by config");
        }
        if (props.getWalletPrivateKey() == null || props.getWalletPrivateKey().isBlank()) {
            log.warn("⛓ Ledger enabled but wallet key is missing -> disabled");
            return new DisabledLedgerClient(props.getNetwork(), "wallet key missing");
        }

        SolanaWallet wallet;
        try {
            wallet = SolanaWallet.fromSecret(props.getWalletPrivateKey());
        } catch (IllegalArgumentException e) {
            log.error("⛓ Ledger wallet key rejected -> disabled: {}", e.getMessage());
            return new DisabledLedgerClient(props.getNetwork(), "wallet key invalid");
        }

        return new SolanaLedgerClient(
                new SolanaRpcClient(okHttpClient, objectMapper, props),
                wallet,
                props,
                clock,
                Sleeper.threadSleep()
        );
    }
}
