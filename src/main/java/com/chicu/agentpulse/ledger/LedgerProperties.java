package com.chicu.agentpulse.ledger;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "agentpulse.ledger")
public class LedgerProperties {

    /**
     * false -> DisabledLedgerClient: действия пишутся только в БД.
     */
    private boolean enabled = false;

    private String rpcUrl = "https://api.devnet.solana.com";

    /**
     * devnet / testnet / mainnet-beta (идёт в explorer ссылку).
     */
    private String network = "devnet";

    /**
     * base58 секретный ключ (64 байта) или JSON-массив из solana-keygen.
     * Только из env, в логи не попадает.
     */
    private String walletPrivateKey = "";

    private String namespace = "agentpulse/v1";

    private int payloadMaxBytes = 900;
    private int hashPrefixLength = 16;
    private int summaryMaxChars = 200;

    private Duration confirmationTimeout = Duration.ofSeconds(60);
    private Duration confirmationPoll = Duration.ofSeconds(2);

    private int historyScanLimit = 200;

    private String explorerBaseUrl = "https://explorer.solana.com/tx/";

    private long connectTimeoutMs = 5000;
    private long readTimeoutMs = 20000;
}
