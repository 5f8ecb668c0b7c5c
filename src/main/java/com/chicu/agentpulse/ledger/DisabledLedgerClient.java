package com.chicu.agentpulse.ledger;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Леджер выключен или нет ключа.
 * Чтение отдаёт пустоту, запись бросает — коммит-сервис это видит через canWrite() и просто пропускает.
 */
public class DisabledLedgerClient implements LedgerClient {

    private final String network;
    private final String reason;

    public DisabledLedgerClient(String network, String reason) {
        this.network = network;
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }

    @Override
    public boolean canWrite() {
        return false;
    }

    @Override
    public Optional<String> address() {
        return Optional.empty();
    }

    @Override
    public String network() {
        return network;
    }

    @Override
    public OptionalLong balanceLamports() {
        return OptionalLong.empty();
    }

    @Override
    public List<LedgerTransaction> recentTransactions(int limit) {
        return Collections.emptyList();
    }

    @Override
    public Optional<LedgerTransaction> transaction(String signature) {
        return Optional.empty();
    }

    @Override
    public String writeMemo(String memo) {
        throw new LedgerException("ledger disabled: " + reason);
    }

    @Override
    public LedgerNetworkStatus networkStatus() {
        return LedgerNetworkStatus.unreachable(network, "disabled: " + reason);
    }
}
