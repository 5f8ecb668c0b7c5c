package com.chicu.agentpulse.ledger;

public record LedgerNetworkStatus(
        String network,
        boolean reachable,
        Long slot,
        Long blockHeight,
        String error
) {
    public static LedgerNetworkStatus unreachable(String network, String error) {
        return new LedgerNetworkStatus(network, false, null, null, error);
    }
}
