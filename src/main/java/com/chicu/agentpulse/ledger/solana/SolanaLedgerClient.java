package com.chicu.agentpulse.ledger.solana;

import com.chicu.agentpulse.common.time.Sleeper;
import com.chicu.agentpulse.ledger.LedgerClient;
import com.chicu.agentpulse.ledger.LedgerException;
import com.chicu.agentpulse.ledger.LedgerNetworkStatus;
import com.chicu.agentpulse.ledger.LedgerProperties;
import com.chicu.agentpulse.ledger.LedgerTransaction;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

@Slf4j
public class SolanaLedgerClient implements LedgerClient {

    private final SolanaRpcClient rpc;
    private final SolanaWallet wallet;
    private final LedgerProperties props;
    private final Clock clock;
    private final Sleeper sleeper;

    public SolanaLedgerClient(SolanaRpcClient rpc,
                              SolanaWallet wallet,
                              LedgerProperties props,
                              Clock clock,
                              Sleeper sleeper) {
        this.rpc = rpc;
        this.wallet = wallet;
        this.props = props;
        this.clock = clock;
        this.sleeper = sleeper;
        log.info("⛓ Solana ledger: network={} wallet={}", props.getNetwork(), wallet.address());
    }

    @Override
    public boolean canWrite() {
        return true;
    }

    @Override
    public Optional<String> address() {
        return Optional.of(wallet.address());
    }

    @Override
    public String network() {
        return props.getNetwork();
    }

    @Override
    public OptionalLong balanceLamports() {
        return OptionalLong.of(rpc.getBalance(wallet.address()));
    }

    @Override
    public List<LedgerTransaction> recentTransactions(int limit) {
        List<LedgerTransaction> out = new ArrayList<>();
        for (JsonNode n : rpc.getSignaturesForAddress(wallet.address(), limit)) {
            out.add(new LedgerTransaction(
                    n.path("signature").asText(),
                    n.path("slot").asLong(),
                    blockTime(n.path("blockTime")),
                    textOrNull(n.path("memo")),
                    hasError(n.path("err"))
            ));
        }
        return out;
    }

    @Override
    public Optional<LedgerTransaction> transaction(String signature) {
        if (signature == null || signature.isBlank()) return Optional.empty();

        JsonNode tx = rpc.getTransaction(signature);
        if (tx == null || tx.isMissingNode() || tx.isNull()) return Optional.empty();

        return Optional.of(new LedgerTransaction(
                signature,
                tx.path("slot").asLong(),
                blockTime(tx.path("blockTime")),
                extractMemo(tx),
                hasError(tx.path("meta").path("err"))
        ));
    }

    @Override
    public String writeMemo(String memo) {
        byte[] data = memo.getBytes(StandardCharsets.UTF_8);
        if (data.length > props.getPayloadMaxBytes()) {
            throw new LedgerException("memo is " + data.length + " bytes, limit " + props.getPayloadMaxBytes());
        }

        byte[] blockhash = Base58.decode(rpc.getLatestBlockhash());
        byte[] tx = MemoTransactionBuilder.buildSigned(wallet, blockhash, data);
        String signature = rpc.sendTransaction(Base64.getEncoder().encodeToString(tx));

        awaitConfirmation(signature);
        return signature;
    }

    @Override
    public LedgerNetworkStatus networkStatus() {
        try {
            return new LedgerNetworkStatus(props.getNetwork(), true, rpc.getSlot(), rpc.getBlockHeight(), null);
        } catch (LedgerException e) {
            log.warn("⛓ network status unavailable: {}", e.getMessage());
            return LedgerNetworkStatus.unreachable(props.getNetwork(), e.getMessage());
        }
    }

    // =====================================================
    // confirmation
    // =====================================================

    private void awaitConfirmation(String signature) {
        Instant deadline = clock.instant().plus(props.getConfirmationTimeout());
        Duration poll = props.getConfirmationPoll();

        while (true) {
            JsonNode st = rpc.getSignatureStatus(signature);
            if (st != null && !st.isMissingNode() && !st.isNull()) {
                if (hasError(st.path("err"))) {
                    throw new LedgerException("transaction " + shortSig(signature) + " failed: " + st.path("err"));
                }
                String level = st.path("confirmationStatus").asText("");
                if ("confirmed".equals(level) || "finalized".equals(level)) {
                    log.debug("⛓ confirmed {} ({})", shortSig(signature), level);
                    return;
                }
            }

            if (!clock.instant().isBefore(deadline)) {
                throw new LedgerException("confirmation timeout for " + shortSig(signature)
                        + " after " + props.getConfirmationTimeout());
            }

            try {
                sleeper.sleep(poll);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new LedgerException("interrupted while waiting for " + shortSig(signature), ie);
            }
        }
    }

    // =====================================================
    // parsing
    // =====================================================

    private static String extractMemo(JsonNode tx) {
        JsonNode ixs = tx.path("transaction").path("message").path("instructions");
        if (!ixs.isArray()) return null;
        for (JsonNode ix : ixs) {
            boolean memoProgram = "spl-memo".equals(ix.path("program").asText())
                    || MemoTransactionBuilder.MEMO_PROGRAM_ID.equals(ix.path("programId").asText());
            if (memoProgram && ix.path("parsed").isTextual()) {
                return ix.path("parsed").asText();
            }
        }
        return null;
    }

    private static Instant blockTime(JsonNode n) {
        return n.isNumber() ? Instant.ofEpochSecond(n.asLong()) : null;
    }

    private static boolean hasError(JsonNode err) {
        return err != null && !err.isMissingNode() && !err.isNull();
    }

    private static String textOrNull(JsonNode n) {
        return (n == null || n.isMissingNode() || n.isNull()) ? null : n.asText();
    }

    static String shortSig(String sig) {
        if (sig == null) return "null";
        return sig.length() <= 16 ? sig : sig.substring(0, 16);
    }
}
