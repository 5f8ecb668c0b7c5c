package com.chicu.agentpulse.ledger.solana;

import com.chicu.agentpulse.ledger.LedgerException;
import com.chicu.agentpulse.ledger.LedgerProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC к ноде Solana. Только те методы, которые нужны журналу действий.
 */
@Slf4j
public class SolanaRpcClient {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient http;
    private final ObjectMapper objectMapper;
    private final String rpcUrl;
    private final AtomicLong ids = new AtomicLong();

    public SolanaRpcClient(OkHttpClient baseClient, ObjectMapper objectMapper, LedgerProperties props) {
        this.http = baseClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(200, props.getConnectTimeoutMs())))
                .readTimeout(Duration.ofMillis(Math.max(500, props.getReadTimeoutMs())))
                .build();
        this.objectMapper = objectMapper;
        this.rpcUrl = props.getRpcUrl();
    }

    public long getBalance(String address) {
        return call("getBalance", address, Map.of("commitment", "confirmed"))
                .path("value").asLong();
    }

    public List<JsonNode> getSignaturesForAddress(String address, int limit) {
        JsonNode res = call("getSignaturesForAddress", address, Map.of("limit", Math.max(1, Math.min(limit, 1000))));
        List<JsonNode> out = new ArrayList<>();
        if (res != null && res.isArray()) res.forEach(out::add);
        return out;
    }

    /**
     * @return result или MissingNode, если транзакция не найдена
     */
    public JsonNode getTransaction(String signature) {
        Map<String, Object> cfg = new LinkedHashMap<>();
        cfg.put("encoding", "jsonParsed");
        cfg.put("commitment", "confirmed");
        cfg.put("maxSupportedTransactionVersion", 0);
        return call("getTransaction", signature, cfg);
    }

    public String getLatestBlockhash() {
        String hash = call("getLatestBlockhash", Map.of("commitment", "confirmed"))
                .path("value").path("blockhash").asText(null);
        if (hash == null || hash.isBlank()) throw new LedgerException("getLatestBlockhash: empty blockhash");
        return hash;
    }

    public String sendTransaction(String base64Tx) {
        Map<String, Object> cfg = new LinkedHashMap<>();
        cfg.put("encoding", "base64");
        cfg.put("preflightCommitment", "confirmed");
        String sig = call("sendTransaction", base64Tx, cfg).asText(null);
        if (sig == null || sig.isBlank()) throw new LedgerException("sendTransaction: empty signature");
        return sig;
    }

    /**
     * Статус одной подписи; MissingNode/null пока сеть её не видит.
     */
    public JsonNode getSignatureStatus(String signature) {
        return call("getSignatureStatuses", List.of(signature), Map.of("searchTransactionHistory", false))
                .path("value").path(0);
    }

    public long getSlot() {
        return call("getSlot").asLong();
    }

    public long getBlockHeight() {
        return call("getBlockHeight").asLong();
    }

    // =====================================================
    // transport
    // =====================================================

    private JsonNode call(String method, Object... params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("id", ids.incrementAndGet());
        body.put("method", method);
        body.put("params", params == null ? List.of() : List.of(params));

        try {
            Request req = new Request.Builder()
                    .url(rpcUrl)
                    .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                    .build();

            try (Response resp = http.newCall(req).execute()) {
                String respBody = resp.body() != null ? resp.body().string() : "";

                if (!resp.isSuccessful()) {
                    log.warn("⛓ RPC error: {} -> {} body={}", method, resp.code(), shrink(respBody));
                    throw new LedgerException("RPC " + method + " HTTP " + resp.code() + ": " + shrink(respBody));
                }

                JsonNode root = objectMapper.readTree(respBody);
                JsonNode err = root.path("error");
                if (!err.isMissingNode() && !err.isNull()) {
                    throw new LedgerException("RPC " + method + " error " + err.path("code").asText()
                            + ": " + shrink(err.path("message").asText()));
                }
                return root.path("result");
            }

        } catch (IOException e) {
            throw new LedgerException("RPC IO error: " + method + " -> " + e.getMessage(), e);
        }
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        if (x.length() <= 300) return x;
        return x.substring(0, 300) + "...";
    }
}
