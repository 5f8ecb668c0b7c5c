package com.chicu.agentpulse.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class AnthropicReasoningClient implements ReasoningClient {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final String MESSAGES_PATH = "/messages";
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    private final OkHttpClient http;
    private final ObjectMapper objectMapper;
    private final ReasoningProperties props;

    public AnthropicReasoningClient(OkHttpClient baseClient, ObjectMapper objectMapper, ReasoningProperties props) {
        this.http = baseClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(200, props.getConnectTimeoutMs())))
                .readTimeout(Duration.ofMillis(Math.max(1000, props.getReadTimeoutMs())))
                .build();
        this.objectMapper = objectMapper;
        this.props = props;
    }

    @Override
    public String complete(String system, String prompt, int maxTokens) {
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            throw new ReasoningUnavailableException("reasoning api key is not configured");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", maxTokens > 0 ? maxTokens : props.getMaxTokens());
        if (system != null && !system.isBlank()) body.put("system", system);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));

        String url = props.getBaseUrl().replaceAll("/+$", "") + MESSAGES_PATH;
        long started = System.currentTimeMillis();

        try {
            Request req = new Request.Builder()
                    .url(url)
                    .header("x-api-key", props.getApiKey().trim())
                    .header("anthropic-version", ANTHROPIC_VERSION)
                    .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                    .build();

            try (Response resp = http.newCall(req).execute()) {
                String respBody = resp.body() != null ? resp.body().string() : "";

                if (!resp.isSuccessful()) {
                    log.warn("🧠 Reasoning error: POST {} -> {} body={}", MESSAGES_PATH, resp.code(), shrink(respBody));
                    throw new ReasoningUnavailableException("reasoning HTTP " + resp.code() + ": " + shrink(respBody));
                }

                String text = extractText(objectMapper.readTree(respBody));
                if (text.isBlank()) {
                    throw new ReasoningUnavailableException("reasoning returned empty content");
                }

                log.debug("🧠 Reasoning OK model={} tookMs={} chars={}",
                        props.getModel(), System.currentTimeMillis() - started, text.length());
                return text;
            }

        } catch (IOException e) {
            throw new ReasoningUnavailableException("reasoning IO error: " + e.getMessage(), e);
        }
    }

    private static String extractText(JsonNode root) {
        StringBuilder sb = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                sb.append(block.path("text").asText(""));
            }
        }
        return sb.toString().trim();
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        if (x.length() <= 400) return x;
        return x.substring(0, 400) + "...";
    }
}
