package com.chicu.agentpulse.ledger;

import com.chicu.agentpulse.journal.ActionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Компактный JSON для memo: {"ns","t","s","h","ts"}.
 * <p>
 * Лимит — payloadMaxBytes в UTF-8. Если не влезает, режется только summary;
 * префикс хэша не трогаем никогда.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerPayloadCodec {

    // RPC отдаёт memo как "[<len>] <text>"
    private static final Pattern RPC_MEMO_PREFIX = Pattern.compile("^\\[\\d+]\\s*");

    private final ObjectMapper objectMapper;
    private final LedgerProperties props;

    public String encode(ActionRecord record) {
        if (record == null) throw new IllegalArgumentException("record is null");
        return encode(
                record.getType().name(),
                record.getSummary(),
                ActionHasher.prefix(record.getContentHash(), props.getHashPrefixLength()),
                record.getCreatedAt()
        );
    }

    public String encode(String type, String summary, String hashPrefix, Instant timestamp) {
        if (type == null || type.isBlank()) throw new IllegalArgumentException("type is blank");
        if (hashPrefix == null || hashPrefix.isBlank()) throw new IllegalArgumentException("hashPrefix is blank");

        String s = limitCodePoints(summary == null ? "" : summary.trim(), props.getSummaryMaxChars());
        String json = write(type, s, hashPrefix, timestamp);

        while (utf8Length(json) > props.getPayloadMaxBytes()) {
            if (s.isEmpty()) {
                throw new LedgerException("payload exceeds " + props.getPayloadMaxBytes()
                        + " bytes even with empty summary (type=" + type + ")");
            }
            int overflow = utf8Length(json) - props.getPayloadMaxBytes();
            s = dropTailBytes(s, overflow);
            json = write(type, s, hashPrefix, timestamp);
        }
        return json;
    }

    /**
     * Разбор memo. Чужие namespace, не-JSON и неполные записи -> empty.
     */
    public Optional<LedgerPayload> decode(String memo) {
        if (memo == null || memo.isBlank()) return Optional.empty();

        String text = RPC_MEMO_PREFIX.matcher(memo.trim()).replaceFirst("");
        if (!text.startsWith("{")) return Optional.empty();

        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("⛓ memo is not json: {}", e.getOriginalMessage());
            return Optional.empty();
        }

        if (node == null || !node.isObject()) return Optional.empty();
        if (!props.getNamespace().equals(node.path("ns").asText(null))) return Optional.empty();

        String type = node.path("t").asText(null);
        String hash = node.path("h").asText(null);
        if (type == null || type.isBlank() || hash == null || hash.isBlank()) return Optional.empty();

        return Optional.of(LedgerPayload.builder()
                .namespace(props.getNamespace())
                .type(type)
                .summary(node.path("s").asText(""))
                .hashPrefix(hash.toLowerCase())
                .timestamp(parseInstant(node.path("ts").asText(null)))
                .build());
    }

    // =====================================================
    // helpers
    // =====================================================

    private String write(String type, String summary, String hashPrefix, Instant ts) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ns", props.getNamespace());
        m.put("t", type);
        m.put("s", summary);
        m.put("h", hashPrefix);
        if (ts != null) m.put("ts", ActionHasher.normalizeTimestamp(ts).toString());
        try {
            return objectMapper.writeValueAsString(m);
        } catch (JsonProcessingException e) {
            throw new LedgerException("payload serialization failed: " + e.getOriginalMessage(), e);
        }
    }

    static String limitCodePoints(String s, int maxCodePoints) {
        if (maxCodePoints <= 0) return "";
        if (s.codePointCount(0, s.length()) <= maxCodePoints) return s;
        return s.substring(0, s.offsetByCodePoints(0, maxCodePoints));
    }

    /**
     * Срезает с конца целые code point'ы, пока не уберёт минимум {@code bytes} байт (хотя бы один символ).
     */
    static String dropTailBytes(String s, int bytes) {
        int end = s.length();
        int removed = 0;
        while (end > 0 && (removed < bytes || end == s.length())) {
            int cp = s.codePointBefore(end);
            end -= Character.charCount(cp);
            removed += utf8Length(new String(Character.toChars(cp)));
        }
        return s.substring(0, end);
    }

    static int utf8Length(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    private static Instant parseInstant(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
