package com.chicu.agentpulse.ledger;

import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.journal.ActionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Канонический хэш действия: SHA-256 над нормализованным {type, summary, timestamp, metadata}.
 * <p>
 * Один и тот же хэш используется для коммита в леджер (префикс) и для обратной склейки
 * proof -> полная запись с рассуждением.
 */
@Component
public class ActionHasher {

    public static final int DEFAULT_PREFIX_LENGTH = 16;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    // сортировка ключей на всех уровнях, иначе хэш зависит от порядка вставки
    private final ObjectMapper canonical = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public String hash(ActionType type, String summary, Instant timestamp, Map<String, Object> metadata) {
        return sha256(canonicalForm(type, summary, timestamp, metadata));
    }

    /**
     * Пересчёт по сохранённой записи (metadataJson уже канонический).
     */
    public String hash(ActionRecord record) {
        return hash(record.getType(), record.getSummary(), record.getCreatedAt(), parseMetadata(record.getMetadataJson()));
    }

    public boolean verify(ActionRecord record) {
        return record.getContentHash() != null && record.getContentHash().equals(hash(record));
    }

    public String canonicalForm(ActionType type, String summary, Instant timestamp, Map<String, Object> metadata) {
        if (type == null) throw new IllegalArgumentException("type is null");
        if (timestamp == null) throw new IllegalArgumentException("timestamp is null");

        Map<String, Object> root = new TreeMap<>();
        root.put("type", type.name());
        root.put("summary", normalizeSummary(summary));
        root.put("timestamp", normalizeTimestamp(timestamp).toString());
        root.put("metadata", metadata == null ? Collections.emptyMap() : metadata);
        return write(root);
    }

    public String canonicalMetadataJson(Map<String, Object> metadata) {
        return write(metadata == null ? Collections.emptyMap() : metadata);
    }

    public Map<String, Object> parseMetadata(String json) {
        if (json == null || json.isBlank()) return Collections.emptyMap();
        try {
            return canonical.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("metadata json is not a map: " + e.getOriginalMessage(), e);
        }
    }

    // =====================================================
    // normalization
    // =====================================================

    public static String normalizeSummary(String summary) {
        if (summary == null) return "";
        String s = summary.trim().replaceAll("\\s+", " ");
        if (s.length() <= ActionRecord.SUMMARY_MAX) return s;
        int end = ActionRecord.SUMMARY_MAX;
        // не режем суррогатную пару пополам
        if (Character.isHighSurrogate(s.charAt(end - 1))) end--;
        return s.substring(0, end);
    }

    public static Instant normalizeTimestamp(Instant ts) {
        return ts.truncatedTo(ChronoUnit.MILLIS);
    }

    public static String prefix(String hash, int length) {
        if (hash == null) return null;
        int n = Math.max(1, Math.min(length, hash.length()));
        return hash.substring(0, n);
    }

    public static String prefix(String hash) {
        return prefix(hash, DEFAULT_PREFIX_LENGTH);
    }

    private String write(Object value) {
        try {
            return canonical.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("metadata is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(dig);
        } catch (Exception e) {
            throw new IllegalStateException("sha256 error: " + e.getMessage(), e);
        }
    }
}
