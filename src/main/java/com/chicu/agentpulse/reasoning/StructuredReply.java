package com.chicu.agentpulse.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Достаёт первый JSON-блок из свободного текста модели.
 * Всё, что не разобралось, -> empty; вызывающий применяет свой fallback.
 */
@Slf4j
public final class StructuredReply {

    private StructuredReply() {}

    public static Optional<JsonNode> firstObject(ObjectMapper om, String text) {
        return first(om, text, '{', '}').filter(JsonNode::isObject);
    }

    public static Optional<JsonNode> firstArray(ObjectMapper om, String text) {
        return first(om, text, '[', ']').filter(JsonNode::isArray);
    }

    private static Optional<JsonNode> first(ObjectMapper om, String text, char open, char close) {
        if (text == null) return Optional.empty();

        int start = text.indexOf(open);
        while (start >= 0) {
            int end = matchingClose(text, start, open, close);
            if (end < 0) return Optional.empty();
            try {
                return Optional.ofNullable(om.readTree(text.substring(start, end + 1)));
            } catch (JsonProcessingException e) {
                log.debug("🧠 reply block at {} is not json: {}", start, e.getOriginalMessage());
                start = text.indexOf(open, start + 1);
            }
        }
        return Optional.empty();
    }

    /**
     * Баланс скобок с учётом строк и escape.
     */
    static int matchingClose(String s, int start, char open, char close) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (inString) {
                if (escaped) escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"') inString = false;
                continue;
            }
            if (c == '"') inString = true;
            else if (c == open) depth++;
            else if (c == close) {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }
}
