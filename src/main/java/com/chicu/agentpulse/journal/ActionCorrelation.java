package com.chicu.agentpulse.journal;

import com.chicu.agentpulse.common.enums.ActionType;
import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.UUID;

@UtilityClass
public class ActionCorrelation {

    /**
     * Базовый actionId (32 символа, lower hex, без '-').
     */
    public static String newActionId() {
        return UUID.randomUUID().toString()
                .replace("-", "")
                .toLowerCase(Locale.ROOT);
    }

    /**
     * Ключ субъекта для дедупликации: TYPE:kind:id.
     * Пример: VOTE:project:42
     */
    public static String subjectKey(ActionType type, String kind, String id) {
        if (type == null) throw new IllegalArgumentException("type is null");
        String k = normalize(kind);
        String i = normalize(id);
        if (i == null) throw new IllegalArgumentException("subject id is blank");
        return k == null
                ? type.name() + ":" + i
                : type.name() + ":" + k + ":" + i;
    }

    /**
     * Достаём id субъекта обратно: VOTE:project:42 -> 42.
     */
    public static String extractSubjectId(String subjectKey) {
        if (subjectKey == null) return null;
        String s = subjectKey.trim();
        if (s.isEmpty()) return null;
        int idx = s.lastIndexOf(':');
        return idx >= 0 && idx < s.length() - 1 ? s.substring(idx + 1) : s;
    }

    private static String normalize(String s) {
        if (s == null) return null;
        String x = s.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
        return x.isEmpty() ? null : x;
    }
}
