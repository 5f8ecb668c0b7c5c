package com.chicu.agentpulse.common.enums;

import java.util.Locale;

/**
 * Типы автономных действий, попадающих в журнал.
 */
public enum ActionType {
    DATA_REFRESH,
    POST_DECISION,
    FORUM_POST,
    VOTE,
    SELF_IMPROVEMENT,
    DAILY_SNAPSHOT,
    DAILY_DIGEST,
    SPOTLIGHT,
    COMMENT_REPLY,
    FORUM_ENGAGEMENT;

    /**
     * Мягкий разбор значения из memo леджера: неизвестное -> null.
     */
    public static ActionType parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return ActionType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
