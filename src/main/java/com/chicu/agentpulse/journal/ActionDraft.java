package com.chicu.agentpulse.journal;

import com.chicu.agentpulse.common.enums.ActionOutcome;
import com.chicu.agentpulse.common.enums.ActionType;
import lombok.Builder;

import java.util.Map;

/**
 * То, что компонент знает о действии в момент попытки его выполнить.
 * Хэш, id и время проставляет {@link ActionJournalService}.
 */
@Builder
public record ActionDraft(
        ActionType type,
        String subjectKey,       // null = без дедупликации
        String summary,
        Map<String, Object> metadata,
        String reasoning,
        ActionOutcome outcome,   // null -> PENDING
        String errorMessage
) {}
