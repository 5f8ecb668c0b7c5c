package com.chicu.agentpulse.reasoning;

/**
 * Генерация текста. Структурированные данные вызывающий сам достаёт из ответа через {@link StructuredReply}.
 */
public interface ReasoningClient {

    /**
     * @throws ReasoningUnavailableException при любом сбое транспорта
     */
    String complete(String system, String prompt, int maxTokens);

    default String complete(String prompt, int maxTokens) {
        return complete(null, prompt, maxTokens);
    }
}
