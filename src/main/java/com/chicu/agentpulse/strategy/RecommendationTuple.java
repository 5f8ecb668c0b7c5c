package com.chicu.agentpulse.strategy;

/**
 * Сырая рекомендация модели. suggestedValue — что угодно (строка, число, объект): недоверенный ввод.
 */
public record RecommendationTuple(
        String parameter,
        Object suggestedValue,
        String reason
) {}
