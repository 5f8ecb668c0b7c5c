package com.chicu.agentpulse.engagement.digest;

import java.util.Map;

/**
 * @param stats сводные цифры (уходят в метаданные действия)
 * @param votes projectId -> голоса на момент дайджеста; следующий дайджест считает по ним рост
 */
public record Digest(
        String title,
        String body,
        Map<String, Object> stats,
        Map<String, Integer> votes
) {}
