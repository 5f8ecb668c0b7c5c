package com.chicu.agentpulse.engagement.spotlight;

/**
 * @param rating оценка модели 1..10 (или нейтральная при fallback)
 */
public record SpotlightPost(
        String title,
        String body,
        int rating,
        boolean fallback
) {}
