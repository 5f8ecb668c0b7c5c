package com.chicu.agentpulse.ecosystem;

import lombok.Builder;

import java.time.Instant;

@Builder
public record ProjectSnapshot(
        long id,
        String name,
        String slug,
        String tagline,
        String description,
        String repoLink,
        String demoLink,
        String videoLink,
        int votes,
        Instant createdAt
) {
    public boolean hasRepo() {
        return notBlank(repoLink);
    }

    public boolean hasDemo() {
        return notBlank(demoLink);
    }

    public boolean hasVideo() {
        return notBlank(videoLink);
    }

    public int descriptionLength() {
        return description == null ? 0 : description.trim().length();
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
