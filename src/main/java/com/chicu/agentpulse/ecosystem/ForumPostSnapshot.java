package com.chicu.agentpulse.ecosystem;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder
public record ForumPostSnapshot(
        long id,
        String title,
        String body,
        String agentName,
        int upvotes,
        int commentCount,
        List<String> tags,
        Instant createdAt
) {}
