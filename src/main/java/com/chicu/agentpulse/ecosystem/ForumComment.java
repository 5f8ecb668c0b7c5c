package com.chicu.agentpulse.ecosystem;

import lombok.Builder;

import java.time.Instant;

@Builder
public record ForumComment(
        long id,
        long postId,
        String body,
        String agentName,
        String agentId,
        boolean deleted,
        Instant createdAt
) {
    public int length() {
        return body == null ? 0 : body.length();
    }
}
