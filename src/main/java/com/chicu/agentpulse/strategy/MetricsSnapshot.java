package com.chicu.agentpulse.strategy;

import lombok.Builder;

import java.time.Instant;

/**
 * Исходы за скользящее окно: вход для рекомендации по стратегии.
 */
@Builder
public record MetricsSnapshot(
        long windowHours,
        long actionsTaken,
        long failedActions,
        long postsPublished,
        long votesCast,
        long ledgerCommitments,
        int ownPostsObserved,
        double avgUpvotes,
        int maxUpvotes,
        double avgComments,
        Instant collectedAt
) {}
