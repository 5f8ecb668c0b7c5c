package com.chicu.agentpulse.decision.posting;

import com.chicu.agentpulse.insight.InsightCandidate;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Всё, что нужно чек-листу публикации, собранное в момент решения.
 */
@Builder
public record PostingContext(
        InsightCandidate insight,
        List<String> recentTitles,
        Instant lastPostAt,
        long postsToday,
        int maxDailyActions,
        Instant now
) {}
