package com.chicu.agentpulse.strategy;

import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.ecosystem.EcosystemProperties;
import com.chicu.agentpulse.ecosystem.EcosystemSnapshotHolder;
import com.chicu.agentpulse.ecosystem.ForumPostSnapshot;
import com.chicu.agentpulse.journal.ActionJournalService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Component
@RequiredArgsConstructor
public class MetricsCollector {

    private final ActionJournalService journal;
    private final EcosystemSnapshotHolder snapshots;
    private final EcosystemProperties ecosystemProps;
    private final StrategyProperties props;
    private final Clock clock;

    public MetricsSnapshot collect() {
        Instant now = clock.instant();
        Instant from = now.minus(props.getMetricsWindow());

        // вовлечённость своих постов — из последнего среза форума
        List<ForumPostSnapshot> own = snapshots.current().forumPosts().stream()
                .filter(p -> p.agentName() != null && p.agentName().equalsIgnoreCase(ecosystemProps.getAgentName()))
                .filter(p -> p.createdAt() == null || !p.createdAt().isBefore(from))
                .toList();

        double avgUp = own.stream().mapToInt(ForumPostSnapshot::upvotes).average().orElse(0);
        int maxUp = own.stream().mapToInt(ForumPostSnapshot::upvotes).max().orElse(0);
        double avgComments = own.stream().mapToInt(ForumPostSnapshot::commentCount).average().orElse(0);

        return MetricsSnapshot.builder()
                .windowHours(props.getMetricsWindow().toHours())
                .actionsTaken(journal.countSince(from))
                .failedActions(journal.countFailedSince(from))
                .postsPublished(journal.countSuccessesSince(ActionType.FORUM_POST, from))
                .votesCast(journal.countSuccessesSince(ActionType.VOTE, from))
                .ledgerCommitments(journal.countCommittedSince(from))
                .ownPostsObserved(own.size())
                .avgUpvotes(round1(avgUp))
                .maxUpvotes(maxUp)
                .avgComments(round1(avgComments))
                .collectedAt(now)
                .build();
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
