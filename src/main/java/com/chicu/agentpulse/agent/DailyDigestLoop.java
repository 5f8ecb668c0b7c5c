package com.chicu.agentpulse.agent;

import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.ecosystem.EcosystemClient;
import com.chicu.agentpulse.ecosystem.EcosystemSnapshotHolder;
import com.chicu.agentpulse.ecosystem.NewForumPost;
import com.chicu.agentpulse.engagement.EngagementProperties;
import com.chicu.agentpulse.engagement.digest.Digest;
import com.chicu.agentpulse.engagement.digest.DigestComposer;
import com.chicu.agentpulse.engine.AgentLoop;
import com.chicu.agentpulse.engine.SchedulerProperties;
import com.chicu.agentpulse.journal.ActionCorrelation;
import com.chicu.agentpulse.journal.ActionDraft;
import com.chicu.agentpulse.journal.ActionJournalService;
import com.chicu.agentpulse.journal.ActionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Один дайджест на календарный день UTC. Рост голосов считается от прошлого дайджеста.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DailyDigestLoop implements AgentLoop {

    public static final String NAME = "daily-digest";
    static final String SUBJECT_KIND = "day";

    private final EcosystemSnapshotHolder snapshots;
    private final DigestComposer composer;
    private final EcosystemClient ecosystem;
    private final ActionJournalService journal;
    private final SubjectActionRunner runner;
    private final EngagementProperties engagementProps;
    private final SchedulerProperties schedulerProps;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ActionType actionType() {
        return ActionType.DAILY_DIGEST;
    }

    @Override
    public Duration interval() {
        return schedulerProps.getDailyDigest();
    }

    @Override
    public int priority() {
        return 25;
    }

    @Override
    public void runIteration() {
        EcosystemSnapshotHolder.Snapshot snap = snapshots.current();
        if (snap.fetchedAt() == null) {
            log.info("📰 Digest SKIP: no ecosystem data yet");
            return;
        }

        Instant now = clock.instant();
        String day = LocalDate.ofInstant(now, ZoneOffset.UTC).toString();
        String subjectKey = ActionCorrelation.subjectKey(ActionType.DAILY_DIGEST, SUBJECT_KIND, day);
        if (journal.existsSubject(subjectKey)) {
            log.info("📰 Digest for {} already attempted -> no-op", day);
            return;
        }

        Map<String, Integer> previousVotes = journal.latestSuccess(ActionType.DAILY_DIGEST)
                .map(this::votesOf)
                .orElse(null);

        Digest digest = composer.compose(snap.projects(), snap.forumPosts(), previousVotes, now);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("day", day);
        meta.put("stats", digest.stats());
        meta.put("votes", digest.votes());

        SubjectActionRunner.Attempt<Long> attempt = runner.run(ActionDraft.builder()
                        .type(ActionType.DAILY_DIGEST)
                        .subjectKey(subjectKey)
                        .summary(digest.title())
                        .metadata(meta)
                        .reasoning(digest.body())
                        .build(),
                () -> ecosystem.createPost(new NewForumPost(digest.title(), digest.body(),
                        engagementProps.getDigest().getTags())));

        if (attempt.succeeded()) {
            log.info("📰 Digest posted for {} postId={}", day, attempt.value());
        }
    }

    /**
     * Голоса из метаданных прошлого дайджеста. Битые метаданные = прошлого нет.
     */
    Map<String, Integer> votesOf(ActionRecord previous) {
        JsonNode votes;
        try {
            votes = objectMapper.readTree(previous.getMetadataJson()).path("votes");
        } catch (JsonProcessingException e) {
            log.warn("📰 Digest: previous metadata unreadable (action {}): {}",
                    previous.getActionId(), e.getOriginalMessage());
            return null;
        }
        if (!votes.isObject()) return null;

        Map<String, Integer> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = votes.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getValue().canConvertToInt()) {
                out.put(e.getKey(), e.getValue().intValue());
            }
        }
        return out;
    }
}
