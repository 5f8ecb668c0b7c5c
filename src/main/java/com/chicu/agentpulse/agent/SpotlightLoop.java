package com.chicu.agentpulse.agent;

import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.common.time.UtcDay;
import com.chicu.agentpulse.ecosystem.EcosystemClient;
import com.chicu.agentpulse.ecosystem.EcosystemSnapshotHolder;
import com.chicu.agentpulse.ecosystem.NewForumPost;
import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import com.chicu.agentpulse.engagement.EngagementProperties;
import com.chicu.agentpulse.engagement.spotlight.SpotlightPost;
import com.chicu.agentpulse.engagement.spotlight.SpotlightSelector;
import com.chicu.agentpulse.engagement.spotlight.SpotlightWriter;
import com.chicu.agentpulse.engine.AgentLoop;
import com.chicu.agentpulse.engine.SchedulerProperties;
import com.chicu.agentpulse.journal.ActionCorrelation;
import com.chicu.agentpulse.journal.ActionDraft;
import com.chicu.agentpulse.journal.ActionJournalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Проект дня: не чаще одного в сутки UTC, каждый проект не больше одного раза.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpotlightLoop implements AgentLoop {

    public static final String NAME = "spotlight";
    static final String SUBJECT_KIND = "project";

    private final EcosystemSnapshotHolder snapshots;
    private final SpotlightSelector selector;
    private final SpotlightWriter writer;
    private final EcosystemClient ecosystem;
    private final ActionJournalService journal;
    private final SubjectActionRunner runner;
    private final EngagementProperties engagementProps;
    private final SchedulerProperties schedulerProps;
    private final Clock clock;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ActionType actionType() {
        return ActionType.SPOTLIGHT;
    }

    @Override
    public Duration interval() {
        return schedulerProps.getSpotlight();
    }

    @Override
    public int priority() {
        return 30;
    }

    @Override
    public void runIteration() {
        EcosystemSnapshotHolder.Snapshot snap = snapshots.current();
        if (snap.fetchedAt() == null) {
            log.info("🔦 Spotlight SKIP: no ecosystem data yet");
            return;
        }
        if (journal.countSuccessesSince(ActionType.SPOTLIGHT, UtcDay.startOf(clock.instant())) > 0) {
            log.info("🔦 Spotlight SKIP: already featured a project today");
            return;
        }

        Optional<SpotlightSelector.Pick> pick = selector.select(snap.projects(),
                id -> journal.existsSubject(subjectKey(id)));
        if (pick.isEmpty()) {
            return;
        }

        ProjectSnapshot p = pick.get().project();
        SpotlightPost post = writer.write(p);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("projectId", p.id());
        meta.put("projectName", Objects.toString(p.name(), ""));
        meta.put("selectionScore", pick.get().score());
        meta.put("rating", post.rating());
        meta.put("modelFallback", post.fallback());

        SubjectActionRunner.Attempt<Long> attempt = runner.run(ActionDraft.builder()
                        .type(ActionType.SPOTLIGHT)
                        .subjectKey(subjectKey(p.id()))
                        .summary(post.title())
                        .metadata(meta)
                        .reasoning(post.body())
                        .build(),
                () -> ecosystem.createPost(new NewForumPost(post.title(), post.body(),
                        engagementProps.getSpotlight().getTags())));

        if (attempt.succeeded()) {
            log.info("🔦 Spotlight posted: {} (score {}) postId={}", p.name(), pick.get().score(), attempt.value());
        }
    }

    static String subjectKey(long projectId) {
        return ActionCorrelation.subjectKey(ActionType.SPOTLIGHT, SUBJECT_KIND, String.valueOf(projectId));
    }
}
