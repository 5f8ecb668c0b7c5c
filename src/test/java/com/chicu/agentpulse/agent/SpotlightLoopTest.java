package com.chicu.agentpulse.agent;

import com.chicu.agentpulse.common.enums.ActionOutcome;
import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.ecosystem.EcosystemClient;
import com.chicu.agentpulse.ecosystem.EcosystemException;
import com.chicu.agentpulse.ecosystem.EcosystemProperties;
import com.chicu.agentpulse.ecosystem.EcosystemSnapshotHolder;
import com.chicu.agentpulse.ecosystem.NewForumPost;
import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import com.chicu.agentpulse.engagement.EngagementProperties;
import com.chicu.agentpulse.engagement.spotlight.SpotlightPost;
import com.chicu.agentpulse.engagement.spotlight.SpotlightSelector;
import com.chicu.agentpulse.engagement.spotlight.SpotlightWriter;
import com.chicu.agentpulse.engine.SchedulerProperties;
import com.chicu.agentpulse.journal.ActionDraft;
import com.chicu.agentpulse.journal.ActionJournalService;
import com.chicu.agentpulse.journal.ActionRecord;
import com.chicu.agentpulse.ledger.LedgerCommitService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SpotlightLoopTest {

    @Mock private SpotlightWriter writer;
    @Mock private EcosystemClient ecosystem;
    @Mock private ActionJournalService journal;
    @Mock private LedgerCommitService ledgerCommit;

    private final EcosystemSnapshotHolder snapshots = new EcosystemSnapshotHolder();
    private final Clock clock = Clock.fixed(Instant.parse("2026-02-10T15:00:00Z"), ZoneOffset.UTC);

    private SpotlightLoop loop;

    @BeforeEach
    void setUp() {
        EcosystemProperties ecosystemProps = new EcosystemProperties();
        EngagementProperties engagementProps = new EngagementProperties();
        loop = new SpotlightLoop(snapshots, new SpotlightSelector(engagementProps, ecosystemProps), writer,
                ecosystem, journal, new SubjectActionRunner(journal, ledgerCommit),
                engagementProps, new SchedulerProperties(), clock);
    }

    private static ProjectSnapshot project(long id, int votes) {
        return ProjectSnapshot.builder()
                .id(id)
                .name("P" + id)
                .description("x".repeat(400))
                .demoLink("https://demo/" + id)
                .repoLink("https://github.com/x/" + id)
                .votes(votes)
                .build();
    }

    private static ActionRecord pending(String subjectKey) {
        return ActionRecord.builder()
                .actionId("s".repeat(32))
                .subjectKey(subjectKey)
                .type(ActionType.SPOTLIGHT)
                .summary("spotlight")
                .createdAt(Instant.parse("2026-02-10T15:00:00Z"))
                .contentHash("3".repeat(64))
                .outcome(ActionOutcome.PENDING)
                .build();
    }

    @Test
    void spotlightAlreadyPostedToday_shouldSkip() {
        snapshots.replace(List.of(project(5, 20)), List.of(), clock.instant());
        when(journal.countSuccessesSince(eq(ActionType.SPOTLIGHT), any())).thenReturn(1L);

        loop.runIteration();

        verifyNoInteractions(writer, ecosystem, ledgerCommit);
        verify(journal, never()).claim(any(ActionDraft.class));
    }

    @Test
    void bestProject_shouldBeClaimedUnderProjectSubjectAndPosted() {
        snapshots.replace(List.of(project(5, 20), project(6, 2)), List.of(), clock.instant());
        when(writer.write(any())).thenAnswer(inv -> {
            ProjectSnapshot p = inv.getArgument(0);
            return new SpotlightPost("🔦 Agent Spotlight: " + p.name(), "body", 8, false);
        });
        when(journal.claim(any(ActionDraft.class))).thenAnswer(inv -> Optional.of(pending("SPOTLIGHT:project:5")));
        when(ecosystem.createPost(any(NewForumPost.class))).thenReturn(77L);

        loop.runIteration();

        ArgumentCaptor<ActionDraft> draft = ArgumentCaptor.forClass(ActionDraft.class);
        verify(journal).claim(draft.capture());
        assertEquals("SPOTLIGHT:project:5", draft.getValue().subjectKey());
        assertEquals(5L, draft.getValue().metadata().get("projectId"));

        ArgumentCaptor<NewForumPost> post = ArgumentCaptor.forClass(NewForumPost.class);
        verify(ecosystem).createPost(post.capture());
        assertEquals("🔦 Agent Spotlight: P5", post.getValue().title());
        assertEquals(List.of("spotlight", "projects"), post.getValue().tags());
        verify(ledgerCommit).commit(any(ActionRecord.class));
    }

    @Test
    void featuredProject_shouldNeverBeFeaturedAgain() {
        snapshots.replace(List.of(project(5, 20), project(6, 2)), List.of(), clock.instant());
        when(journal.existsSubject(anyString())).thenAnswer(inv -> "SPOTLIGHT:project:5".equals(inv.getArgument(0)));
        when(writer.write(any())).thenReturn(new SpotlightPost("🔦 Agent Spotlight: P6", "body", 7, true));
        when(journal.claim(any(ActionDraft.class))).thenReturn(Optional.of(pending("SPOTLIGHT:project:6")));

        loop.runIteration();

        ArgumentCaptor<ProjectSnapshot> written = ArgumentCaptor.forClass(ProjectSnapshot.class);
        verify(writer).write(written.capture());
        assertEquals(6, written.getValue().id());
    }

    @Test
    void failedPost_shouldKeepSubjectTakenAndSkipLedger() {
        snapshots.replace(List.of(project(5, 20)), List.of(), clock.instant());
        when(writer.write(any())).thenReturn(new SpotlightPost("🔦 Agent Spotlight: P5", "body", 8, false));
        when(journal.claim(any(ActionDraft.class))).thenReturn(Optional.of(pending("SPOTLIGHT:project:5")));
        when(ecosystem.createPost(any(NewForumPost.class))).thenThrow(new EcosystemException("boom", 500));

        loop.runIteration();

        verify(journal).resolveOutcome("s".repeat(32), ActionOutcome.FAILED, "boom");
        verifyNoInteractions(ledgerCommit);
    }
}
