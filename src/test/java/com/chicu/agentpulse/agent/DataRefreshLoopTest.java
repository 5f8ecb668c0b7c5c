package com.chicu.agentpulse.agent;

import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.ecosystem.EcosystemClient;
import com.chicu.agentpulse.ecosystem.EcosystemException;
import com.chicu.agentpulse.ecosystem.EcosystemProperties;
import com.chicu.agentpulse.ecosystem.EcosystemSnapshotHolder;
import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import com.chicu.agentpulse.engine.SchedulerProperties;
import com.chicu.agentpulse.journal.ActionDraft;
import com.chicu.agentpulse.journal.ActionJournalService;
import org.junit.jupiter.api.AfterEach;
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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DataRefreshLoopTest {

    @Mock private EcosystemClient ecosystem;
    @Mock private ActionJournalService journal;

    private final EcosystemSnapshotHolder snapshots = new EcosystemSnapshotHolder();
    private final Instant now = Instant.parse("2026-02-10T15:00:00Z");

    private DataRefreshLoop loop;

    @BeforeEach
    void setUp() {
        loop = new DataRefreshLoop(ecosystem, snapshots, new EcosystemProperties(), new SchedulerProperties(),
                journal, Clock.fixed(now, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        loop.shutdown();
    }

    @Test
    void successfulFetch_shouldReplaceSnapshotAndJournal() {
        when(ecosystem.fetchProjects()).thenReturn(List.of(
                ProjectSnapshot.builder().id(1).name("A").build(),
                ProjectSnapshot.builder().id(2).name("B").build()));
        when(ecosystem.fetchForumPosts(eq("new"), anyInt())).thenReturn(List.of());

        loop.runIteration();

        EcosystemSnapshotHolder.Snapshot snap = snapshots.current();
        assertEquals(2, snap.projects().size());
        assertEquals(now, snap.fetchedAt());

        ArgumentCaptor<ActionDraft> draft = ArgumentCaptor.forClass(ActionDraft.class);
        verify(journal).record(draft.capture());
        assertEquals(ActionType.DATA_REFRESH, draft.getValue().type());
        assertEquals("Refreshed 2 projects, 0 forum posts", draft.getValue().summary());
    }

    @Test
    void failedFetch_shouldKeepPreviousSnapshotAndSurfaceClientError() {
        snapshots.replace(List.of(ProjectSnapshot.builder().id(9).build()), List.of(), Instant.parse("2026-02-10T14:00:00Z"));
        when(ecosystem.fetchProjects()).thenThrow(new EcosystemException("HTTP 502", 502));
        lenient().when(ecosystem.fetchForumPosts(anyString(), anyInt())).thenReturn(List.of());

        assertThrows(EcosystemException.class, () -> loop.runIteration());

        assertEquals(9L, snapshots.current().projects().get(0).id());
        verifyNoInteractions(journal);
    }
}
