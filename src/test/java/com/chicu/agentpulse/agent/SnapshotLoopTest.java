package com.chicu.agentpulse.agent;

import com.chicu.agentpulse.common.enums.ActionOutcome;
import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.decision.evaluation.EvaluationService;
import com.chicu.agentpulse.ecosystem.EcosystemSnapshotHolder;
import com.chicu.agentpulse.engine.SchedulerProperties;
import com.chicu.agentpulse.journal.ActionDraft;
import com.chicu.agentpulse.journal.ActionJournalService;
import com.chicu.agentpulse.journal.ActionRecord;
import com.chicu.agentpulse.ledger.LedgerCommitService;
import com.chicu.agentpulse.strategy.StrategyHolder;
import com.chicu.agentpulse.strategy.StrategyProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SnapshotLoopTest {

    @Mock private ActionJournalService journal;
    @Mock private EvaluationService evaluations;
    @Mock private LedgerCommitService ledgerCommit;

    @Test
    void snapshot_shouldAggregateTodayAndCommit() {
        Instant now = Instant.parse("2026-02-10T15:00:00Z");
        Instant dayStart = Instant.parse("2026-02-10T00:00:00Z");
        SnapshotLoop loop = new SnapshotLoop(journal, evaluations, new EcosystemSnapshotHolder(),
                new StrategyHolder(new StrategyProperties()), ledgerCommit, new SchedulerProperties(),
                Clock.fixed(now, ZoneOffset.UTC));

        ActionRecord rec = ActionRecord.builder()
                .actionId("9".repeat(32))
                .type(ActionType.DAILY_SNAPSHOT)
                .summary("Snapshot")
                .createdAt(now)
                .contentHash("2".repeat(64))
                .outcome(ActionOutcome.SUCCESS)
                .build();
        when(journal.countSince(dayStart)).thenReturn(12L);
        when(journal.countSuccessesSince(ActionType.VOTE, dayStart)).thenReturn(3L);
        when(journal.countSuccessesSince(ActionType.FORUM_POST, dayStart)).thenReturn(2L);
        when(journal.record(any(ActionDraft.class))).thenReturn(Optional.of(rec));

        loop.runIteration();

        ArgumentCaptor<ActionDraft> draft = ArgumentCaptor.forClass(ActionDraft.class);
        verify(journal).record(draft.capture());
        assertEquals(ActionType.DAILY_SNAPSHOT, draft.getValue().type());
        assertEquals("Snapshot: 12 actions today, 3 votes, 2 posts, strategy v1", draft.getValue().summary());
        assertEquals(1, draft.getValue().metadata().get("strategyVersion"));
        verify(ledgerCommit).commit(rec);
    }
}
