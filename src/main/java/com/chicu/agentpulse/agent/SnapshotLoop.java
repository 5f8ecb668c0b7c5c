package com.chicu.agentpulse.agent;

import com.chicu.agentpulse.common.enums.ActionOutcome;
import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.common.time.UtcDay;
import com.chicu.agentpulse.decision.evaluation.EvaluationService;
import com.chicu.agentpulse.ecosystem.EcosystemSnapshotHolder;
import com.chicu.agentpulse.engine.AgentLoop;
import com.chicu.agentpulse.engine.SchedulerProperties;
import com.chicu.agentpulse.journal.ActionDraft;
import com.chicu.agentpulse.journal.ActionJournalService;
import com.chicu.agentpulse.ledger.LedgerCommitService;
import com.chicu.agentpulse.strategy.Strategy;
import com.chicu.agentpulse.strategy.StrategyHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Периодический агрегат счётчиков, фиксируется в леджере.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotLoop implements AgentLoop {

    public static final String NAME = "snapshot";

    private final ActionJournalService journal;
    private final EvaluationService evaluations;
    private final EcosystemSnapshotHolder snapshots;
    private final StrategyHolder strategy;
    private final LedgerCommitService ledgerCommit;
    private final SchedulerProperties schedulerProps;
    private final Clock clock;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ActionType actionType() {
        return ActionType.DAILY_SNAPSHOT;
    }

    @Override
    public Duration interval() {
        return schedulerProps.getSnapshot();
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public void runIteration() {
        Instant dayStart = UtcDay.startOf(clock.instant());
        Strategy s = strategy.current();
        EcosystemSnapshotHolder.Snapshot snap = snapshots.current();

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("actionsTotal", journal.countAll());
        meta.put("actionsToday", journal.countSince(dayStart));
        meta.put("failedToday", journal.countFailedSince(dayStart));
        meta.put("postsToday", journal.countSuccessesSince(ActionType.FORUM_POST, dayStart));
        meta.put("votesToday", journal.countSuccessesSince(ActionType.VOTE, dayStart));
        meta.put("votesTotal", evaluations.countActed());
        meta.put("ledgerCommitted", journal.countCommitted());
        meta.put("ledgerCommittedToday", journal.countCommittedSince(dayStart));
        meta.put("strategyVersion", s.version());
        meta.put("projectsTracked", snap.projects().size());

        String summary = "Snapshot: " + meta.get("actionsToday") + " actions today, "
                + meta.get("votesToday") + " votes, " + meta.get("postsToday") + " posts, strategy v" + s.version();

        journal.record(ActionDraft.builder()
                        .type(ActionType.DAILY_SNAPSHOT)
                        .summary(summary)
                        .metadata(meta)
                        .outcome(ActionOutcome.SUCCESS)
                        .build())
                .ifPresent(ledgerCommit::commit);

        log.info("📊 {}", summary);
    }
}
