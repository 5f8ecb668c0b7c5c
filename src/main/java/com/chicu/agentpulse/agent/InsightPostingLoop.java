package com.chicu.agentpulse.agent;

import com.chicu.agentpulse.common.enums.ActionOutcome;
import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.decision.gate.CheckResult;
import com.chicu.agentpulse.decision.gate.GateVerdict;
import com.chicu.agentpulse.decision.posting.InsightPostingGate;
import com.chicu.agentpulse.ecosystem.EcosystemClient;
import com.chicu.agentpulse.ecosystem.EcosystemSnapshotHolder;
import com.chicu.agentpulse.ecosystem.NewForumPost;
import com.chicu.agentpulse.engine.AgentLoop;
import com.chicu.agentpulse.engine.SchedulerProperties;
import com.chicu.agentpulse.insight.InsightCandidate;
import com.chicu.agentpulse.insight.InsightGenerator;
import com.chicu.agentpulse.journal.ActionCorrelation;
import com.chicu.agentpulse.journal.ActionDraft;
import com.chicu.agentpulse.journal.ActionJournalService;
import com.chicu.agentpulse.strategy.StrategyHolder;
import com.chicu.agentpulse.strategy.StrategyParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * generate -> gate -> POST_DECISION -> FORUM_POST (PENDING) -> post -> SUCCESS/FAILED -> ledger.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InsightPostingLoop implements AgentLoop {

    public static final String NAME = "insight-posting";
    static final String SUBJECT_KIND = "insight";

    private final EcosystemSnapshotHolder snapshots;
    private final InsightGenerator generator;
    private final InsightPostingGate gate;
    private final EcosystemClient ecosystem;
    private final ActionJournalService journal;
    private final SubjectActionRunner runner;
    private final StrategyHolder strategy;
    private final SchedulerProperties schedulerProps;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ActionType actionType() {
        return ActionType.FORUM_POST;
    }

    @Override
    public Duration interval() {
        return schedulerProps.getInsightPosting();
    }

    @Override
    public int priority() {
        return 50;
    }

    @Override
    public void runIteration() {
        EcosystemSnapshotHolder.Snapshot snap = snapshots.current();
        if (snap.fetchedAt() == null) {
            log.info("📝 Insight SKIP: no ecosystem data yet");
            return;
        }

        StrategyParameters params = strategy.parameters();
        List<InsightCandidate> candidates = generator.generate(snap, params);
        if (candidates.isEmpty()) {
            log.info("📝 Insight: nothing generated");
            return;
        }

        int posted = 0;
        for (InsightCandidate c : candidates) {
            if (process(c)) posted++;
        }
        log.info("📝 Insight cycle done: candidates={} posted={}", candidates.size(), posted);
    }

    /**
     * @return true, если пост опубликован
     */
    boolean process(InsightCandidate c) {
        String subjectKey = ActionCorrelation.subjectKey(ActionType.FORUM_POST, SUBJECT_KIND, c.key());
        if (journal.existsSubject(subjectKey)) {
            log.info("📝 Insight '{}' already posted -> no-op", c.title());
            return false;
        }

        // гейт читает стратегию заново: адаптация между кандидатами действует со следующего решения
        GateVerdict verdict = gate.evaluate(c);

        journal.record(ActionDraft.builder()
                .type(ActionType.POST_DECISION)
                .summary("Post decision '" + c.title() + "': " + verdict.decision()
                        + " " + verdict.passed() + "/" + verdict.total())
                .metadata(decisionMetadata(c, verdict))
                .reasoning(verdict.reasoning())
                .outcome(ActionOutcome.SUCCESS)
                .build());

        if (!verdict.accepted()) {
            return false;
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("insightKey", c.key());
        meta.put("insightType", c.type());
        meta.put("tags", c.tags());
        meta.put("gatePassed", verdict.passed());
        meta.put("gateTotal", verdict.total());

        SubjectActionRunner.Attempt<Long> attempt = runner.run(ActionDraft.builder()
                        .type(ActionType.FORUM_POST)
                        .subjectKey(subjectKey)
                        .summary(c.title())
                        .metadata(meta)
                        .reasoning(verdict.reasoning() + "\n\n" + c.body())
                        .build(),
                () -> ecosystem.createPost(new NewForumPost(c.title(), c.body(), c.tags())));

        if (!attempt.succeeded()) {
            return false;
        }
        log.info("📝 Posted '{}' postId={}", c.title(), attempt.value());
        return true;
    }

    private static Map<String, Object> decisionMetadata(InsightCandidate c, GateVerdict v) {
        Map<String, Object> checks = new LinkedHashMap<>();
        for (CheckResult r : v.checks()) {
            checks.put(r.name(), r.passed());
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("insightKey", c.key());
        meta.put("decision", v.decision().name());
        meta.put("passed", v.passed());
        meta.put("total", v.total());
        meta.put("threshold", v.threshold());
        meta.put("checks", checks);
        return meta;
    }
}
