package com.chicu.agentpulse.agent;

import com.chicu.agentpulse.common.enums.ActionOutcome;
import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.common.time.Sleeper;
import com.chicu.agentpulse.common.time.UtcDay;
import com.chicu.agentpulse.decision.DecisionProperties;
import com.chicu.agentpulse.decision.evaluation.EvaluationService;
import com.chicu.agentpulse.decision.voting.ProjectEvaluation;
import com.chicu.agentpulse.decision.voting.ProjectScorer;
import com.chicu.agentpulse.ecosystem.EcosystemClient;
import com.chicu.agentpulse.ecosystem.EcosystemProperties;
import com.chicu.agentpulse.ecosystem.EcosystemSnapshotHolder;
import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import com.chicu.agentpulse.engine.AgentLoop;
import com.chicu.agentpulse.engine.SchedulerProperties;
import com.chicu.agentpulse.journal.ActionCorrelation;
import com.chicu.agentpulse.journal.ActionDraft;
import com.chicu.agentpulse.journal.ActionJournalService;
import com.chicu.agentpulse.journal.ActionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Оценка проектов и голосование.
 * Проект, по которому уже голосовали (ACTED), повторно не оценивается.
 */
@Slf4j
@Component
public class VotingLoop implements AgentLoop {

    public static final String NAME = "voting";
    static final String SUBJECT_KIND = "project";

    private final EcosystemSnapshotHolder snapshots;
    private final ProjectScorer scorer;
    private final EvaluationService evaluations;
    private final EcosystemClient ecosystem;
    private final ActionJournalService journal;
    private final SubjectActionRunner runner;
    private final DecisionProperties.Voting props;
    private final EcosystemProperties ecosystemProps;
    private final SchedulerProperties schedulerProps;
    private final Sleeper sleeper;
    private final Clock clock;

    public VotingLoop(EcosystemSnapshotHolder snapshots,
                      ProjectScorer scorer,
                      EvaluationService evaluations,
                      EcosystemClient ecosystem,
                      ActionJournalService journal,
                      SubjectActionRunner runner,
                      DecisionProperties decisionProps,
                      EcosystemProperties ecosystemProps,
                      SchedulerProperties schedulerProps,
                      Sleeper sleeper,
                      Clock clock) {
        this.snapshots = snapshots;
        this.scorer = scorer;
        this.evaluations = evaluations;
        this.ecosystem = ecosystem;
        this.journal = journal;
        this.runner = runner;
        this.props = decisionProps.getVoting();
        this.ecosystemProps = ecosystemProps;
        this.schedulerProps = schedulerProps;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ActionType actionType() {
        return ActionType.VOTE;
    }

    @Override
    public Duration interval() {
        return schedulerProps.getVoting();
    }

    @Override
    public int priority() {
        return 40;
    }

    @Override
    public void runIteration() throws InterruptedException {
        EcosystemSnapshotHolder.Snapshot snap = snapshots.current();
        if (snap.fetchedAt() == null) {
            log.info("🗳 Voting SKIP: no ecosystem data yet");
            return;
        }

        long votedToday = journal.countSuccessesSince(ActionType.VOTE, UtcDay.startOf(clock.instant()));
        long budget = props.getMaxVotesPerDay() - votedToday;
        if (budget <= 0) {
            log.info("🗳 Voting SKIP: daily cap reached ({}/{})", votedToday, props.getMaxVotesPerDay());
            return;
        }

        List<ProjectSnapshot> candidates = candidates(snap.projects());
        log.info("🗳 Voting: {} candidate(s), budget {}", candidates.size(), budget);

        int evaluated = 0;
        int voted = 0;
        for (ProjectSnapshot p : candidates) {
            if (voted >= budget) break;
            if (evaluated > 0) {
                sleeper.sleep(props.getDelayBetweenEvaluations());
            }
            evaluated++;
            if (process(p)) voted++;
        }

        log.info("🗳 Voting done: evaluated={} voted={}", evaluated, voted);
    }

    /**
     * Без своего проекта и без ACTED, полные проекты первыми.
     */
    List<ProjectSnapshot> candidates(List<ProjectSnapshot> projects) {
        Set<String> acted = evaluations.actedSubjectIds();
        Long own = ecosystemProps.getOwnProjectId();

        return projects.stream()
                .filter(p -> own == null || p.id() != own)
                .filter(p -> !acted.contains(subjectId(p)))
                .sorted(Comparator.comparingInt(VotingLoop::completeness).reversed()
                        .thenComparing(Comparator.comparingInt(ProjectSnapshot::descriptionLength).reversed()))
                .limit(props.getMaxEvaluationsPerCycle())
                .toList();
    }

    /**
     * @return true, если голос отдан
     */
    boolean process(ProjectSnapshot p) {
        String subjectId = subjectId(p);
        String subjectKey = ActionCorrelation.subjectKey(ActionType.VOTE, SUBJECT_KIND, subjectId);

        // ACTED мог появиться после построения списка (ручной запуск)
        if (evaluations.isActed(subjectId)) {
            log.info("🗳 Project {} already voted -> no-op", p.id());
            return false;
        }
        Optional<ActionRecord> prior = journal.findBySubject(subjectKey);
        if (prior.isPresent()) {
            // голос прошёл, а до ACTED итерация не дошла
            if (prior.get().getOutcome() == ActionOutcome.SUCCESS) {
                evaluations.markActed(subjectId, prior.get().getActionId());
            }
            log.info("🗳 Project {} already attempted ({}) -> no-op", p.id(), prior.get().getOutcome());
            return false;
        }

        ProjectEvaluation e = scorer.evaluate(p);
        evaluations.upsert(e);

        if (!e.act()) {
            return false;
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("projectId", p.id());
        meta.put("projectName", Objects.toString(p.name(), ""));
        meta.put("objectiveScore", e.objectiveScore());
        meta.put("modelScore", e.modelScore());
        meta.put("finalScore", e.finalScore());
        meta.put("threshold", e.threshold());
        meta.put("confidence", e.confidence());
        meta.put("strategyVersion", e.strategyVersion());

        SubjectActionRunner.Attempt<Void> attempt = runner.run(ActionDraft.builder()
                        .type(ActionType.VOTE)
                        .subjectKey(subjectKey)
                        .summary("Voted for " + p.name() + " (score " + e.finalScore() + ")")
                        .metadata(meta)
                        .reasoning(e.reasoning())
                        .build(),
                () -> {
                    ecosystem.voteForProject(p.id());
                    return null;
                },
                done -> evaluations.markActed(subjectId, done.getActionId()));

        if (!attempt.succeeded()) {
            return false;
        }
        log.info("🗳 Voted for {} '{}' final={}", p.id(), p.name(), e.finalScore());
        return true;
    }

    static String subjectId(ProjectSnapshot p) {
        return String.valueOf(p.id());
    }

    static int completeness(ProjectSnapshot p) {
        int c = 0;
        if (p.hasRepo()) c++;
        if (p.hasDemo()) c++;
        if (p.hasVideo()) c++;
        return c;
    }
}
