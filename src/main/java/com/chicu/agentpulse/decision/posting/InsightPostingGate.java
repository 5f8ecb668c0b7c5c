package com.chicu.agentpulse.decision.posting;

import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.common.time.UtcDay;
import com.chicu.agentpulse.decision.DecisionProperties;
import com.chicu.agentpulse.decision.gate.CheckResult;
import com.chicu.agentpulse.decision.gate.DecisionGate;
import com.chicu.agentpulse.decision.gate.GateCheck;
import com.chicu.agentpulse.decision.gate.GateVerdict;
import com.chicu.agentpulse.insight.InsightCandidate;
import com.chicu.agentpulse.journal.ActionJournalService;
import com.chicu.agentpulse.journal.ActionRecord;
import com.chicu.agentpulse.strategy.StrategyHolder;
import com.chicu.agentpulse.strategy.StrategyParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Чек-лист "публиковать ли инсайт": 8 проверок, порог = minQualityScore текущей стратегии.
 */
@Slf4j
@Component
public class InsightPostingGate {

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final ActionJournalService journal;
    private final StrategyHolder strategy;
    private final DecisionProperties.Posting props;
    private final Clock clock;
    private final DecisionGate<PostingContext> gate;

    public InsightPostingGate(ActionJournalService journal,
                              StrategyHolder strategy,
                              DecisionProperties props,
                              Clock clock) {
        this.journal = journal;
        this.strategy = strategy;
        this.props = props.getPosting();
        this.clock = clock;
        this.gate = new DecisionGate<>("Quality gate", List.of(
                GateCheck.of("hasData", this::hasData),
                GateCheck.of("isNovel", this::isNovel),
                GateCheck.of("isRelevant", this::isRelevant),
                GateCheck.of("answersQuestion", this::answersQuestion),
                GateCheck.of("providesAction", this::providesAction),
                GateCheck.of("notTooFrequent", this::notTooFrequent),
                GateCheck.of("underDailyLimit", this::underDailyLimit),
                GateCheck.of("engagementPotential", this::engagementPotential)
        ));
    }

    /**
     * Порог и дневной лимит читаются из стратегии в момент вызова.
     */
    public GateVerdict evaluate(InsightCandidate insight) {
        StrategyParameters p = strategy.parameters();
        Instant now = clock.instant();

        PostingContext ctx = PostingContext.builder()
                .insight(insight)
                .recentTitles(journal.successesWithin(ActionType.FORUM_POST, props.getNoveltyWindow()).stream()
                        .map(ActionRecord::getSummary)
                        .toList())
                .lastPostAt(journal.lastSuccessAt(ActionType.FORUM_POST).orElse(null))
                .postsToday(journal.countSuccessesSince(ActionType.FORUM_POST, UtcDay.startOf(now)))
                .maxDailyActions(p.maxDailyActions())
                .now(now)
                .build();

        GateVerdict v = evaluate(ctx, p.minQualityScore());
        log.info("⚖ Quality gate '{}': {}/{} (threshold {}) -> {}",
                insight.title(), v.passed(), v.total(), v.threshold(), v.decision());
        return v;
    }

    public GateVerdict evaluate(PostingContext ctx, int threshold) {
        return gate.evaluate(ctx, threshold);
    }

    public int checkCount() {
        return gate.size();
    }

    // =====================================================
    // checks
    // =====================================================

    CheckResult hasData(PostingContext c) {
        int n = c.insight().dataPoints();
        return CheckResult.of("hasData", n >= props.getMinDataPoints(),
                n + " data points (min " + props.getMinDataPoints() + ")");
    }

    CheckResult isNovel(PostingContext c) {
        double worst = 0.0;
        String closest = null;
        for (String t : c.recentTitles()) {
            double s = TextSimilarity.jaccard(c.insight().title(), t);
            if (s > worst) {
                worst = s;
                closest = t;
            }
        }
        boolean novel = worst <= props.getSimilarityCutoff();
        return CheckResult.of("isNovel", novel, novel
                ? "max similarity " + fmt(worst) + " vs " + c.recentTitles().size() + " recent titles"
                : "similar to '" + closest + "' (" + fmt(worst) + ")");
    }

    CheckResult isRelevant(PostingContext c) {
        double score = relevanceScore(c.insight());
        return CheckResult.of("isRelevant", score > props.getRelevanceThreshold(),
                "relevance " + fmt(score) + " (need > " + props.getRelevanceThreshold() + ")");
    }

    CheckResult answersQuestion(PostingContext c) {
        InsightCandidate i = c.insight();
        boolean ok = i.answersQuestion() || i.solvesIssue();
        return CheckResult.of("answersQuestion", ok, ok ? "answers a question / solves an issue" : "no question answered");
    }

    CheckResult providesAction(PostingContext c) {
        int n = c.insight().actionable().size();
        return CheckResult.of("providesAction", n > 0, n + " actionable recommendation(s)");
    }

    CheckResult notTooFrequent(PostingContext c) {
        if (c.lastPostAt() == null) return CheckResult.pass("notTooFrequent", "no previous post");
        Duration since = Duration.between(c.lastPostAt(), c.now());
        return CheckResult.of("notTooFrequent", since.compareTo(props.getMinInterval()) >= 0,
                since.toMinutes() + "m since last post (min " + props.getMinInterval().toMinutes() + "m)");
    }

    CheckResult underDailyLimit(PostingContext c) {
        return CheckResult.of("underDailyLimit", c.postsToday() < c.maxDailyActions(),
                c.postsToday() + "/" + c.maxDailyActions() + " posts today");
    }

    CheckResult engagementPotential(PostingContext c) {
        BigDecimal score = engagementScore(c.insight());
        return CheckResult.of("engagementPotential",
                score.compareTo(BigDecimal.valueOf(props.getEngagementThreshold())) > 0,
                "engagement " + score.toPlainString() + " (need > " + props.getEngagementThreshold() + ")");
    }

    // =====================================================
    // scores
    // =====================================================

    double relevanceScore(InsightCandidate i) {
        String text = ((i.title() == null ? "" : i.title()) + " " + (i.body() == null ? "" : i.body()))
                .toLowerCase(Locale.ROOT);
        BigDecimal score = BigDecimal.ZERO;
        for (String k : props.getRelevanceKeywords()) {
            if (text.contains(k.toLowerCase(Locale.ROOT))) score = score.add(BigDecimal.valueOf(props.getKeywordWeight()));
        }
        if (!i.tags().isEmpty()) score = score.add(BigDecimal.valueOf(props.getTagsBonus()));
        return score.min(BigDecimal.ONE).doubleValue();
    }

    /**
     * Десятичная арифметика: 0.2+0.2+0.2 ровно 0.6, т.е. НЕ больше порога.
     */
    static BigDecimal engagementScore(InsightCandidate i) {
        BigDecimal s = BigDecimal.ZERO;
        if (i.body() != null && DIGITS.matcher(i.body()).find()) s = s.add(new BigDecimal("0.2"));
        if (!i.examples().isEmpty()) s = s.add(new BigDecimal("0.2"));
        if (i.trending()) s = s.add(new BigDecimal("0.3"));
        String title = i.title() == null ? "" : i.title();
        if (title.contains("How to") || title.contains("Guide")) s = s.add(new BigDecimal("0.2"));
        if (i.hasVisualization()) s = s.add(new BigDecimal("0.1"));
        return s;
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
