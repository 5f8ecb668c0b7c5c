package com.chicu.agentpulse.decision.voting;

import com.chicu.agentpulse.common.enums.Decision;
import com.chicu.agentpulse.decision.DecisionProperties;
import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import com.chicu.agentpulse.strategy.Strategy;
import com.chicu.agentpulse.strategy.StrategyHolder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * final = wObj * objective + wModel * model; ACT если final >= minVoteScore текущей стратегии.
 */
@Slf4j
@Component
public class ProjectScorer {

    private final ObjectiveScorer objectiveScorer;
    private final ModelScorer modelScorer;
    private final StrategyHolder strategy;
    private final DecisionProperties.Voting props;

    public ProjectScorer(ObjectiveScorer objectiveScorer,
                         ModelScorer modelScorer,
                         StrategyHolder strategy,
                         DecisionProperties props) {
        this.objectiveScorer = objectiveScorer;
        this.modelScorer = modelScorer;
        this.strategy = strategy;
        this.props = props.getVoting();
    }

    public ProjectEvaluation evaluate(ProjectSnapshot p) {
        ObjectiveScore obj = objectiveScorer.score(p);
        ModelScore model = modelScorer.score(p);

        // порог читаем после (медленного) вызова модели, а не до
        Strategy s = strategy.current();
        ProjectEvaluation e = decide(p, obj, model, s.parameters().minVoteScore(), s.version());

        log.info("⚖ Project {} '{}': obj={} model={} final={} threshold={} -> {}",
                p.id(), p.name(), e.objectiveScore(), e.modelScore(), e.finalScore(), e.threshold(), e.decision());
        return e;
    }

    public ProjectEvaluation decide(ProjectSnapshot p, ObjectiveScore obj, ModelScore model, double threshold, int strategyVersion) {
        BigDecimal objective = BigDecimal.valueOf(obj.total());
        BigDecimal modelAvg = BigDecimal.valueOf(model.average()).setScale(2, RoundingMode.HALF_UP);
        BigDecimal fin = objective.multiply(BigDecimal.valueOf(props.getObjectiveWeight()))
                .add(modelAvg.multiply(BigDecimal.valueOf(props.getModelWeight())))
                .setScale(2, RoundingMode.HALF_UP);

        double finalScore = fin.doubleValue();
        Decision d = fin.compareTo(BigDecimal.valueOf(threshold)) >= 0 ? Decision.ACT : Decision.SKIP;

        Map<String, Double> breakdown = new LinkedHashMap<>();
        obj.parts().forEach((k, v) -> breakdown.put("objective." + k, v));
        model.breakdown().forEach((k, v) -> breakdown.put("model." + k, v));

        return ProjectEvaluation.builder()
                .subjectId(String.valueOf(p.id()))
                .subjectName(p.name())
                .objectiveScore(obj.total())
                .modelScore(modelAvg.doubleValue())
                .finalScore(finalScore)
                .breakdown(breakdown)
                .reasoning(trace(p, obj, model, modelAvg.doubleValue(), finalScore, threshold, d))
                .decision(d)
                .confidence(confidence(finalScore))
                .threshold(threshold)
                .strategyVersion(strategyVersion)
                .modelFallback(model.fallback())
                .build();
    }

    static int confidence(double finalScore) {
        if (finalScore >= 8.0) return 95;
        if (finalScore >= 7.0) return 90;
        if (finalScore >= 6.5) return 85;
        if (finalScore >= 6.0) return 80;
        if (finalScore >= 5.5) return 75;
        if (finalScore >= 5.0) return 70;
        if (finalScore >= 4.0) return 65;
        return 60;
    }

    private String trace(ProjectSnapshot p,
                         ObjectiveScore obj,
                         ModelScore model,
                         double modelAvg,
                         double finalScore,
                         double threshold,
                         Decision d) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== VOTE DECISION FOR PROJECT #").append(p.id()).append(" ===\n");
        sb.append("Name: ").append(p.name()).append('\n');
        sb.append('\n');
        sb.append("1. OBJECTIVE (weight ").append(props.getObjectiveWeight()).append("): ").append(f1(obj.total())).append("/10\n");
        sb.append("   demo/live: ").append(p.hasDemo() ? "yes" : "no").append(" (+").append(obj.parts().get("demo")).append(")\n");
        sb.append("   repository: ").append(p.hasRepo() ? "yes" : "no").append(" (+").append(obj.parts().get("repo")).append(")\n");
        sb.append("   video: ").append(p.hasVideo() ? "yes" : "no").append(" (+").append(obj.parts().get("video")).append(")\n");
        sb.append("   description: ").append(obj.descriptionTier()).append(" (+").append(obj.parts().get("description")).append(")\n");
        sb.append('\n');
        sb.append("2. MODEL (weight ").append(props.getModelWeight()).append("): ").append(f1(modelAvg)).append("/10")
                .append(model.fallback() ? " [neutral fallback]" : "").append('\n');
        model.breakdown().forEach((k, v) -> sb.append("   ").append(k).append(": ").append(f1(v)).append('\n'));
        if (model.reasoning() != null && !model.reasoning().isBlank()) {
            sb.append("   assessment: ").append(model.reasoning()).append('\n');
        }
        sb.append('\n');
        sb.append("3. FINAL: ").append(f1(obj.total())).append(" x ").append(props.getObjectiveWeight())
                .append(" + ").append(f1(modelAvg)).append(" x ").append(props.getModelWeight())
                .append(" = ").append(String.format(Locale.ROOT, "%.2f", finalScore)).append('\n');
        sb.append("   threshold: ").append(threshold).append('\n');
        sb.append('\n');
        sb.append("4. DECISION: ").append(d == Decision.ACT ? "VOTE" : "SKIP")
                .append(" (confidence ").append(confidence(finalScore)).append("%)");
        return sb.toString();
    }

    private static String f1(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }
}
