package com.chicu.agentpulse.decision.voting;

import com.chicu.agentpulse.decision.DecisionProperties;
import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Структурная полнота проекта, 0..10.
 */
@Component
public class ObjectiveScorer {

    public static final double MAX = 10.0;

    private final DecisionProperties.Voting props;

    public ObjectiveScorer(DecisionProperties props) {
        this.props = props.getVoting();
    }

    public ObjectiveScore score(ProjectSnapshot p) {
        Map<String, Double> parts = new LinkedHashMap<>();
        parts.put("demo", p.hasDemo() ? props.getDemoPoints() : 0.0);
        parts.put("repo", p.hasRepo() ? props.getRepoPoints() : 0.0);
        parts.put("video", p.hasVideo() ? props.getVideoPoints() : 0.0);

        DecisionProperties.DescriptionTier tier = descriptionTier(p.descriptionLength());
        double d = tier == null ? 0.0 : tier.getPoints();
        parts.put("description", d);

        double total = parts.values().stream().mapToDouble(Double::doubleValue).sum();
        return new ObjectiveScore(Math.min(MAX, Math.round(total * 10.0) / 10.0), parts,
                tier == null ? "none" : tier.getName());
    }

    /**
     * Самый высокий уровень, чей порог длина превышает. Пустое описание = без уровня.
     */
    private DecisionProperties.DescriptionTier descriptionTier(int len) {
        if (len <= 0) return null;
        return props.getDescriptionTiers().stream()
                .filter(t -> len > t.getMinLength())
                .max(Comparator.comparingInt(DecisionProperties.DescriptionTier::getMinLength))
                .orElse(null);
    }
}
