package com.chicu.agentpulse.strategy;

import java.util.List;

public record StrategyRecommendation(
        String summary,
        List<RecommendationTuple> recommendations,
        double performanceScore,
        boolean fallback
) {
    public static final double NEUTRAL_SCORE = 5.0;

    public StrategyRecommendation {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public static StrategyRecommendation fallback(String why) {
        return new StrategyRecommendation("Analysis unavailable, keeping current strategy (" + why + ")",
                List.of(), NEUTRAL_SCORE, true);
    }
}
