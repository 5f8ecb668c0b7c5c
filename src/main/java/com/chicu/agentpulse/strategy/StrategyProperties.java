package com.chicu.agentpulse.strategy;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "agentpulse.strategy")
public class StrategyProperties {

    // ===== стартовые значения (v1) =====
    private PostingTone postingTone = PostingTone.ENTHUSIASTIC;
    private InsightFocus insightFocus = InsightFocus.TRENDS;
    private int minQualityScore = 6;
    private int maxDailyActions = 5;
    private int optimalHour = 9;
    private double minVoteScore = 5.5;

    /**
     * Сколько AdaptationRecord держать в памяти (в БД — все).
     */
    private int historyCap = 20;

    private Duration metricsWindow = Duration.ofHours(24);

    public StrategyParameters initialParameters() {
        return StrategyParameters.builder()
                .postingTone(postingTone)
                .insightFocus(insightFocus)
                .minQualityScore(minQualityScore)
                .maxDailyActions(maxDailyActions)
                .optimalHour(optimalHour)
                .minVoteScore(minVoteScore)
                .build();
    }
}
