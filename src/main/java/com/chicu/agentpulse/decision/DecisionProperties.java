package com.chicu.agentpulse.decision;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Константы гейтов. Сам порог прохождения чек-листа и порог голоса живут в стратегии
 * (minQualityScore / minVoteScore), потому что их меняет адаптация.
 */
@Data
@ConfigurationProperties(prefix = "agentpulse.decision")
public class DecisionProperties {

    private Posting posting = new Posting();
    private Voting voting = new Voting();

    @Data
    public static class Posting {
        private int minDataPoints = 5;
        private Duration noveltyWindow = Duration.ofHours(48);
        /**
         * similarity > cutoff = дубль.
         */
        private double similarityCutoff = 0.8;
        private Duration minInterval = Duration.ofHours(1);
        private double relevanceThreshold = 0.7;
        private double keywordWeight = 0.15;
        private double tagsBonus = 0.2;
        private List<String> relevanceKeywords = new ArrayList<>(
                List.of("agent", "solana", "project", "team", "build", "hackathon"));
        private double engagementThreshold = 0.6;
    }

    @Data
    public static class Voting {
        private double repoPoints = 2.0;
        private double demoPoints = 3.0;
        private double videoPoints = 1.0;

        /**
         * Уровни описания: длина строго больше minLength -> points. Порядок не важен.
         */
        private List<DescriptionTier> descriptionTiers = new ArrayList<>(List.of(
                new DescriptionTier("excellent", 500, 2.5),
                new DescriptionTier("good", 300, 2.0),
                new DescriptionTier("fair", 150, 1.5),
                new DescriptionTier("minimal", 50, 0.5),
                new DescriptionTier("poor", 0, 0.2)));

        private double objectiveWeight = 0.4;
        private double modelWeight = 0.6;

        private double neutralSubScore = 5.0;

        private int maxVotesPerDay = 10;
        private int maxEvaluationsPerCycle = 25;
        private Duration delayBetweenEvaluations = Duration.ofSeconds(2);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DescriptionTier {
        private String name;
        private int minLength;
        private double points;
    }
}
