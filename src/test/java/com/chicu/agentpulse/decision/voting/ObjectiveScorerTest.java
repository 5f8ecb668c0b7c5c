package com.chicu.agentpulse.decision.voting;

import com.chicu.agentpulse.decision.DecisionProperties;
import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ObjectiveScorerTest {

    private final ObjectiveScorer scorer = new ObjectiveScorer(new DecisionProperties());

    @Test
    void completeProject_shouldScoreAllSignals() {
        ProjectSnapshot p = ProjectSnapshot.builder()
                .id(1)
                .repoLink("https://github.com/x/y")
                .demoLink("https://demo.example")
                .videoLink("https://youtu.be/z")
                .description("d".repeat(600))
                .build();

        ObjectiveScore s = scorer.score(p);

        // 3.0 + 2.0 + 1.0 + 2.5
        assertEquals(8.5, s.total(), 1e-9);
        assertEquals("excellent", s.descriptionTier());
        assertEquals(3.0, s.parts().get("demo"));
        assertEquals(2.0, s.parts().get("repo"));
        assertEquals(1.0, s.parts().get("video"));
    }

    @Test
    void descriptionTiers_shouldFollowLengthBoundaries() {
        assertEquals(2.0, descriptionPoints(301));
        assertEquals(1.5, descriptionPoints(300));
        assertEquals(1.5, descriptionPoints(151));
        assertEquals(0.5, descriptionPoints(150));
        assertEquals(0.5, descriptionPoints(51));
        assertEquals(0.2, descriptionPoints(50));
        assertEquals(0.2, descriptionPoints(1));
        assertEquals(0.0, descriptionPoints(0));
    }

    @Test
    void emptyProject_shouldScoreZero() {
        ObjectiveScore s = scorer.score(ProjectSnapshot.builder().id(2).repoLink("  ").build());

        assertEquals(0.0, s.total());
        assertEquals("none", s.descriptionTier());
    }

    @Test
    void total_shouldBeCappedAtTen() {
        DecisionProperties props = new DecisionProperties();
        props.getVoting().setDemoPoints(6.0);
        props.getVoting().setRepoPoints(4.0);
        ObjectiveScorer generous = new ObjectiveScorer(props);

        ProjectSnapshot p = ProjectSnapshot.builder()
                .id(3)
                .repoLink("r")
                .demoLink("d")
                .videoLink("v")
                .description("d".repeat(600))
                .build();

        assertEquals(ObjectiveScorer.MAX, generous.score(p).total());
    }

    @Test
    void configuredTiers_shouldReplaceDefaults() {
        DecisionProperties props = new DecisionProperties();
        props.getVoting().setDescriptionTiers(List.of(
                new DecisionProperties.DescriptionTier("short", 0, 1.0),
                new DecisionProperties.DescriptionTier("long", 100, 4.0)));
        ObjectiveScorer custom = new ObjectiveScorer(props);

        ObjectiveScore longDesc = custom.score(ProjectSnapshot.builder().id(4).description("x".repeat(101)).build());
        ObjectiveScore shortDesc = custom.score(ProjectSnapshot.builder().id(5).description("x".repeat(100)).build());

        assertEquals("long", longDesc.descriptionTier());
        assertEquals(4.0, longDesc.parts().get("description"));
        assertEquals("short", shortDesc.descriptionTier());
        assertEquals(1.0, shortDesc.total());
    }

    private double descriptionPoints(int len) {
        ProjectSnapshot p = ProjectSnapshot.builder().id(9).description("x".repeat(len)).build();
        return scorer.score(p).parts().get("description");
    }
}
