package com.chicu.agentpulse.engagement.spotlight;

import com.chicu.agentpulse.ecosystem.EcosystemProperties;
import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import com.chicu.agentpulse.engagement.EngagementProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SpotlightSelectorTest {

    private final EcosystemProperties ecosystemProps = new EcosystemProperties();
    private SpotlightSelector selector;

    @BeforeEach
    void setUp() {
        ecosystemProps.setOwnProjectId(244L);
        selector = new SpotlightSelector(new EngagementProperties(), ecosystemProps);
    }

    private static ProjectSnapshot project(long id, int descLen, boolean demo, boolean repo, int votes) {
        return ProjectSnapshot.builder()
                .id(id)
                .name("Project " + id)
                .description("x".repeat(descLen))
                .demoLink(demo ? "https://demo/" + id : null)
                .repoLink(repo ? "https://github.com/x/" + id : null)
                .votes(votes)
                .build();
    }

    @Test
    void score_shouldAddLinksDescriptionVotesAndTagline() {
        ProjectSnapshot full = ProjectSnapshot.builder()
                .id(1)
                .description("x".repeat(400))
                .demoLink("d").repoLink("r").videoLink("v")
                .votes(20)
                .tagline("Real-time validator analytics")
                .build();

        assertEquals(10, SpotlightSelector.score(full));
        assertEquals(2, SpotlightSelector.score(project(2, 60, false, true, 0)));
    }

    @Test
    void ineligibleProjects_shouldNeverBePicked() {
        List<ProjectSnapshot> projects = List.of(
                project(244, 500, true, true, 50),  // свой
                project(2, 40, true, true, 50),     // короткое описание
                project(3, 500, false, false, 50)); // ни демо, ни репо

        assertTrue(selector.select(projects, id -> false).isEmpty());
    }

    @Test
    void alreadyFeaturedProject_shouldBeSkipped() {
        List<ProjectSnapshot> projects = List.of(project(5, 500, true, true, 20), project(6, 200, false, true, 0));

        Optional<SpotlightSelector.Pick> pick = selector.select(projects, id -> id == 5);

        assertEquals(6, pick.orElseThrow().project().id());
    }

    @Test
    void tie_shouldGoToMoreVotesThenLowerId() {
        ProjectSnapshot a = project(9, 200, true, false, 6);
        ProjectSnapshot b = project(4, 200, true, false, 10);
        ProjectSnapshot c = project(3, 200, true, false, 10);

        assertEquals(SpotlightSelector.score(a), SpotlightSelector.score(b));
        assertEquals(3, selector.select(List.of(a, b, c), id -> false).orElseThrow().project().id());
    }
}
