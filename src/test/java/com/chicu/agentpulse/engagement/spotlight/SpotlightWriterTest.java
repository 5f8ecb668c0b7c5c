package com.chicu.agentpulse.engagement.spotlight;

import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import com.chicu.agentpulse.reasoning.ReasoningClient;
import com.chicu.agentpulse.reasoning.ReasoningUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpotlightWriterTest {

    @Mock
    ReasoningClient reasoning;

    private SpotlightWriter writer;

    private final ProjectSnapshot project = ProjectSnapshot.builder()
            .id(12)
            .name("ValidatorWatch")
            .tagline("Eyes on every validator")
            .description("Tracks validator uptime and alerts operators before slashing happens.")
            .demoLink("https://demo/12")
            .repoLink("https://github.com/x/12")
            .votes(8)
            .build();

    @BeforeEach
    void setUp() {
        writer = new SpotlightWriter(reasoning, new ObjectMapper());
    }

    @Test
    void modelReply_shouldFillEverySection() {
        when(reasoning.complete(anyString(), anyInt())).thenReturn("""
                {"whatTheyBuilt": "A validator monitor.", "whyInteresting": "Prevents slashing.",
                 "technicalApproach": "Polls RPC every slot.", "suggestion": "Add a public status page.",
                 "score": 9}
                """);

        SpotlightPost post = writer.write(project);

        assertFalse(post.fallback());
        assertEquals("🔦 Agent Spotlight: ValidatorWatch", post.title());
        assertEquals(9, post.rating());
        assertTrue(post.body().startsWith("> *Eyes on every validator*"));
        assertTrue(post.body().contains("## 🛠️ What They Built\n\nA validator monitor."));
        assertTrue(post.body().contains("- **Live Demo:** [Try it](https://demo/12)"));
        assertFalse(post.body().contains("Video Demo"));
        assertTrue(post.body().contains("Score: 9/10"));
        assertTrue(post.body().contains("Add a public status page."));
    }

    @Test
    void outOfRangeScore_shouldBeClamped() {
        when(reasoning.complete(anyString(), anyInt())).thenReturn("{\"score\": 15}");

        assertEquals(10, writer.write(project).rating());
    }

    @Test
    void unavailableModel_shouldFallBackToProjectData() {
        when(reasoning.complete(anyString(), anyInt())).thenThrow(new ReasoningUnavailableException("down"));

        SpotlightPost post = writer.write(project);

        assertTrue(post.fallback());
        assertEquals(SpotlightWriter.NEUTRAL_RATING, post.rating());
        assertTrue(post.body().contains("Tracks validator uptime"));
        assertTrue(post.body().contains("Keep building and share progress on the forum!"));
    }
}
