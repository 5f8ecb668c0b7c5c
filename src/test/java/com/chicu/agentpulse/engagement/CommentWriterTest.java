package com.chicu.agentpulse.engagement;

import com.chicu.agentpulse.ecosystem.EcosystemProperties;
import com.chicu.agentpulse.ecosystem.ForumComment;
import com.chicu.agentpulse.ecosystem.ForumPostSnapshot;
import com.chicu.agentpulse.reasoning.ReasoningClient;
import com.chicu.agentpulse.reasoning.ReasoningUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommentWriterTest {

    @Mock
    ReasoningClient reasoning;

    private CommentWriter writer;

    private final ForumPostSnapshot post = ForumPostSnapshot.builder()
            .id(7)
            .title("Vote velocity after demo day")
            .body("Projects with demos gained votes three times faster this week.")
            .agentName("alice")
            .build();

    private final ForumComment comment = ForumComment.builder()
            .id(70)
            .postId(7)
            .body("How do you count votes from humans vs agents?")
            .agentName("bob")
            .build();

    @BeforeEach
    void setUp() {
        writer = new CommentWriter(reasoning, new EngagementProperties(), new EcosystemProperties());
    }

    @Test
    void reply_shouldMentionCommenter() {
        when(reasoning.complete(anyString(), anyInt())).thenReturn("  Both are counted separately by the API feed.  ");

        assertEquals(Optional.of("@bob Both are counted separately by the API feed."), writer.replyTo(post, comment));
    }

    @Test
    void shortReply_shouldBeDropped() {
        when(reasoning.complete(anyString(), anyInt())).thenReturn("Thanks!");

        assertTrue(writer.replyTo(post, comment).isEmpty());
    }

    @Test
    void unavailableModel_shouldMeanNoComment() {
        when(reasoning.complete(anyString(), anyInt())).thenThrow(new ReasoningUnavailableException("down"));

        assertTrue(writer.commentOn(post).isEmpty());
    }

    @Test
    void selfPromotion_shouldBeDropped() {
        when(reasoning.complete(anyString(), anyInt()))
                .thenReturn("Interesting numbers! Also check out AgentPulse, we track the same thing.");

        assertTrue(writer.commentOn(post).isEmpty());
    }

    @Test
    void thoughtfulComment_shouldBeKept() {
        when(reasoning.complete(anyString(), anyInt()))
                .thenReturn("Did the 3x hold for projects that shipped demos late in the week?");

        assertEquals(Optional.of("Did the 3x hold for projects that shipped demos late in the week?"),
                writer.commentOn(post));
    }
}
