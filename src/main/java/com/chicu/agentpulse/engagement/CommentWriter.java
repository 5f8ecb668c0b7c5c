package com.chicu.agentpulse.engagement;

import com.chicu.agentpulse.ecosystem.EcosystemProperties;
import com.chicu.agentpulse.ecosystem.ForumComment;
import com.chicu.agentpulse.ecosystem.ForumPostSnapshot;
import com.chicu.agentpulse.reasoning.ReasoningClient;
import com.chicu.agentpulse.reasoning.ReasoningUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Тексты комментариев через модель. empty = не комментируем (модель недоступна или ответ не годится).
 */
@Slf4j
@Component
public class CommentWriter {

    private static final int MAX_TOKENS = 300;
    private static final int POST_EXCERPT = 1500;

    private final ReasoningClient reasoning;
    private final EngagementProperties props;
    private final String agentName;
    private final Pattern selfPromotion;

    public CommentWriter(ReasoningClient reasoning, EngagementProperties props, EcosystemProperties ecosystemProps) {
        this.reasoning = reasoning;
        this.props = props;
        this.agentName = ecosystemProps.getAgentName();
        String me = Pattern.quote(agentName);
        this.selfPromotion = Pattern.compile(
                "vote.*for.*" + me + "|check.*out.*" + me + "|" + me + ".*project", Pattern.CASE_INSENSITIVE);
    }

    /**
     * Ответ на комментарий под своим постом, уже с @упоминанием автора.
     */
    public Optional<String> replyTo(ForumPostSnapshot post, ForumComment comment) {
        String prompt = """
                You are %s, an autonomous analytics agent in a hackathon community.
                Someone commented on YOUR forum post titled: "%s"
                Commenter: %s

                Their comment:
                "%s"

                Write a brief, helpful reply (2-4 sentences). Answer questions, acknowledge their project
                if they mention it, be open to collaboration, end with something engaging.
                Do NOT agree to vote exchanges, do NOT be generic, do NOT use more than 2 emojis.

                Reply:
                """.formatted(agentName, post.title(), Objects.toString(comment.agentName(), "another agent"),
                comment.body());

        return complete(prompt, props.getReplies().getMinReplyLength())
                .map(text -> comment.agentName() == null ? text : "@" + comment.agentName() + " " + text);
    }

    /**
     * Комментарий к чужому посту. Самопродвижение отбрасывается.
     */
    public Optional<String> commentOn(ForumPostSnapshot post) {
        String body = post.body() == null ? "" : post.body();
        String prompt = """
                You are %s, an autonomous analytics agent in a hackathon community.
                You are reading a forum post by another agent and want to leave a thoughtful comment.

                POST TITLE: "%s"
                POST AUTHOR: %s
                POST BODY:
                %s

                Write a comment (2-4 sentences) that shows you read the post, adds value with a smart question
                or a relevant insight, and references concrete details from it.
                Do NOT open with generic praise, mention voting, promote yourself or link your project.

                Comment:
                """.formatted(agentName, post.title(), Objects.toString(post.agentName(), "unknown"),
                body.length() > POST_EXCERPT ? body.substring(0, POST_EXCERPT) : body);

        Optional<String> text = complete(prompt, props.getForum().getMinCommentLength());
        if (text.isPresent() && selfPromotion.matcher(text.get()).find()) {
            log.warn("💬 Comment for post {} is self-promotional -> dropped", post.id());
            return Optional.empty();
        }
        return text;
    }

    private Optional<String> complete(String prompt, int minLength) {
        String text;
        try {
            text = reasoning.complete(prompt, MAX_TOKENS);
        } catch (ReasoningUnavailableException e) {
            log.warn("💬 Comment: reasoning unavailable: {}", e.getMessage());
            return Optional.empty();
        }
        String t = text == null ? "" : text.trim();
        if (t.length() < minLength) {
            log.warn("💬 Comment: reply too short ({} chars) -> dropped", t.length());
            return Optional.empty();
        }
        return Optional.of(t);
    }
}
