package com.chicu.agentpulse.engagement.reply;

import com.chicu.agentpulse.ecosystem.EcosystemProperties;
import com.chicu.agentpulse.ecosystem.ForumComment;
import com.chicu.agentpulse.engagement.EngagementProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Отвечать ли на комментарий под своим постом. Модель не зовём: только длина, спам-шаблоны и релевантность.
 */
@Component
public class CommentFilter {

    private static final Pattern RELEVANT =
            Pattern.compile("analytics|insight|data|track|monitor|dashboard|solana|agent", Pattern.CASE_INSENSITIVE);
    private static final int LOW_EFFORT_TEXT = 10;
    private static final int SUBSTANTIVE_LENGTH = 50;

    private final EngagementProperties.Replies props;
    private final List<Pattern> spam;
    private final Pattern mention;

    public CommentFilter(EngagementProperties engagementProps, EcosystemProperties ecosystemProps) {
        this.props = engagementProps.getReplies();
        this.spam = props.getSpamPatterns().stream().map(Pattern::compile).toList();
        this.mention = Pattern.compile("@?" + Pattern.quote(ecosystemProps.getAgentName()), Pattern.CASE_INSENSITIVE);
    }

    public ReplyVerdict check(ForumComment c) {
        String body = c.body() == null ? "" : c.body();

        if (body.length() < props.getMinCommentLength()) {
            return ReplyVerdict.skip("too_short");
        }
        for (Pattern p : spam) {
            if (p.matcher(body).find()) {
                return ReplyVerdict.skip("spam_pattern");
            }
        }
        // эмодзи и пунктуация не считаются
        if (body.replaceAll("[^\\w\\s]", "").trim().length() < LOW_EFFORT_TEXT) {
            return ReplyVerdict.skip("low_effort");
        }

        boolean question = body.contains("?");
        boolean substantive = body.length() > SUBSTANTIVE_LENGTH;
        boolean mentionsUs = mention.matcher(body).find();
        boolean relevant = RELEVANT.matcher(body).find();

        if (question || mentionsUs || (substantive && relevant)) {
            return ReplyVerdict.respond("relevant");
        }
        if (substantive) {
            return ReplyVerdict.respond("substantive");
        }
        return ReplyVerdict.skip("not_relevant");
    }
}
