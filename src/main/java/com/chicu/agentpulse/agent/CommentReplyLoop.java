package com.chicu.agentpulse.agent;

import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.common.retry.RateLimitedException;
import com.chicu.agentpulse.common.time.Sleeper;
import com.chicu.agentpulse.ecosystem.EcosystemClient;
import com.chicu.agentpulse.ecosystem.EcosystemProperties;
import com.chicu.agentpulse.ecosystem.ForumComment;
import com.chicu.agentpulse.ecosystem.ForumPostSnapshot;
import com.chicu.agentpulse.engagement.CommentWriter;
import com.chicu.agentpulse.engagement.EngagementProperties;
import com.chicu.agentpulse.engagement.reply.CommentFilter;
import com.chicu.agentpulse.engagement.reply.ReplyVerdict;
import com.chicu.agentpulse.engine.AgentLoop;
import com.chicu.agentpulse.engine.SchedulerProperties;
import com.chicu.agentpulse.journal.ActionCorrelation;
import com.chicu.agentpulse.journal.ActionDraft;
import com.chicu.agentpulse.journal.ActionJournalService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ответы на комментарии под своими постами. Лимит в час по журналу, на каждый комментарий не больше одного ответа.
 */
@Slf4j
@Component
public class CommentReplyLoop implements AgentLoop {

    public static final String NAME = "comment-reply";
    static final String SUBJECT_KIND = "comment";

    private final EcosystemClient ecosystem;
    private final CommentFilter filter;
    private final CommentWriter writer;
    private final ActionJournalService journal;
    private final SubjectActionRunner runner;
    private final EngagementProperties.Replies props;
    private final EcosystemProperties ecosystemProps;
    private final SchedulerProperties schedulerProps;
    private final Sleeper sleeper;

    public CommentReplyLoop(EcosystemClient ecosystem,
                            CommentFilter filter,
                            CommentWriter writer,
                            ActionJournalService journal,
                            SubjectActionRunner runner,
                            EngagementProperties engagementProps,
                            EcosystemProperties ecosystemProps,
                            SchedulerProperties schedulerProps,
                            Sleeper sleeper) {
        this.ecosystem = ecosystem;
        this.filter = filter;
        this.writer = writer;
        this.journal = journal;
        this.runner = runner;
        this.props = engagementProps.getReplies();
        this.ecosystemProps = ecosystemProps;
        this.schedulerProps = schedulerProps;
        this.sleeper = sleeper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ActionType actionType() {
        return ActionType.COMMENT_REPLY;
    }

    @Override
    public Duration interval() {
        return schedulerProps.getCommentReply();
    }

    @Override
    public int priority() {
        return 60;
    }

    @Override
    public void runIteration() throws InterruptedException {
        long lastHour = journal.countSuccessesWithin(ActionType.COMMENT_REPLY, Duration.ofHours(1));
        long budget = Math.min(props.getMaxPerCycle(), props.getMaxPerHour() - lastHour);
        if (budget <= 0) {
            log.info("💬 Replies SKIP: hourly cap reached ({}/{})", lastHour, props.getMaxPerHour());
            return;
        }

        List<ForumPostSnapshot> ownPosts = ecosystem.fetchOwnPosts(props.getOwnPostsToScan());
        int replied = 0;
        int skipped = 0;

        scan:
        for (int i = 0; i < ownPosts.size() && replied < budget; i++) {
            ForumPostSnapshot post = ownPosts.get(i);
            if (i > 0) {
                sleeper.sleep(props.getDelayBetweenPosts());
            }

            for (ForumComment c : ecosystem.fetchComments(post.id(), props.getCommentsPerPost())) {
                if (replied >= budget) break;
                if (c.deleted() || isOwn(c)) continue;

                String subjectKey = subjectKey(c.id());
                if (journal.existsSubject(subjectKey)) continue;

                ReplyVerdict verdict = filter.check(c);
                if (!verdict.respond()) {
                    log.debug("💬 Comment {} skipped: {}", c.id(), verdict.reason());
                    skipped++;
                    continue;
                }

                Optional<String> text = writer.replyTo(post, c);
                if (text.isEmpty()) continue;

                if (replied > 0) {
                    sleeper.sleep(props.getDelayBetweenReplies());
                }

                SubjectActionRunner.Attempt<Long> attempt = runner.run(ActionDraft.builder()
                                .type(ActionType.COMMENT_REPLY)
                                .subjectKey(subjectKey)
                                .summary("Replied to " + c.agentName() + " on '" + post.title() + "'")
                                .metadata(metadata(post, c, verdict))
                                .reasoning(text.get())
                                .build(),
                        () -> ecosystem.createComment(post.id(), text.get()));

                if (attempt.succeeded()) {
                    replied++;
                } else if (attempt.error() instanceof RateLimitedException) {
                    log.warn("💬 Replies: rate limited -> stop cycle");
                    break scan;
                }
            }
        }

        log.info("💬 Replies done: replied={} skipped={}", replied, skipped);
    }

    private boolean isOwn(ForumComment c) {
        String id = ecosystemProps.getAgentId();
        return (c.agentName() != null && c.agentName().equalsIgnoreCase(ecosystemProps.getAgentName()))
                || (id != null && !id.isBlank() && id.equals(c.agentId()));
    }

    private static Map<String, Object> metadata(ForumPostSnapshot post, ForumComment c, ReplyVerdict verdict) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("postId", post.id());
        meta.put("commentId", c.id());
        meta.put("commenter", c.agentName() == null ? "" : c.agentName());
        meta.put("reason", verdict.reason());
        return meta;
    }

    static String subjectKey(long commentId) {
        return ActionCorrelation.subjectKey(ActionType.COMMENT_REPLY, SUBJECT_KIND, String.valueOf(commentId));
    }
}
