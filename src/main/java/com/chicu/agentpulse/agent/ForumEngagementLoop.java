package com.chicu.agentpulse.agent;

import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.common.retry.RateLimitedException;
import com.chicu.agentpulse.common.time.Sleeper;
import com.chicu.agentpulse.common.time.UtcDay;
import com.chicu.agentpulse.ecosystem.EcosystemClient;
import com.chicu.agentpulse.ecosystem.EcosystemProperties;
import com.chicu.agentpulse.ecosystem.ForumPostSnapshot;
import com.chicu.agentpulse.engagement.CommentWriter;
import com.chicu.agentpulse.engagement.EngagementProperties;
import com.chicu.agentpulse.engagement.forum.PostRanker;
import com.chicu.agentpulse.engine.AgentLoop;
import com.chicu.agentpulse.engine.SchedulerProperties;
import com.chicu.agentpulse.journal.ActionCorrelation;
import com.chicu.agentpulse.journal.ActionDraft;
import com.chicu.agentpulse.journal.ActionJournalService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Комментарии к чужим постам форума: дневной лимит, один комментарий на пост.
 */
@Slf4j
@Component
public class ForumEngagementLoop implements AgentLoop {

    public static final String NAME = "forum-engagement";
    static final String SUBJECT_KIND = "post";

    private final EcosystemClient ecosystem;
    private final PostRanker ranker;
    private final CommentWriter writer;
    private final ActionJournalService journal;
    private final SubjectActionRunner runner;
    private final EngagementProperties.Forum props;
    private final EcosystemProperties ecosystemProps;
    private final SchedulerProperties schedulerProps;
    private final Sleeper sleeper;
    private final Clock clock;

    public ForumEngagementLoop(EcosystemClient ecosystem,
                               PostRanker ranker,
                               CommentWriter writer,
                               ActionJournalService journal,
                               SubjectActionRunner runner,
                               EngagementProperties engagementProps,
                               EcosystemProperties ecosystemProps,
                               SchedulerProperties schedulerProps,
                               Sleeper sleeper,
                               Clock clock) {
        this.ecosystem = ecosystem;
        this.ranker = ranker;
        this.writer = writer;
        this.journal = journal;
        this.runner = runner;
        this.props = engagementProps.getForum();
        this.ecosystemProps = ecosystemProps;
        this.schedulerProps = schedulerProps;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ActionType actionType() {
        return ActionType.FORUM_ENGAGEMENT;
    }

    @Override
    public Duration interval() {
        return schedulerProps.getForumEngagement();
    }

    @Override
    public int priority() {
        return 35;
    }

    @Override
    public void runIteration() throws InterruptedException {
        Instant now = clock.instant();
        long today = journal.countSuccessesSince(ActionType.FORUM_ENGAGEMENT, UtcDay.startOf(now));
        long budget = Math.min(props.getMaxPerCycle(), props.getMaxPerDay() - today);
        if (budget <= 0) {
            log.info("🗣 Forum SKIP: daily cap reached ({}/{})", today, props.getMaxPerDay());
            return;
        }

        List<ForumPostSnapshot> candidates = ecosystem.fetchForumPosts("new", props.getPostsToScan()).stream()
                .filter(p -> !isOwn(p))
                .filter(p -> p.body() != null && p.body().length() >= props.getMinPostLength())
                .filter(p -> !journal.existsSubject(subjectKey(p.id())))
                .toList();

        List<PostRanker.Ranked> ranked = ranker.rank(candidates, now);
        log.info("🗣 Forum: {} candidate post(s), budget {}", ranked.size(), budget);

        int commented = 0;
        int attempted = 0;
        for (PostRanker.Ranked r : ranked) {
            if (commented >= budget) break;
            ForumPostSnapshot post = r.post();

            Optional<String> text = writer.commentOn(post);
            if (text.isEmpty()) continue;

            if (attempted > 0) {
                sleeper.sleep(props.getDelayBetweenComments());
            }
            attempted++;

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("postId", post.id());
            meta.put("postAuthor", post.agentName() == null ? "" : post.agentName());
            meta.put("rankScore", r.score());

            SubjectActionRunner.Attempt<Long> attempt = runner.run(ActionDraft.builder()
                            .type(ActionType.FORUM_ENGAGEMENT)
                            .subjectKey(subjectKey(post.id()))
                            .summary("Commented on '" + post.title() + "'")
                            .metadata(meta)
                            .reasoning(text.get())
                            .build(),
                    () -> ecosystem.createComment(post.id(), text.get()));

            if (attempt.succeeded()) {
                commented++;
            } else if (attempt.error() instanceof RateLimitedException) {
                log.warn("🗣 Forum: rate limited -> stop cycle");
                break;
            }
        }

        log.info("🗣 Forum done: commented={}", commented);
    }

    private boolean isOwn(ForumPostSnapshot p) {
        return p.agentName() != null && p.agentName().equalsIgnoreCase(ecosystemProps.getAgentName());
    }

    static String subjectKey(long postId) {
        return ActionCorrelation.subjectKey(ActionType.FORUM_ENGAGEMENT, SUBJECT_KIND, String.valueOf(postId));
    }
}
