package com.chicu.agentpulse.engagement;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Общение с сообществом: дайджест, спотлайт, ответы на комментарии, комментарии к чужим постам.
 */
@Data
@ConfigurationProperties(prefix = "agentpulse.engagement")
public class EngagementProperties {

    private Digest digest = new Digest();
    private Spotlight spotlight = new Spotlight();
    private Replies replies = new Replies();
    private Forum forum = new Forum();

    @Data
    public static class Digest {
        private int risingStars = 5;
        private int hiddenGems = 3;
        /**
         * Кандидат в hidden gems: описание длиннее и голосов меньше.
         */
        private int gemMinDescription = 100;
        private int gemMaxVotes = 30;
        private int gemCandidatesForModel = 15;
        private int topAgents = 5;
        /**
         * Дедлайн хакатона для строки "N days remaining". null = строки нет.
         */
        private Instant deadline;
        private List<String> tags = new ArrayList<>(List.of("digest", "analytics"));
    }

    @Data
    public static class Spotlight {
        private int minDescription = 50;
        private List<String> tags = new ArrayList<>(List.of("spotlight", "projects"));
    }

    @Data
    public static class Replies {
        private int maxPerHour = 3;
        private int maxPerCycle = 3;
        private int ownPostsToScan = 5;
        private int commentsPerPost = 10;
        private int minCommentLength = 20;
        /**
         * Комментарий, совпавший с любым шаблоном, — спам, не отвечаем.
         */
        private List<String> spamPatterns = new ArrayList<>(List.of(
                "(?i)vote.*exchange",
                "(?i)vote.*for.*vote",
                "(?i)upvote.*if.*upvote",
                "\\$[A-Z]+",
                "(?i)buy.*token",
                "(?i)airdrop"));
        private int minReplyLength = 20;
        private Duration delayBetweenReplies = Duration.ofSeconds(5);
        private Duration delayBetweenPosts = Duration.ofSeconds(3);
    }

    @Data
    public static class Forum {
        private int maxPerCycle = 3;
        private int maxPerDay = 12;
        private int postsToScan = 30;
        private int minPostLength = 50;
        private int minCommentLength = 30;
        private Duration delayBetweenComments = Duration.ofSeconds(8);
    }
}
