package com.chicu.agentpulse.engagement.forum;

import com.chicu.agentpulse.ecosystem.ForumPostSnapshot;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Чужие посты в порядке "где комментарий заметнее и полезнее".
 */
@Component
public class PostRanker {

    private static final Pattern TOPICS = Pattern.compile(
            "analytics|data|insight|dashboard|leaderboard|solana|on-chain|autonomous|voting|agent", Pattern.CASE_INSENSITIVE);
    private static final Pattern INVITES_DISCUSSION = Pattern.compile(
            "what do you think|thoughts\\??|feedback|opinions", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROJECT_UPDATE = Pattern.compile(
            "update|shipped|deployed|built|launched|v\\d|day \\d", Pattern.CASE_INSENSITIVE);

    public record Ranked(ForumPostSnapshot post, int score) {}

    public List<Ranked> rank(List<ForumPostSnapshot> posts, Instant now) {
        return posts.stream()
                .map(p -> new Ranked(p, score(p, now)))
                .sorted(Comparator.comparingInt(Ranked::score).reversed())
                .toList();
    }

    int score(ForumPostSnapshot p, Instant now) {
        String title = p.title() == null ? "" : p.title();
        String body = p.body() == null ? "" : p.body();
        int score = 0;

        // свежие видят чаще
        if (p.createdAt() != null) {
            long ageMinutes = Duration.between(p.createdAt(), now).toMinutes();
            if (ageMinutes < 120) score += 5;
            else if (ageMinutes < 360) score += 3;
            else if (ageMinutes < 1440) score += 1;
        }

        // меньше комментариев = меньше конкуренции
        if (p.commentCount() < 3) score += 3;
        else if (p.commentCount() < 10) score += 1;

        if (TOPICS.matcher(title).find() || TOPICS.matcher(body).find()) score += 3;
        if (title.contains("?") || INVITES_DISCUSSION.matcher(body).find()) score += 2;
        if (PROJECT_UPDATE.matcher(title).find()) score += 2;

        return score;
    }
}
