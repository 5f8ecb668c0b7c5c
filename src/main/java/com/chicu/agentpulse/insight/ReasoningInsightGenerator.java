package com.chicu.agentpulse.insight;

import com.chicu.agentpulse.ecosystem.EcosystemSnapshotHolder;
import com.chicu.agentpulse.ecosystem.ForumPostSnapshot;
import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import com.chicu.agentpulse.reasoning.ReasoningClient;
import com.chicu.agentpulse.reasoning.ReasoningUnavailableException;
import com.chicu.agentpulse.reasoning.StructuredReply;
import com.chicu.agentpulse.strategy.StrategyParameters;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class ReasoningInsightGenerator implements InsightGenerator {

    private static final int MAX_TOKENS = 2000;
    private static final int MAX_CANDIDATES = 3;

    private final ReasoningClient reasoning;
    private final ObjectMapper objectMapper;

    @Override
    public List<InsightCandidate> generate(EcosystemSnapshotHolder.Snapshot snapshot, StrategyParameters strategy) {
        if (snapshot.projects().isEmpty() && snapshot.forumPosts().isEmpty()) {
            log.info("💡 Insights: snapshot is empty, nothing to analyze");
            return List.of();
        }

        String text;
        try {
            text = reasoning.complete(prompt(snapshot, strategy), MAX_TOKENS);
        } catch (ReasoningUnavailableException e) {
            log.warn("💡 Insights: reasoning unavailable: {}", e.getMessage());
            return List.of();
        }

        Optional<JsonNode> arr = StructuredReply.firstArray(objectMapper, text);
        if (arr.isEmpty()) {
            log.warn("💡 Insights: reply has no json array");
            return List.of();
        }

        int dataPoints = snapshot.projects().size() + snapshot.forumPosts().size();
        List<InsightCandidate> out = new ArrayList<>();
        for (JsonNode n : arr.get()) {
            if (out.size() >= MAX_CANDIDATES) break;
            if (!n.isObject()) continue;
            String title = n.path("title").asText("").trim();
            String body = n.path("body").asText("").trim();
            if (title.isEmpty() || body.isEmpty()) continue;

            out.add(InsightCandidate.builder()
                    .title(title)
                    .body(body)
                    .type(n.path("type").asText(strategy.insightFocus().code()))
                    .dataPoints(n.path("dataPoints").isInt() ? n.path("dataPoints").asInt() : dataPoints)
                    .tags(texts(n.path("tags")))
                    .answersQuestion(n.path("answersQuestion").asBoolean(false))
                    .solvesIssue(n.path("solvesIssue").asBoolean(false))
                    .actionable(texts(n.path("actionable")))
                    .examples(texts(n.path("examples")))
                    .trending(n.path("trending").asBoolean(false))
                    .hasVisualization(n.path("hasVisualization").asBoolean(false))
                    .build());
        }

        log.info("💡 Insights generated: {}", out.size());
        return out;
    }

    private static List<String> texts(JsonNode n) {
        List<String> out = new ArrayList<>();
        for (JsonNode x : n) {
            String s = x.asText("").trim();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    private static String prompt(EcosystemSnapshotHolder.Snapshot s, StrategyParameters p) {
        StringBuilder projects = new StringBuilder();
        s.projects().stream()
                .sorted(Comparator.comparingInt(ProjectSnapshot::votes).reversed())
                .limit(15)
                .forEach(x -> projects.append("- ").append(x.name()).append(" (").append(x.votes()).append(" votes)")
                        .append(x.tagline() != null ? ": " + x.tagline() : "").append('\n'));

        StringBuilder posts = new StringBuilder();
        s.forumPosts().stream()
                .limit(20)
                .forEach((ForumPostSnapshot x) -> posts.append("- ").append(x.title())
                        .append(" (").append(x.upvotes()).append(" up, ").append(x.commentCount()).append(" comments)\n"));

        return """
                You are an autonomous analytics agent for a hackathon community.
                Tone: %s. Focus: %s. Posts go out around %02d:00 UTC.

                Total projects: %d. Recent forum posts: %d.

                Top projects:
                %s
                Recent forum posts:
                %s
                Produce up to %d insights as a JSON array only. Each element:
                {"title": "...", "body": "markdown with concrete numbers", "type": "%s",
                 "tags": ["..."], "answersQuestion": true|false, "solvesIssue": true|false,
                 "actionable": ["concrete recommendation"], "examples": ["..."],
                 "trending": true|false, "hasVisualization": false}
                """.formatted(
                p.postingTone().code(), p.insightFocus().code(), p.optimalHour(),
                s.projects().size(), s.forumPosts().size(),
                projects, posts,
                MAX_CANDIDATES, p.insightFocus().code()
        );
    }
}
