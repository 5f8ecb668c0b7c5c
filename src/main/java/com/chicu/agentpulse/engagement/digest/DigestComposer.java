package com.chicu.agentpulse.engagement.digest;

import com.chicu.agentpulse.ecosystem.EcosystemProperties;
import com.chicu.agentpulse.ecosystem.ForumPostSnapshot;
import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import com.chicu.agentpulse.engagement.EngagementProperties;
import com.chicu.agentpulse.reasoning.ReasoningClient;
import com.chicu.agentpulse.reasoning.ReasoningUnavailableException;
import com.chicu.agentpulse.reasoning.StructuredReply;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ежедневная сводка по хакатону: рост голосов, недооценённые проекты, форум, цифры, прогноз.
 */
@Slf4j
@Component
public class DigestComposer {

    static final String PREDICTIONS_UNAVAILABLE = "Predictions temporarily unavailable.";
    static final String GEM_FALLBACK_REASON = "Interesting project with working demo";

    private static final int MAX_TOKENS = 700;
    private static final int TOP_FOR_PREDICTIONS = 10;
    private static final DateTimeFormatter TITLE_DATE =
            DateTimeFormatter.ofPattern("MMM d", Locale.ROOT).withZone(ZoneOffset.UTC);

    record RisingStar(ProjectSnapshot project, int growth) {}

    record Gem(ProjectSnapshot project, String reason) {}

    record AgentActivity(String name, long posts) {}

    private final ReasoningClient reasoning;
    private final ObjectMapper objectMapper;
    private final EngagementProperties.Digest props;
    private final EcosystemProperties ecosystemProps;

    public DigestComposer(ReasoningClient reasoning,
                          ObjectMapper objectMapper,
                          EngagementProperties props,
                          EcosystemProperties ecosystemProps) {
        this.reasoning = reasoning;
        this.objectMapper = objectMapper;
        this.props = props.getDigest();
        this.ecosystemProps = ecosystemProps;
    }

    /**
     * @param previousVotes голоса из прошлого дайджеста; null = прошлого нет, Rising Stars пропускаем
     */
    public Digest compose(List<ProjectSnapshot> projects,
                          List<ForumPostSnapshot> posts,
                          Map<String, Integer> previousVotes,
                          Instant now) {
        List<RisingStar> rising = risingStars(projects, previousVotes);
        List<ProjectSnapshot> gemCandidates = gemCandidates(projects);

        Optional<JsonNode> model = projects.isEmpty() ? Optional.empty() : askModel(projects, gemCandidates);
        List<Gem> gems = gems(gemCandidates, model);
        String predictions = model.map(n -> n.path("predictions").asText("").trim())
                .filter(s -> !s.isEmpty())
                .orElse(PREDICTIONS_UNAVAILABLE);

        List<ForumPostSnapshot> recent = recentPosts(posts, now);
        List<AgentActivity> topAgents = topAgents(recent);
        Map<String, Object> stats = stats(projects, recent.size());
        Long daysLeft = daysLeft(now);

        String title = "🫀 AgentPulse Daily Digest - " + TITLE_DATE.format(now);
        String body = format(rising, gems, topAgents, stats, predictions, daysLeft);

        Map<String, Integer> votes = new LinkedHashMap<>();
        for (ProjectSnapshot p : projects) {
            votes.put(String.valueOf(p.id()), p.votes());
        }

        log.info("📰 Digest composed: rising={} gems={} activeAgents={} modelFallback={}",
                rising.size(), gems.size(), topAgents.size(), model.isEmpty());
        return new Digest(title, body, stats, votes);
    }

    // ==========================
    // секции
    // ==========================

    List<RisingStar> risingStars(List<ProjectSnapshot> projects, Map<String, Integer> previousVotes) {
        if (previousVotes == null) return List.of();
        return projects.stream()
                .filter(p -> previousVotes.containsKey(String.valueOf(p.id())))
                .map(p -> new RisingStar(p, p.votes() - previousVotes.get(String.valueOf(p.id()))))
                .filter(r -> r.growth() > 0)
                .sorted(Comparator.comparingInt(RisingStar::growth).reversed()
                        .thenComparingLong(r -> r.project().id()))
                .limit(props.getRisingStars())
                .toList();
    }

    List<ProjectSnapshot> gemCandidates(List<ProjectSnapshot> projects) {
        Long own = ecosystemProps.getOwnProjectId();
        return projects.stream()
                .filter(p -> own == null || p.id() != own)
                .filter(p -> p.hasDemo() || p.hasRepo())
                .filter(p -> p.descriptionLength() > props.getGemMinDescription())
                .filter(p -> p.votes() < props.getGemMaxVotes())
                .limit(props.getGemCandidatesForModel())
                .toList();
    }

    private List<Gem> gems(List<ProjectSnapshot> candidates, Optional<JsonNode> model) {
        if (candidates.isEmpty()) return List.of();

        Map<Long, ProjectSnapshot> byId = candidates.stream()
                .collect(Collectors.toMap(ProjectSnapshot::id, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        List<Gem> picked = new ArrayList<>();
        JsonNode arr = model.map(n -> n.path("hiddenGems")).orElse(null);
        if (arr != null && arr.isArray()) {
            for (JsonNode g : arr) {
                // модель может выдумать id: берём только из кандидатов
                ProjectSnapshot p = byId.remove(g.path("id").asLong(-1));
                if (p == null) continue;
                String reason = g.path("reason").asText("").trim();
                picked.add(new Gem(p, reason.isEmpty() ? fallbackReason(p) : reason));
                if (picked.size() >= props.getHiddenGems()) break;
            }
        }
        if (!picked.isEmpty()) return picked;

        return candidates.stream()
                .limit(props.getHiddenGems())
                .map(p -> new Gem(p, fallbackReason(p)))
                .toList();
    }

    private static List<ForumPostSnapshot> recentPosts(List<ForumPostSnapshot> posts, Instant now) {
        Instant from = now.minus(Duration.ofHours(24));
        return posts.stream()
                .filter(p -> p.createdAt() != null && p.createdAt().isAfter(from))
                .toList();
    }

    List<AgentActivity> topAgents(List<ForumPostSnapshot> recent) {
        Map<String, Long> counts = recent.stream()
                .collect(Collectors.groupingBy(p -> Objects.toString(p.agentName(), "unknown"),
                        LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .map(e -> new AgentActivity(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(AgentActivity::posts).reversed()
                        .thenComparing(AgentActivity::name))
                .limit(props.getTopAgents())
                .toList();
    }

    static Map<String, Object> stats(List<ProjectSnapshot> projects, int postsToday) {
        int total = projects.size();
        long withDemo = projects.stream().filter(ProjectSnapshot::hasDemo).count();
        long withRepo = projects.stream().filter(ProjectSnapshot::hasRepo).count();
        long votes = projects.stream().mapToLong(ProjectSnapshot::votes).sum();

        Map<String, Object> s = new LinkedHashMap<>();
        s.put("totalProjects", total);
        s.put("totalVotes", votes);
        s.put("projectsWithDemo", withDemo);
        s.put("projectsWithRepo", withRepo);
        s.put("completionRate", Math.round(withDemo * 100.0 / Math.max(total, 1)));
        s.put("forumPostsToday", postsToday);
        return s;
    }

    Long daysLeft(Instant now) {
        Instant deadline = props.getDeadline();
        if (deadline == null) return null;
        long seconds = Duration.between(now, deadline).getSeconds();
        if (seconds <= 0) return 0L;
        return (seconds + 86_399) / 86_400;
    }

    // ==========================
    // модель
    // ==========================

    private Optional<JsonNode> askModel(List<ProjectSnapshot> projects, List<ProjectSnapshot> gemCandidates) {
        List<ProjectSnapshot> top = projects.stream()
                .sorted(Comparator.comparingInt(ProjectSnapshot::votes).reversed())
                .limit(TOP_FOR_PREDICTIONS)
                .toList();

        StringBuilder topLines = new StringBuilder();
        for (int i = 0; i < top.size(); i++) {
            ProjectSnapshot p = top.get(i);
            topLines.append(i + 1).append(". \"").append(p.name()).append("\" (").append(p.votes())
                    .append(" votes) - Demo: ").append(p.hasDemo())
                    .append(", GitHub: ").append(p.hasRepo())
                    .append(" - ").append(excerpt(p.description(), 100)).append('\n');
        }
        StringBuilder gemLines = new StringBuilder();
        for (ProjectSnapshot p : gemCandidates) {
            gemLines.append("- id=").append(p.id()).append(" \"").append(p.name()).append("\": ")
                    .append(excerpt(p.description(), 100))
                    .append(" | Votes: ").append(p.votes())
                    .append(" | GitHub: ").append(p.hasRepo()).append('\n');
        }

        String prompt = """
                You are AgentPulse writing the daily digest for an AI agent hackathon.

                Top projects by votes:
                %s
                Hidden gem candidates (quality projects with few votes):
                %s
                Tasks:
                1. Pick the %d most interesting hidden gems from the candidates (use their id).
                2. Predict the most likely winners (top 3) and one dark horse, 2-3 sentences, say WHY.

                Respond in JSON only:
                {"hiddenGems": [{"id": <id>, "reason": "1 sentence"}], "predictions": "..."}
                """.formatted(topLines, gemLines.length() == 0 ? "(none)\n" : gemLines, props.getHiddenGems());

        try {
            return StructuredReply.firstObject(objectMapper, reasoning.complete(prompt, MAX_TOKENS));
        } catch (ReasoningUnavailableException e) {
            log.warn("📰 Digest: reasoning unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ==========================
    // текст
    // ==========================

    private static String format(List<RisingStar> rising,
                                 List<Gem> gems,
                                 List<AgentActivity> topAgents,
                                 Map<String, Object> stats,
                                 String predictions,
                                 Long daysLeft) {
        List<String> s = new ArrayList<>();

        String intro = "Good morning, builders! Here's your daily pulse check on the hackathon.";
        if (daysLeft != null) intro += " ⏰ **" + daysLeft + " days remaining!**";
        s.add(intro);
        s.add("");

        if (!rising.isEmpty()) {
            s.add("## 📈 Rising Stars (biggest growth in 24h)");
            s.add("");
            for (int i = 0; i < rising.size(); i++) {
                RisingStar r = rising.get(i);
                s.add("**" + (i + 1) + ". " + r.project().name() + "** (+" + r.growth() + " votes) - now at "
                        + r.project().votes() + " total");
            }
            s.add("");
        }

        if (!gems.isEmpty()) {
            s.add("## 💎 Hidden Gems (quality projects that deserve attention)");
            s.add("");
            for (Gem g : gems) {
                s.add("- **" + g.project().name() + "** (" + g.project().votes() + " votes) - " + g.reason());
            }
            s.add("");
        }

        if (!topAgents.isEmpty()) {
            s.add("## 🔥 Most Active on Forum Today");
            s.add("");
            for (int i = 0; i < topAgents.size(); i++) {
                AgentActivity a = topAgents.get(i);
                s.add((i + 1) + ". " + a.name() + " - " + a.posts() + " posts");
            }
            s.add("");
        }

        s.add("## 📊 Hackathon Stats");
        s.add("");
        s.add("- **Total projects:** " + stats.get("totalProjects"));
        s.add("- **Total votes:** " + stats.get("totalVotes"));
        s.add("- **Projects with demo:** " + stats.get("projectsWithDemo") + " (" + stats.get("completionRate") + "%)");
        s.add("- **Projects with GitHub:** " + stats.get("projectsWithRepo"));
        s.add("- **Forum posts today:** " + stats.get("forumPostsToday"));
        s.add("");

        s.add("## 🎯 AgentPulse Predictions");
        s.add("");
        s.add(predictions);
        s.add("");

        s.add("---");
        s.add("");
        s.add("*🫀 Generated autonomously by AgentPulse*");
        s.add("*Want to be featured? Keep building, keep posting, keep engaging!*");
        return String.join("\n", s);
    }

    private static String fallbackReason(ProjectSnapshot p) {
        return p.tagline() != null && !p.tagline().isBlank() ? p.tagline() : GEM_FALLBACK_REASON;
    }

    private static String excerpt(String s, int max) {
        if (s == null || s.isBlank()) return "N/A";
        String x = s.trim();
        return x.length() > max ? x.substring(0, max) : x;
    }
}
