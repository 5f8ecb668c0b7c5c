package com.chicu.agentpulse.engagement.spotlight;

import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import com.chicu.agentpulse.reasoning.ReasoningClient;
import com.chicu.agentpulse.reasoning.ReasoningUnavailableException;
import com.chicu.agentpulse.reasoning.StructuredReply;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class SpotlightWriter {

    private static final int MAX_TOKENS = 600;
    static final int NEUTRAL_RATING = 7;

    private final ReasoningClient reasoning;
    private final ObjectMapper objectMapper;

    public SpotlightPost write(ProjectSnapshot p) {
        Optional<JsonNode> reply;
        try {
            reply = StructuredReply.firstObject(objectMapper, reasoning.complete(prompt(p), MAX_TOKENS));
        } catch (ReasoningUnavailableException e) {
            log.warn("🔦 Spotlight: reasoning unavailable: {}", e.getMessage());
            reply = Optional.empty();
        }

        boolean fallback = reply.isEmpty();
        JsonNode n = reply.orElseGet(objectMapper::createObjectNode);

        String built = text(n, "whatTheyBuilt", p.description() == null ? "An innovative hackathon project."
                : p.description().substring(0, Math.min(200, p.description().length())));
        String why = text(n, "whyInteresting", "Shows great potential and effort.");
        String approach = text(n, "technicalApproach", "Building on Solana with AI agent capabilities.");
        String suggestion = text(n, "suggestion", "Keep building and share progress on the forum!");
        int rating = n.path("score").isNumber() ? Math.max(1, Math.min(10, n.path("score").asInt())) : NEUTRAL_RATING;

        return new SpotlightPost("🔦 Agent Spotlight: " + p.name(),
                format(p, built, why, approach, suggestion, rating), rating, fallback);
    }

    private static String format(ProjectSnapshot p, String built, String why, String approach,
                                 String suggestion, int rating) {
        StringBuilder sb = new StringBuilder();
        if (p.tagline() != null && !p.tagline().isBlank()) {
            sb.append("> *").append(p.tagline()).append("*\n\n");
        }
        sb.append("## 🛠️ What They Built\n\n").append(built).append("\n\n");
        sb.append("## ✨ Why It's Interesting\n\n").append(why).append("\n\n");
        sb.append("## 🔧 Technical Approach\n\n").append(approach).append("\n\n");

        sb.append("## 📊 Project Stats\n\n");
        sb.append("- **Votes:** ").append(p.votes()).append('\n');
        if (p.hasDemo()) sb.append("- **Live Demo:** [Try it](").append(p.demoLink()).append(")\n");
        if (p.hasRepo()) sb.append("- **GitHub:** [View Code](").append(p.repoLink()).append(")\n");
        if (p.hasVideo()) sb.append("- **Video Demo:** [Watch](").append(p.videoLink()).append(")\n");
        sb.append('\n');

        sb.append("## 🫀 AgentPulse Score: ").append(rating).append("/10\n\n");
        sb.append("**💡 Suggestion:** ").append(suggestion).append("\n\n");
        sb.append("---\n\n");
        sb.append("*🫀 One standout project is selected autonomously each day. Keep building and sharing progress!*");
        return sb.toString();
    }

    private static String text(JsonNode n, String field, String fallback) {
        String v = n.path(field).asText("").trim();
        return v.isEmpty() ? fallback : v;
    }

    private static String prompt(ProjectSnapshot p) {
        return """
                You are writing a spotlight feature for a hackathon project. Be enthusiastic, specific
                and genuinely helpful.

                Project:
                - Name: %s
                - Tagline: %s
                - Description: %s
                - GitHub: %s
                - Demo: %s
                - Video: %s
                - Votes: %d

                Respond in JSON only:
                {"whatTheyBuilt": "2-3 sentences", "whyInteresting": "2-3 sentences",
                 "technicalApproach": "1-2 sentences", "suggestion": "1 constructive suggestion",
                 "score": <1-10>}
                """.formatted(
                p.name(),
                Objects.toString(p.tagline(), "N/A"),
                Objects.toString(p.description(), "N/A"),
                Objects.toString(p.repoLink(), "N/A"),
                Objects.toString(p.demoLink(), "N/A"),
                Objects.toString(p.videoLink(), "N/A"),
                p.votes());
    }
}
