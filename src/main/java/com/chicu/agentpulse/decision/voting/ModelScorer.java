package com.chicu.agentpulse.decision.voting;

import com.chicu.agentpulse.decision.DecisionProperties;
import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import com.chicu.agentpulse.reasoning.ReasoningClient;
import com.chicu.agentpulse.reasoning.ReasoningUnavailableException;
import com.chicu.agentpulse.reasoning.StructuredReply;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Оценка проекта внешней моделью. Никогда не бросает: любой сбой -> нейтральные 5.
 */
@Slf4j
@Component
public class ModelScorer {

    private static final int MAX_TOKENS = 500;

    private final ReasoningClient reasoning;
    private final ObjectMapper objectMapper;
    private final double neutral;

    public ModelScorer(ReasoningClient reasoning, ObjectMapper objectMapper, DecisionProperties props) {
        this.reasoning = reasoning;
        this.objectMapper = objectMapper;
        this.neutral = props.getVoting().getNeutralSubScore();
    }

    public ModelScore score(ProjectSnapshot p) {
        String text;
        try {
            text = reasoning.complete(prompt(p), MAX_TOKENS);
        } catch (ReasoningUnavailableException e) {
            log.warn("⚖ Model score fallback project={} : {}", p.id(), e.getMessage());
            return ModelScore.neutral(neutral, "model unavailable: " + e.getMessage());
        }

        Optional<JsonNode> json = StructuredReply.firstObject(objectMapper, text);
        if (json.isEmpty()) {
            log.warn("⚖ Model score fallback project={} : unparseable reply", p.id());
            return ModelScore.neutral(neutral, "unparseable model reply");
        }

        JsonNode n = json.get();
        return new ModelScore(
                dim(n, "innovation"),
                dim(n, "effort"),
                dim(n, "potential"),
                dim(n, "fit"),
                n.path("reasoning").asText(""),
                false
        );
    }

    /**
     * Отсутствует / не число -> нейтральное; иначе clamp в [1,10].
     */
    private double dim(JsonNode n, String field) {
        JsonNode v = n.path(field);
        double d;
        if (v.isNumber()) {
            d = v.asDouble();
        } else if (v.isTextual()) {
            try {
                d = Double.parseDouble(v.asText().trim());
            } catch (NumberFormatException e) {
                return neutral;
            }
        } else {
            return neutral;
        }
        if (Double.isNaN(d) || Double.isInfinite(d)) return neutral;
        return Math.max(1.0, Math.min(10.0, d));
    }

    private static String prompt(ProjectSnapshot p) {
        return """
                You are an autonomous analytics agent evaluating hackathon projects.

                Project: %s
                Tagline: %s
                Description: %s
                Repository: %s
                Demo: %s
                Video: %s

                Score each dimension from 1 to 10:
                - innovation: is the idea novel, does it solve a real problem?
                - effort: evidence of engineering work and completeness
                - potential: could this become a real product?
                - fit: value for the Solana / AI agent ecosystem

                Respond in JSON only:
                {"innovation": <1-10>, "effort": <1-10>, "potential": <1-10>, "fit": <1-10>, "reasoning": "<1-2 sentences>"}
                """.formatted(
                safe(p.name()),
                safe(p.tagline()),
                shrink(p.description()),
                p.hasRepo() ? p.repoLink() : "none",
                p.hasDemo() ? p.demoLink() : "none",
                p.hasVideo() ? p.videoLink() : "none"
        );
    }

    private static String safe(String s) {
        return (s == null || s.isBlank()) ? "N/A" : s.trim();
    }

    private static String shrink(String s) {
        String x = safe(s);
        return x.length() <= 1500 ? x : x.substring(0, 1500) + "...";
    }
}
