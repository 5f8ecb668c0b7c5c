package com.chicu.agentpulse.strategy;

import com.chicu.agentpulse.reasoning.ReasoningClient;
import com.chicu.agentpulse.reasoning.ReasoningUnavailableException;
import com.chicu.agentpulse.reasoning.StructuredReply;
import com.chicu.agentpulse.strategy.space.ParamSpace;
import com.chicu.agentpulse.strategy.space.ParamSpaceItem;
import com.chicu.agentpulse.strategy.space.ParamValueType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Спрашивает модель, как подкрутить стратегию. Ответ НЕ проверяется здесь — это делает AdaptationService.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StrategyAdvisor {

    private static final int MAX_TOKENS = 800;
    private static final int MAX_TUPLES = 20;

    private final ReasoningClient reasoning;
    private final ObjectMapper objectMapper;

    public StrategyRecommendation recommend(MetricsSnapshot metrics, Strategy strategy) {
        String text;
        try {
            text = reasoning.complete(buildPrompt(metrics, strategy), MAX_TOKENS);
        } catch (ReasoningUnavailableException e) {
            log.warn("🧬 Advisor: reasoning unavailable -> neutral: {}", e.getMessage());
            return StrategyRecommendation.fallback("reasoning unavailable");
        }

        Optional<JsonNode> parsed = StructuredReply.firstObject(objectMapper, text);
        if (parsed.isEmpty()) {
            log.warn("🧬 Advisor: reply has no json object -> neutral");
            return StrategyRecommendation.fallback("unparseable reply");
        }
        return fromJson(parsed.get());
    }

    StrategyRecommendation fromJson(JsonNode root) {
        List<RecommendationTuple> tuples = new ArrayList<>();
        for (JsonNode r : root.path("recommendations")) {
            if (tuples.size() >= MAX_TUPLES) break;
            if (!r.isObject()) continue;
            tuples.add(new RecommendationTuple(
                    r.path("parameter").asText(null),
                    raw(r.get("suggestedValue")),
                    r.path("reason").asText("")
            ));
        }

        JsonNode score = root.path("performanceScore");
        double perf = score.isNumber() ? score.asDouble() : StrategyRecommendation.NEUTRAL_SCORE;
        if (Double.isNaN(perf) || perf < 1 || perf > 10) perf = StrategyRecommendation.NEUTRAL_SCORE;

        String summary = root.path("summary").asText("");
        return new StrategyRecommendation(summary, tuples, perf, false);
    }

    /**
     * JsonNode -> значение без интерпретации: типы проверит валидатор.
     */
    private static Object raw(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) return null;
        if (v.isTextual()) return v.asText();
        if (v.isBoolean()) return v.booleanValue();
        if (v.isNumber()) return v.numberValue();
        return v.toString();
    }

    String buildPrompt(MetricsSnapshot m, Strategy s) {
        StringBuilder domains = new StringBuilder();
        for (Map.Entry<String, ParamSpaceItem> e : ParamSpace.items().entrySet()) {
            ParamSpaceItem it = e.getValue();
            domains.append("- ").append(e.getKey()).append(": ");
            if (it.type() == ParamValueType.ENUM) {
                domains.append(String.join(" | ", new TreeSet<>(it.allowed())));
            } else {
                domains.append(it.type().name().toLowerCase()).append(" in [").append(it.min()).append(", ").append(it.max()).append("]");
            }
            domains.append(" (current: ").append(s.parameters().get(e.getKey())).append(")\n");
        }

        return String.format(Locale.ROOT, """
                You are the self-improvement engine of an autonomous analytics agent.
                Analyze the performance metrics below and recommend parameter changes.

                Strategy version: %d

                Adjustable parameters (name: domain):
                %s
                Last %dh performance:
                - Actions taken: %d (failed: %d)
                - Forum posts published: %d
                - Own posts observed: %d, avg upvotes %.1f, best %d, avg comments %.1f
                - Votes cast: %d
                - Ledger commitments: %d

                Respond in JSON only:
                {
                  "summary": "2-3 sentence assessment",
                  "recommendations": [
                    {"parameter": "<name from the list>", "suggestedValue": <value>, "reason": "why"}
                  ],
                  "performanceScore": <1-10>
                }
                """,
                s.version(),
                domains,
                m.windowHours(),
                m.actionsTaken(), m.failedActions(),
                m.postsPublished(),
                m.ownPostsObserved(), m.avgUpvotes(), m.maxUpvotes(), m.avgComments(),
                m.votesCast(),
                m.ledgerCommitments()
        );
    }
}
