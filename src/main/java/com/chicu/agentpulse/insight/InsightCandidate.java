package com.chicu.agentpulse.insight;

import lombok.Builder;

import java.util.List;
import java.util.Locale;

/**
 * Кандидат на публикацию. Поля-флаги заполняет генератор, гейт их только читает.
 */
@Builder(toBuilder = true)
public record InsightCandidate(
        String title,
        String body,
        String type,
        int dataPoints,
        List<String> tags,
        boolean answersQuestion,
        boolean solvesIssue,
        List<String> actionable,
        List<String> examples,
        boolean trending,
        boolean hasVisualization
) {
    public InsightCandidate {
        tags = tags == null ? List.of() : List.copyOf(tags);
        actionable = actionable == null ? List.of() : List.copyOf(actionable);
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    /**
     * Стабильный ключ для дедупликации публикации: slug заголовка.
     */
    public String key() {
        String t = title == null ? "" : title.toLowerCase(Locale.ROOT);
        String slug = t.replaceAll("[^a-z0-9]+", "-").replaceAll("(^-+|-+$)", "");
        if (slug.isEmpty()) slug = "untitled";
        return slug.length() > 100 ? slug.substring(0, 100) : slug;
    }
}
