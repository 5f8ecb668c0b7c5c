package com.chicu.agentpulse.engagement.spotlight;

import com.chicu.agentpulse.ecosystem.EcosystemProperties;
import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import com.chicu.agentpulse.engagement.EngagementProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.LongPredicate;

/**
 * Выбор проекта дня. Уже показанные проекты отсекает вызывающий через {@code alreadyFeatured}.
 */
@Slf4j
@Component
public class SpotlightSelector {

    public record Pick(ProjectSnapshot project, int score) {}

    private final EngagementProperties.Spotlight props;
    private final EcosystemProperties ecosystemProps;

    public SpotlightSelector(EngagementProperties props, EcosystemProperties ecosystemProps) {
        this.props = props.getSpotlight();
        this.ecosystemProps = ecosystemProps;
    }

    public Optional<Pick> select(List<ProjectSnapshot> projects, LongPredicate alreadyFeatured) {
        Long own = ecosystemProps.getOwnProjectId();

        List<Pick> ranked = projects.stream()
                .filter(p -> own == null || p.id() != own)
                .filter(p -> p.descriptionLength() > props.getMinDescription())
                .filter(p -> p.hasDemo() || p.hasRepo())
                .filter(p -> !alreadyFeatured.test(p.id()))
                .map(p -> new Pick(p, score(p)))
                // при равном счёте: больше голосов, затем меньший id
                .sorted(Comparator.comparingInt(Pick::score).reversed()
                        .thenComparing(Comparator.comparingInt((Pick x) -> x.project().votes()).reversed())
                        .thenComparingLong(x -> x.project().id()))
                .toList();

        if (ranked.isEmpty()) {
            log.info("🔦 Spotlight: no eligible project");
            return Optional.empty();
        }
        return Optional.of(ranked.get(0));
    }

    static int score(ProjectSnapshot p) {
        int score = 0;
        if (p.hasDemo()) score += 2;
        if (p.hasRepo()) score += 1;
        if (p.hasVideo()) score += 1;

        int len = p.descriptionLength();
        if (len > 300) score += 3;
        else if (len > 150) score += 2;
        else score += 1;

        if (p.votes() > 15) score += 2;
        else if (p.votes() > 5) score += 1;

        if (p.tagline() != null && p.tagline().length() > 20) score += 1;
        return score;
    }
}
