package com.chicu.agentpulse.decision.voting;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ObjectiveScore(
        double total,
        Map<String, Double> parts,
        String descriptionTier
) {
    public ObjectiveScore {
        parts = Collections.unmodifiableMap(new LinkedHashMap<>(parts));
    }
}
