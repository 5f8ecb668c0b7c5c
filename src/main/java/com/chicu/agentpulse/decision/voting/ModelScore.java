package com.chicu.agentpulse.decision.voting;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Четыре измерения 1..10 от модели; average = modelScore.
 * fallback=true: модель недоступна или ответ не разобран, все измерения нейтральные.
 */
public record ModelScore(
        double innovation,
        double effort,
        double potential,
        double fit,
        String reasoning,
        boolean fallback
) {
    public double average() {
        return (innovation + effort + potential + fit) / 4.0;
    }

    public Map<String, Double> breakdown() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("innovation", innovation);
        m.put("effort", effort);
        m.put("potential", potential);
        m.put("fit", fit);
        return m;
    }

    public static ModelScore neutral(double value, String why) {
        return new ModelScore(value, value, value, value, why, true);
    }
}
