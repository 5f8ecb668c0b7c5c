package com.chicu.agentpulse.decision.posting;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public final class TextSimilarity {

    private TextSimilarity() {}

    /**
     * Jaccard по множествам слов (lowercase, split по пробелам).
     */
    public static double jaccard(String a, String b) {
        Set<String> s1 = tokens(a);
        Set<String> s2 = tokens(b);
        if (s1.isEmpty() && s2.isEmpty()) return 1.0;

        Set<String> inter = new HashSet<>(s1);
        inter.retainAll(s2);
        Set<String> union = new HashSet<>(s1);
        union.addAll(s2);
        return (double) inter.size() / union.size();
    }

    static Set<String> tokens(String s) {
        if (s == null || s.isBlank()) return Set.of();
        return Arrays.stream(s.toLowerCase(Locale.ROOT).trim().split("\\s+"))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }
}
