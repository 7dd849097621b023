package com.example.vrpassistant.analysis;

import java.util.List;
import java.util.Locale;

/**
 * Kinds of solution analysis. Free-text aspects from the assistant are mapped with
 * {@link #fromText(String)}: keywords are matched as case-insensitive substrings in
 * declaration order and the first hit wins, anything else falls back to {@link #OVERVIEW}.
 */
public enum AnalysisAspect {
    ROUTES(List.of("route")),
    UTILIZATION(List.of("utilization", "capacity")),
    CONSTRAINTS(List.of("constraint", "violation")),
    EFFICIENCY(List.of("efficiency", "performance")),
    OVERVIEW(List.of());

    private final List<String> keywords;

    AnalysisAspect(List<String> keywords) {
        this.keywords = keywords;
    }

    public static AnalysisAspect fromText(String aspect) {
        if (aspect == null) return OVERVIEW;
        String lower = aspect.toLowerCase(Locale.ROOT);
        for (AnalysisAspect candidate : values()) {
            for (String keyword : candidate.keywords) {
                if (lower.contains(keyword)) {
                    return candidate;
                }
            }
        }
        return OVERVIEW;
    }
}
