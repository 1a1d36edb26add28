package com.nevis.citation.model;

import java.util.Set;

public record ElementAnalysis(
    String elementId,
    double relevance,
    String explanation,
    Set<String> matchedConcepts,
    boolean failed
) {
    public ElementAnalysis {
        if (!(relevance >= 0 && relevance <= 1)) {
            throw new IllegalArgumentException("Invalid element relevance: " + relevance);
        }
        matchedConcepts = matchedConcepts == null ? Set.of() : Set.copyOf(matchedConcepts);
    }

    public static ElementAnalysis failure(String elementId, String reason) {
        return new ElementAnalysis(elementId, 0.0, "Analysis failed: " + reason, Set.of(), true);
    }
}
