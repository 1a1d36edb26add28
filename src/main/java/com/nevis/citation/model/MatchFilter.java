package com.nevis.citation.model;

import java.util.Optional;

public record MatchFilter(
    Optional<String> reference,
    Optional<Double> minScore,
    Optional<Boolean> hasDeepAnalysis
) {
    public static MatchFilter none() {
        return new MatchFilter(Optional.empty(), Optional.empty(), Optional.empty());
    }
}
