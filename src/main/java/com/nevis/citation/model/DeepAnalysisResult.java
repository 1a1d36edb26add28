package com.nevis.citation.model;

import java.util.List;

public record DeepAnalysisResult(
    double overallRelevance,
    List<ElementAnalysis> elementAnalysis,
    List<String> keyFindings,
    List<String> recommendations
) {
    public DeepAnalysisResult {
        if (!(overallRelevance >= 0 && overallRelevance <= 1)) {
            throw new IllegalArgumentException("Invalid overall relevance: " + overallRelevance);
        }
        elementAnalysis = elementAnalysis == null ? List.of() : List.copyOf(elementAnalysis);
        keyFindings = keyFindings == null ? List.of() : List.copyOf(keyFindings);
        recommendations = recommendations == null ? null : List.copyOf(recommendations);
    }
}
