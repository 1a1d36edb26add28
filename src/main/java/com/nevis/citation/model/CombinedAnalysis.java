package com.nevis.citation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record CombinedAnalysis(
    List<ReferenceRanking> referenceRanking,
    List<ElementComparison> elementComparison,
    List<String> coveredElements,
    List<String> uncoveredElements,
    List<String> keyFindings
) {
    public CombinedAnalysis {
        referenceRanking = referenceRanking == null ? List.of() : List.copyOf(referenceRanking);
        elementComparison = elementComparison == null ? List.of() : List.copyOf(elementComparison);
        coveredElements = coveredElements == null ? List.of() : List.copyOf(coveredElements);
        uncoveredElements = uncoveredElements == null ? List.of() : List.copyOf(uncoveredElements);
        keyFindings = keyFindings == null ? List.of() : List.copyOf(keyFindings);
    }

    @JsonIgnore
    public Set<String> mentionedReferences() {
        Set<String> references = new LinkedHashSet<>();
        referenceRanking.forEach(r -> references.add(r.reference()));
        elementComparison.forEach(c -> {
            references.addAll(c.relevanceByReference().keySet());
            if (c.strongestReference() != null) {
                references.add(c.strongestReference());
            }
        });
        return references;
    }
}
