package com.nevis.citation.model;

import java.util.Map;

public record ElementComparison(
    String elementId,
    Map<String, Double> relevanceByReference,
    String strongestReference,
    double strongestRelevance
) {}
