package com.nevis.citation.model;

public record ReferenceRanking(
    int rank,
    String reference,
    double overallRelevance
) {}
