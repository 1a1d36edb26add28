package com.nevis.citation.model;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ConsolidatedCitationResults(
    UUID searchHistoryId,
    int totalMatches,
    int uniqueReferences,
    List<CitationMatch> topMatches,
    Map<String, List<CitationMatch>> byReference
) {}
