package com.nevis.citation.model;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.UUID;

public record CitationMatch(
    UUID id,
    UUID searchHistoryId,
    UUID citationJobId,
    String reference,
    String elementId,
    String elementText,
    int elementOrder,
    String parsedElementText,
    String matchingText,
    Double score,
    String reasoning,
    CitationLocation citationLocation,
    DeepAnalysisResult deepAnalysisResult,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

    /**
     * Descending score, ties broken by claim element order. Matches without a score sort last.
     */
    public static final Comparator<CitationMatch> RANKING = Comparator
        .comparingDouble((CitationMatch m) -> m.score() == null ? -1.0 : m.score())
        .reversed()
        .thenComparingInt(CitationMatch::elementOrder);

    public CitationMatch {
        if (score != null && !(score >= 0 && score <= 1)) {
            throw new IllegalArgumentException("Invalid match score: " + score);
        }
        if (deepAnalysisResult != null && score == null) {
            throw new IllegalArgumentException("Deep analysis requires a scored match");
        }
    }

    public CitationMatch assignedTo(UUID matchId, UUID searchHistoryId, UUID citationJobId) {
        return new CitationMatch(
            matchId,
            searchHistoryId,
            citationJobId,
            reference,
            elementId,
            elementText,
            elementOrder,
            parsedElementText,
            matchingText,
            score,
            reasoning,
            citationLocation,
            deepAnalysisResult,
            createdAt,
            updatedAt
        );
    }
}
