package com.nevis.citation.model;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Point-in-time merge of several deep analyses. Never updated after creation.
 */
public record CombinedAnalysisRecord(
    UUID id,
    UUID searchHistoryId,
    OffsetDateTime createdAt,
    Set<String> referenceNumbers,
    CombinedAnalysis analysis,
    String claim1Text
) {
    public CombinedAnalysisRecord {
        if (referenceNumbers == null || referenceNumbers.isEmpty()) {
            throw new IllegalArgumentException("Combined analysis needs at least one reference");
        }
        referenceNumbers = Collections.unmodifiableSet(new LinkedHashSet<>(referenceNumbers));
        if (analysis != null && !referenceNumbers.containsAll(analysis.mentionedReferences())) {
            throw new IllegalArgumentException("Combined analysis mentions references outside " + referenceNumbers);
        }
    }
}
