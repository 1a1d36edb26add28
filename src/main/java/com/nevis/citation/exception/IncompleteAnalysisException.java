package com.nevis.citation.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class IncompleteAnalysisException extends RuntimeException {
    private final List<String> missingReferences;
    /**
     * Subset of the missing references whose latest deep analysis was computed against a
     * different claim text.
     */
    private final List<String> staleReferences;

    public IncompleteAnalysisException(List<String> missingReferences) {
        this(missingReferences, List.of());
    }

    public IncompleteAnalysisException(List<String> missingReferences, List<String> staleReferences) {
        super(staleReferences.isEmpty()
            ? "Deep analysis missing for references: " + String.join(", ", missingReferences)
            : "Deep analysis missing or out of date for references: " + String.join(", ", missingReferences)
                + " (claim changed for " + String.join(", ", staleReferences) + ")");
        this.missingReferences = List.copyOf(missingReferences);
        this.staleReferences = List.copyOf(staleReferences);
    }
}
