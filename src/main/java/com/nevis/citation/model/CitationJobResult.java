package com.nevis.citation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Output of a completed job: matches ranked by {@link CitationMatch#RANKING} plus the
 * elements whose match attempt failed.
 */
public record CitationJobResult(
    List<CitationMatch> matches,
    List<ElementFailure> failures
) {
    public CitationJobResult {
        matches = matches == null ? List.of() : List.copyOf(matches);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    @JsonIgnore
    public boolean isPartial() {
        return !failures.isEmpty();
    }
}
