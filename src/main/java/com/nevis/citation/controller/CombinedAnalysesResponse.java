package com.nevis.citation.controller;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.citation.model.CombinedAnalysisRecord;

import java.util.List;

/**
 * Serialized as {@code {"analyses": [...]}}. Older clients wrap the same list as
 * {@code {"data": {"analyses": [...]}}}; both shapes are accepted when reading.
 */
public record CombinedAnalysesResponse(
    List<CombinedAnalysisRecord> analyses
) {
    public record Envelope(List<CombinedAnalysisRecord> analyses) {}

    public CombinedAnalysesResponse {
        analyses = analyses == null ? List.of() : List.copyOf(analyses);
    }

    @JsonCreator
    public static CombinedAnalysesResponse fromJson(
        @JsonProperty("analyses") List<CombinedAnalysisRecord> analyses,
        @JsonProperty("data") Envelope data
    ) {
        if (analyses != null) {
            return new CombinedAnalysesResponse(analyses);
        }
        return new CombinedAnalysesResponse(data == null ? null : data.analyses());
    }
}
