package com.nevis.citation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.citation.model.CitationJob;
import com.nevis.citation.model.CitationJobResult;
import com.nevis.citation.model.CitationJobStatus;
import com.nevis.citation.model.DeepAnalysisResult;
import com.nevis.citation.model.JobError;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record CitationJobResponse(
    UUID id,

    @JsonProperty("search_history_id")
    UUID searchHistoryId,

    String reference,

    CitationJobStatus status,

    @JsonProperty("element_ids")
    List<String> elementIds,

    CitationJobResult result,

    JobError error,

    @JsonProperty("deep_analysis")
    DeepAnalysisResult deepAnalysis,

    @JsonProperty("started_at")
    OffsetDateTime startedAt,

    @JsonProperty("completed_at")
    OffsetDateTime completedAt,

    @JsonProperty("created_at")
    OffsetDateTime createdAt
) {
    public static CitationJobResponse from(CitationJob job) {
        return new CitationJobResponse(
            job.id(),
            job.searchHistoryId(),
            job.reference(),
            job.status(),
            job.elementIds(),
            job.result(),
            job.error(),
            job.deepAnalysis(),
            job.startedAt(),
            job.completedAt(),
            job.createdAt()
        );
    }
}
