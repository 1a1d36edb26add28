package com.nevis.citation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record CitationJob(
    UUID id,
    UUID searchHistoryId,
    String reference,
    CitationJobStatus status,
    List<String> elementIds,
    String claimHash,
    CitationJobResult result,
    JobError error,
    DeepAnalysisResult deepAnalysis,
    OffsetDateTime startedAt,
    OffsetDateTime completedAt,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {
    public CitationJob {
        if (status == CitationJobStatus.COMPLETED && (result == null || error != null)) {
            throw new IllegalArgumentException("Completed job " + id + " must carry a result and no error");
        }
        if (status == CitationJobStatus.FAILED && (error == null || result != null)) {
            throw new IllegalArgumentException("Failed job " + id + " must carry an error and no result");
        }
        elementIds = elementIds == null ? null : List.copyOf(elementIds);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
