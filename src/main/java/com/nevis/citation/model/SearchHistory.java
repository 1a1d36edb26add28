package com.nevis.citation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SearchHistory(
    UUID id,
    String tenantId,
    String projectId,
    String query,
    OffsetDateTime invalidatedAt,
    OffsetDateTime createdAt
) {
    @JsonIgnore
    public boolean isInvalidated() {
        return invalidatedAt != null;
    }
}
