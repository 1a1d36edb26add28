package com.nevis.citation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record WorkspaceInvalidationRequest(
    @JsonProperty("search_history_id")
    UUID searchHistoryId
) {}
