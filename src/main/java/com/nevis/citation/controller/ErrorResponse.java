package com.nevis.citation.controller;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

public record ErrorResponse(
    String message,
    int status,
    long timestamp,

    @JsonInclude(JsonInclude.Include.NON_NULL)
    Map<String, Object> details
) {
    public ErrorResponse(String message, int status) {
        this(message, status, Instant.now().toEpochMilli(), null);
    }

    public ErrorResponse(String message, int status, Map<String, Object> details) {
        this(message, status, Instant.now().toEpochMilli(), details);
    }
}
