package com.nevis.citation.model;

public record ElementFailure(
    String elementId,
    String reason
) {}
