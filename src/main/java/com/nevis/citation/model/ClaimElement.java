package com.nevis.citation.model;

public record ClaimElement(
    String id,
    String text,
    int order
) {}
