package com.nevis.citation.model;

public record LocationSnippet(
    String section,
    String text,
    String context
) {}
