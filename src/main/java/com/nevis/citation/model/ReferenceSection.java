package com.nevis.citation.model;

public record ReferenceSection(
    String section,
    String text
) {}
