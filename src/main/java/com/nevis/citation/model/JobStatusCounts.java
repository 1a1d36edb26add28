package com.nevis.citation.model;

public record JobStatusCounts(
    long total,
    long pending,
    long processing,
    long completed,
    long failed
) {}
