package com.nevis.citation.cache;

public enum ArtifactKind {
    TOP_MATCHES,
    CONSOLIDATED,
    MATCHES,
    DEEP_ANALYSIS,
    COMBINED_ANALYSES
}
