package com.nevis.citation.event;

import java.util.UUID;

public record CitationJobEnqueuedEvent(UUID jobId) {}
