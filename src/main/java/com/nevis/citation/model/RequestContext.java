package com.nevis.citation.model;

/**
 * Caller identity handed over by the auth boundary. Trusted as-is.
 */
public record RequestContext(
    String tenantId,
    String projectId,
    String userId
) {}
