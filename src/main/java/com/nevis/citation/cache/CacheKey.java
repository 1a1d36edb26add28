package com.nevis.citation.cache;

import com.nevis.citation.model.RequestContext;
import com.nevis.citation.model.SearchHistory;

import java.util.Objects;
import java.util.UUID;

/**
 * Cache key composed as {@code tenant:project:searchHistoryId:kind:artifactId}. The
 * segment layout lets a single pattern address one artifact, one kind within a search, a
 * whole search or a whole project.
 */
public record CacheKey(
    String tenantId,
    String projectId,
    UUID searchHistoryId,
    ArtifactKind kind,
    String artifactId
) {
    static final String SEPARATOR = ":";
    static final String WILDCARD = "*";

    public CacheKey {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(searchHistoryId, "searchHistoryId");
        Objects.requireNonNull(kind, "kind");
        artifactId = artifactId == null || artifactId.isBlank() ? "_" : artifactId;
    }

    public static CacheKey of(SearchHistory search, ArtifactKind kind, String artifactId) {
        return new CacheKey(search.tenantId(), search.projectId(), search.id(), kind, artifactId);
    }

    public static String searchPattern(SearchHistory search) {
        return String.join(SEPARATOR, search.tenantId(), search.projectId(), search.id().toString(), WILDCARD);
    }

    public static String kindPattern(SearchHistory search, ArtifactKind kind) {
        return String.join(SEPARATOR, search.tenantId(), search.projectId(), search.id().toString(),
            kind.name(), WILDCARD);
    }

    public static String projectPattern(RequestContext context) {
        return String.join(SEPARATOR, context.tenantId(), context.projectId(), WILDCARD);
    }

    public String asString() {
        return String.join(SEPARATOR, tenantId, projectId, searchHistoryId.toString(), kind.name(), artifactId);
    }
}
