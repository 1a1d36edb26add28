package com.nevis.citation.service;

import com.nevis.citation.model.RequestContext;
import com.nevis.citation.model.SearchHistory;

import java.util.Optional;
import java.util.UUID;

public interface SearchHistoryService {

    /**
     * Resolves a live search session owned by the caller's tenant and project.
     *
     * @throws com.nevis.citation.exception.EntityNotFoundException when missing or deleted
     * @throws com.nevis.citation.exception.TenantMismatchException when owned by someone else
     */
    SearchHistory requireSearch(RequestContext context, UUID searchHistoryId);

    void deleteSearch(RequestContext context, UUID searchHistoryId);

    int notifyWorkspaceChanged(RequestContext context, Optional<UUID> searchHistoryId);

    /**
     * Drops every cached artifact of a search, regardless of caller. Used by background work.
     */
    void invalidateArtifacts(UUID searchHistoryId);
}
