package com.nevis.citation.service;

import com.nevis.citation.cache.CacheKey;
import com.nevis.citation.cache.ResultCache;
import com.nevis.citation.exception.EntityNotFoundException;
import com.nevis.citation.exception.TenantMismatchException;
import com.nevis.citation.model.JobError;
import com.nevis.citation.model.JobErrorCode;
import com.nevis.citation.model.RequestContext;
import com.nevis.citation.model.SearchHistory;
import com.nevis.citation.repository.CitationJobRepository;
import com.nevis.citation.repository.SearchHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class SearchHistoryServiceImpl implements SearchHistoryService {

    private final SearchHistoryRepository searchHistoryRepository;
    private final CitationJobRepository jobRepository;
    private final ResultCache resultCache;

    @Override
    @Transactional(readOnly = true)
    public SearchHistory requireSearch(RequestContext context, UUID searchHistoryId) {
        SearchHistory search = searchHistoryRepository.findById(searchHistoryId)
            .filter(s -> !s.isInvalidated())
            .orElseThrow(() -> {
                log.warn("Search history not found or deleted: {}", searchHistoryId);
                return new EntityNotFoundException(searchHistoryId);
            });

        if (!search.tenantId().equals(context.tenantId()) || !search.projectId().equals(context.projectId())) {
            log.warn("Tenant {} / project {} tried to access search {}",
                context.tenantId(), context.projectId(), searchHistoryId);
            throw new TenantMismatchException(searchHistoryId);
        }
        return search;
    }

    @Override
    @Transactional
    public void deleteSearch(RequestContext context, UUID searchHistoryId) {
        SearchHistory search = requireSearch(context, searchHistoryId);

        searchHistoryRepository.markInvalidated(searchHistoryId);
        int failed = jobRepository.failInFlightForSearch(searchHistoryId,
            new JobError(JobErrorCode.SEARCH_DELETED, "Search session deleted"));

        log.info("Search {} deleted by user {}; {} in-flight jobs failed", searchHistoryId, context.userId(), failed);
        afterCommit(() -> resultCache.invalidate(CacheKey.searchPattern(search)));
    }

    @Override
    public int notifyWorkspaceChanged(RequestContext context, Optional<UUID> searchHistoryId) {
        String pattern = searchHistoryId
            .map(id -> CacheKey.searchPattern(requireSearch(context, id)))
            .orElseGet(() -> CacheKey.projectPattern(context));

        int removed = resultCache.invalidate(pattern);
        log.info("Workspace change for {}: {} cached artifacts dropped", pattern, removed);
        return removed;
    }

    @Override
    public void invalidateArtifacts(UUID searchHistoryId) {
        searchHistoryRepository.findById(searchHistoryId)
            .ifPresent(search -> afterCommit(() -> resultCache.invalidate(CacheKey.searchPattern(search))));
    }

    /**
     * Runs the action once the surrounding transaction commits, or immediately without one.
     */
    static void afterCommit(Runnable action) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    action.run();
                }
            });
        } else {
            action.run();
        }
    }
}
