package com.nevis.citation.repository;

import com.nevis.citation.model.CitationJob;
import com.nevis.citation.model.CitationJobResult;
import com.nevis.citation.model.CitationJobStatus;
import com.nevis.citation.model.DeepAnalysisResult;
import com.nevis.citation.model.JobError;
import com.nevis.citation.model.JobStatusCounts;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public interface CitationJobRepository {

    /**
     * Atomically creates a PENDING job unless a PENDING or PROCESSING job already exists for
     * the same search and reference. Empty when the insert lost to an in-flight job.
     */
    Optional<CitationJob> createIfNoneInFlight(UUID searchHistoryId, String reference, List<String> elementIds,
                                               String claimHash);
    Optional<CitationJob> findInFlight(UUID searchHistoryId, String reference);
    Optional<CitationJob> findById(UUID id);
    List<CitationJob> findBySearchHistory(UUID searchHistoryId, Optional<CitationJobStatus> status);
    JobStatusCounts countByStatus(UUID searchHistoryId);

    Optional<CitationJob> claimForProcessing(UUID id);
    boolean complete(UUID id, CitationJobResult result);
    boolean fail(UUID id, JobError error);
    List<UUID> failStaleProcessing(Duration timeout, JobError error);
    List<UUID> findOrphanedPending(Duration olderThan);
    int failInFlightForSearch(UUID searchHistoryId, JobError error);

    Optional<CitationJob> findLatestCompleted(UUID searchHistoryId, String reference);
    boolean saveDeepAnalysis(UUID id, DeepAnalysisResult deepAnalysis);
    Map<String, DeepAnalysisResult> findLatestDeepAnalyses(UUID searchHistoryId, Collection<String> references);

    /**
     * Latest deep analysis per reference among jobs enqueued against the given claim hash.
     */
    Map<String, DeepAnalysisResult> findLatestDeepAnalyses(UUID searchHistoryId, Collection<String> references,
                                                           String claimHash);
}
