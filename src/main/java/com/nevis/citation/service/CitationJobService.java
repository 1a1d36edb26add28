package com.nevis.citation.service;

import com.nevis.citation.model.CitationJob;
import com.nevis.citation.model.CitationJobResult;
import com.nevis.citation.model.CitationJobStatus;
import com.nevis.citation.model.DeepAnalysisResult;
import com.nevis.citation.model.JobError;
import com.nevis.citation.model.JobStatusCounts;
import com.nevis.citation.model.RequestContext;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CitationJobService {

    /**
     * Creates a PENDING job and schedules it once the transaction commits.
     *
     * @throws com.nevis.citation.exception.DuplicateJobException when a job for the same
     *         reference is already pending or processing
     */
    CitationJob enqueue(RequestContext context, UUID searchHistoryId, String reference, List<String> elementIds);

    /**
     * Polls the job until it is terminal or the wait elapses, whichever comes first.
     */
    CitationJob awaitTerminal(RequestContext context, UUID jobId, Duration maxWait);

    CitationJob getJob(RequestContext context, UUID jobId);

    List<CitationJob> listJobs(RequestContext context, UUID searchHistoryId, Optional<CitationJobStatus> status);

    JobStatusCounts countByStatus(RequestContext context, UUID searchHistoryId);

    boolean recordCompletion(UUID jobId, CitationJobResult result);

    boolean recordFailure(UUID jobId, JobError error);

    boolean recordDeepAnalysis(UUID jobId, Collection<UUID> matchIds, DeepAnalysisResult result);
}
