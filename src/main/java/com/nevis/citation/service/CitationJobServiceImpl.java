package com.nevis.citation.service;

import com.nevis.citation.config.CitationProperties;
import com.nevis.citation.event.CitationJobEnqueuedEvent;
import com.nevis.citation.exception.DuplicateJobException;
import com.nevis.citation.exception.EntityNotFoundException;
import com.nevis.citation.model.CitationJob;
import com.nevis.citation.model.CitationJobResult;
import com.nevis.citation.model.CitationJobStatus;
import com.nevis.citation.model.Claim;
import com.nevis.citation.model.DeepAnalysisResult;
import com.nevis.citation.model.JobError;
import com.nevis.citation.model.JobStatusCounts;
import com.nevis.citation.model.RequestContext;
import com.nevis.citation.repository.CitationJobRepository;
import com.nevis.citation.repository.CitationMatchRepository;
import com.nevis.citation.source.ClaimSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
public class CitationJobServiceImpl implements CitationJobService {

    private static final int ENQUEUE_ATTEMPTS = 2;

    private final CitationJobRepository jobRepository;
    private final CitationMatchRepository matchRepository;
    private final SearchHistoryService searchHistoryService;
    private final ClaimSource claimSource;
    private final ApplicationEventPublisher eventPublisher;
    private final Duration maxAwait;
    private final Duration pollInterval;

    public CitationJobServiceImpl(
        CitationJobRepository jobRepository,
        CitationMatchRepository matchRepository,
        SearchHistoryService searchHistoryService,
        ClaimSource claimSource,
        ApplicationEventPublisher eventPublisher,
        CitationProperties properties
    ) {
        this.jobRepository = jobRepository;
        this.matchRepository = matchRepository;
        this.searchHistoryService = searchHistoryService;
        this.claimSource = claimSource;
        this.eventPublisher = eventPublisher;
        this.maxAwait = properties.job().maxAwait();
        this.pollInterval = properties.job().awaitPollInterval();
    }

    @Override
    @Transactional
    public CitationJob enqueue(RequestContext context, UUID searchHistoryId, String reference, List<String> elementIds) {
        searchHistoryService.requireSearch(context, searchHistoryId);

        List<String> scope = elementIds == null || elementIds.isEmpty() ? null : List.copyOf(elementIds);
        Claim claim = claimSource.getClaim(searchHistoryId);
        if (scope != null) {
            claim.elementsInScope(scope);
        }

        CitationJob job = insertOrReportDuplicate(searchHistoryId, reference, scope, claim.textHash());

        log.info("Search {}: enqueued citation job {} for reference {}", searchHistoryId, job.id(), reference);
        eventPublisher.publishEvent(new CitationJobEnqueuedEvent(job.id()));
        return job;
    }

    private CitationJob insertOrReportDuplicate(UUID searchHistoryId, String reference, List<String> scope,
                                                String claimHash) {
        for (int attempt = 1; attempt <= ENQUEUE_ATTEMPTS; attempt++) {
            Optional<CitationJob> created = jobRepository.createIfNoneInFlight(searchHistoryId, reference, scope, claimHash);
            if (created.isPresent()) {
                return created.get();
            }
            Optional<CitationJob> existing = jobRepository.findInFlight(searchHistoryId, reference);
            if (existing.isPresent()) {
                log.info("Search {}: job {} for {} already {}",
                    searchHistoryId, existing.get().id(), reference, existing.get().status());
                throw new DuplicateJobException(existing.get());
            }
            // the conflicting job finished between the insert and the lookup
            log.debug("Search {}: in-flight job for {} finished during enqueue, retrying", searchHistoryId, reference);
        }
        throw new IllegalStateException("Could not enqueue a job for " + reference + " in search " + searchHistoryId);
    }

    @Override
    public CitationJob awaitTerminal(RequestContext context, UUID jobId, Duration maxWait) {
        Duration wait = maxWait.compareTo(maxAwait) > 0 ? maxAwait : maxWait;
        long deadline = System.nanoTime() + wait.toNanos();

        CitationJob job = getJob(context, jobId);
        while (!job.isTerminal() && System.nanoTime() < deadline) {
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            job = getJob(context, jobId);
        }
        return job;
    }

    @Override
    @Transactional(readOnly = true)
    public CitationJob getJob(RequestContext context, UUID jobId) {
        CitationJob job = jobRepository.findById(jobId)
            .orElseThrow(() -> {
                log.warn("Citation job not found: {}", jobId);
                return new EntityNotFoundException(jobId);
            });
        searchHistoryService.requireSearch(context, job.searchHistoryId());
        return job;
    }

    @Override
    @Transactional(readOnly = true)
    public List<CitationJob> listJobs(RequestContext context, UUID searchHistoryId, Optional<CitationJobStatus> status) {
        searchHistoryService.requireSearch(context, searchHistoryId);
        return jobRepository.findBySearchHistory(searchHistoryId, status);
    }

    @Override
    @Transactional(readOnly = true)
    public JobStatusCounts countByStatus(RequestContext context, UUID searchHistoryId) {
        searchHistoryService.requireSearch(context, searchHistoryId);
        return jobRepository.countByStatus(searchHistoryId);
    }

    @Override
    @Transactional
    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 200))
    public boolean recordCompletion(UUID jobId, CitationJobResult result) {
        if (!jobRepository.complete(jobId, result)) {
            return false;
        }
        matchRepository.saveAll(result.matches());
        jobRepository.findById(jobId)
            .ifPresent(job -> searchHistoryService.invalidateArtifacts(job.searchHistoryId()));
        return true;
    }

    @Override
    public boolean recordFailure(UUID jobId, JobError error) {
        boolean failed = jobRepository.fail(jobId, error);
        if (failed) {
            jobRepository.findById(jobId)
                .ifPresent(job -> searchHistoryService.invalidateArtifacts(job.searchHistoryId()));
        }
        return failed;
    }

    @Override
    @Transactional
    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 200))
    public boolean recordDeepAnalysis(UUID jobId, Collection<UUID> matchIds, DeepAnalysisResult result) {
        if (!jobRepository.saveDeepAnalysis(jobId, result)) {
            return false;
        }
        matchRepository.attachDeepAnalysis(matchIds, result);
        jobRepository.findById(jobId)
            .ifPresent(job -> searchHistoryService.invalidateArtifacts(job.searchHistoryId()));
        return true;
    }
}
