package com.nevis.citation.service;

import com.nevis.citation.config.CitationProperties;
import com.nevis.citation.exception.InvalidElementException;
import com.nevis.citation.exception.JobTimeoutException;
import com.nevis.citation.exception.ReferenceUnavailableException;
import com.nevis.citation.model.CitationJob;
import com.nevis.citation.model.CitationJobResult;
import com.nevis.citation.model.CitationMatch;
import com.nevis.citation.model.ClaimElement;
import com.nevis.citation.model.ElementFailure;
import com.nevis.citation.model.JobError;
import com.nevis.citation.model.JobErrorCode;
import com.nevis.citation.model.ReferenceDocument;
import com.nevis.citation.repository.CitationJobRepository;
import com.nevis.citation.source.ClaimSource;
import com.nevis.citation.source.ReferenceSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

@Service
@Slf4j
public class CitationJobExecutorImpl implements CitationJobExecutor {

    private record ElementOutcome(String elementId, CitationMatch match, Throwable error) {
        boolean succeeded() {
            return error == null;
        }
    }

    private final CitationJobRepository jobRepository;
    private final CitationJobService jobService;
    private final ClaimSource claimSource;
    private final ReferenceSource referenceSource;
    private final ReferenceMatcher matcher;
    private final Executor matchExecutor;
    private final Duration processingTimeout;

    public CitationJobExecutorImpl(
        CitationJobRepository jobRepository,
        CitationJobService jobService,
        ClaimSource claimSource,
        ReferenceSource referenceSource,
        ReferenceMatcher matcher,
        @Qualifier("citationMatchExecutor") Executor matchExecutor,
        CitationProperties properties
    ) {
        this.jobRepository = jobRepository;
        this.jobService = jobService;
        this.claimSource = claimSource;
        this.referenceSource = referenceSource;
        this.matcher = matcher;
        this.matchExecutor = matchExecutor;
        this.processingTimeout = properties.job().processingTimeout();
    }

    @Override
    public void run(UUID jobId) {
        Optional<CitationJob> claimed = jobRepository.claimForProcessing(jobId);
        if (claimed.isEmpty()) {
            log.info("Job {}: not pending anymore, skipping", jobId);
            return;
        }

        CitationJob job = claimed.get();
        log.info("Job {}: processing reference {} for search {}", jobId, job.reference(), job.searchHistoryId());

        try {
            CitationJobResult result = process(job);

            if (result.matches().isEmpty() && result.isPartial()) {
                String reasons = result.failures().stream()
                    .map(f -> f.elementId() + ": " + f.reason())
                    .collect(Collectors.joining("; "));
                fail(job, new JobError(JobErrorCode.ALL_ELEMENTS_FAILED, "Every claim element failed: " + reasons));
                return;
            }
            if (result.isPartial()) {
                log.warn("Job {}: {} of {} elements failed", jobId, result.failures().size(),
                    result.failures().size() + result.matches().size());
            }

            if (jobService.recordCompletion(jobId, result)) {
                log.info("Job {}: completed with {} matches", jobId, result.matches().size());
            } else {
                log.warn("Job {}: no longer processing, dropping late result", jobId);
            }
        } catch (ReferenceUnavailableException e) {
            log.error("Job {}: reference {} unavailable", jobId, job.reference(), e);
            fail(job, new JobError(JobErrorCode.REFERENCE_UNAVAILABLE, e.getMessage()));
        } catch (InvalidElementException e) {
            log.error("Job {}: invalid element scope", jobId, e);
            fail(job, new JobError(JobErrorCode.INVALID_ELEMENT, e.getMessage()));
        } catch (JobTimeoutException e) {
            log.error("Job {}: timed out", jobId, e);
            fail(job, new JobError(JobErrorCode.JOB_TIMEOUT, e.getMessage()));
        } catch (Exception e) {
            log.error("Job {}: unexpected failure", jobId, e);
            fail(job, new JobError(JobErrorCode.INTERNAL_ERROR, e.getMessage()));
        }
    }

    private CitationJobResult process(CitationJob job) {
        List<ClaimElement> elements = claimSource.getClaim(job.searchHistoryId()).elementsInScope(job.elementIds());
        ReferenceDocument reference = referenceSource.getReference(job.reference());

        // the budget covers submission too, which runs on this thread when the match pool is full
        long deadline = System.nanoTime() + processingTimeout.toNanos();
        List<CompletableFuture<ElementOutcome>> futures = elements.stream()
            .map(element -> CompletableFuture
                .supplyAsync(() -> matcher.match(element, reference), matchExecutor)
                .handle((match, error) -> new ElementOutcome(element.id(), match, unwrap(error))))
            .toList();

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            futures.forEach(f -> f.cancel(true));
            throw new JobTimeoutException(job.id(), processingTimeout);
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while matching job " + job.id(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Element matching crashed for job " + job.id(), e.getCause());
        }

        List<ElementOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();

        // the document is shared by every element, so one unreadable answer fails the whole job
        outcomes.stream()
            .map(ElementOutcome::error)
            .filter(ReferenceUnavailableException.class::isInstance)
            .findFirst()
            .ifPresent(error -> {
                throw (ReferenceUnavailableException) error;
            });

        List<CitationMatch> matches = outcomes.stream()
            .filter(ElementOutcome::succeeded)
            .map(o -> o.match().assignedTo(UUID.randomUUID(), job.searchHistoryId(), job.id()))
            .sorted(CitationMatch.RANKING)
            .toList();

        List<ElementFailure> failures = outcomes.stream()
            .filter(o -> !o.succeeded())
            .peek(o -> log.warn("Job {}: element {} failed: {}", job.id(), o.elementId(), reason(o.error())))
            .map(o -> new ElementFailure(o.elementId(), reason(o.error())))
            .toList();

        return new CitationJobResult(matches, failures);
    }

    private void fail(CitationJob job, JobError error) {
        if (!jobService.recordFailure(job.id(), error)) {
            log.warn("Job {}: already terminal, dropping failure {}", job.id(), error.code());
        }
    }

    private static String reason(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
