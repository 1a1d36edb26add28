package com.nevis.citation.worker;

import com.nevis.citation.config.CitationProperties;
import com.nevis.citation.event.CitationJobEnqueuedEvent;
import com.nevis.citation.model.CitationJob;
import com.nevis.citation.model.JobError;
import com.nevis.citation.model.JobErrorCode;
import com.nevis.citation.repository.CitationJobRepository;
import com.nevis.citation.service.SearchHistoryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Component
@Slf4j
public class CitationJobMaintenanceWorker {

    private final CitationJobRepository jobRepository;
    private final SearchHistoryService searchHistoryService;
    private final ApplicationEventPublisher eventPublisher;
    private final Duration processingTimeout;
    private final Duration pendingRedispatchAfter;

    public CitationJobMaintenanceWorker(
        CitationJobRepository jobRepository,
        SearchHistoryService searchHistoryService,
        ApplicationEventPublisher eventPublisher,
        CitationProperties properties
    ) {
        this.jobRepository = jobRepository;
        this.searchHistoryService = searchHistoryService;
        this.eventPublisher = eventPublisher;
        this.processingTimeout = properties.job().processingTimeout();
        this.pendingRedispatchAfter = properties.job().pendingRedispatchAfter();
    }

    @Scheduled(fixedDelayString = "${app.citation.job.sweep-interval-ms:30000}")
    public void failTimedOutJobs() {
        log.debug("Starting maintenance: checking for jobs stuck in PROCESSING...");

        List<UUID> timedOut = jobRepository.failStaleProcessing(processingTimeout,
            new JobError(JobErrorCode.JOB_TIMEOUT, "Processing exceeded " + processingTimeout));

        if (timedOut.isEmpty()) {
            return;
        }

        Set<UUID> searchIds = new LinkedHashSet<>();
        timedOut.forEach(id -> jobRepository.findById(id)
            .map(CitationJob::searchHistoryId)
            .ifPresent(searchIds::add));

        log.warn("Maintenance failed {} timed-out jobs across {} searches", timedOut.size(), searchIds.size());
        searchIds.forEach(searchHistoryService::invalidateArtifacts);
    }

    @Scheduled(fixedDelayString = "${app.citation.job.sweep-interval-ms:30000}")
    public void redispatchOrphanedJobs() {
        List<UUID> orphaned = jobRepository.findOrphanedPending(pendingRedispatchAfter);

        if (!orphaned.isEmpty()) {
            log.info("Re-dispatching {} pending jobs that were never picked up", orphaned.size());
            orphaned.forEach(id -> eventPublisher.publishEvent(new CitationJobEnqueuedEvent(id)));
        }
    }
}
