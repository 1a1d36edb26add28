package com.nevis.citation.listener;

import com.nevis.citation.event.CitationJobEnqueuedEvent;
import com.nevis.citation.service.CitationJobExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.concurrent.Executor;

@Component
@Slf4j
public class CitationJobEventListener {

    private final CitationJobExecutor jobExecutor;
    private final Executor executor;

    public CitationJobEventListener(
        CitationJobExecutor jobExecutor,
        @Qualifier("citationJobExecutor") Executor executor
    ) {
        this.jobExecutor = jobExecutor;
        this.executor = executor;
    }

    /**
     * Hands the job to the job pool without waiting for a free slot. A rejected job is left
     * PENDING for the maintenance worker's redispatch.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleEnqueued(CitationJobEnqueuedEvent event) {
        try {
            executor.execute(() -> {
                log.info("Starting async citation job: {}", event.jobId());
                jobExecutor.run(event.jobId());
            });
        } catch (TaskRejectedException e) {
            log.warn("Job {}: executor saturated, leaving it pending for redispatch", event.jobId());
        }
    }
}
