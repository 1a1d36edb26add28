package com.nevis.citation.worker;

import com.nevis.citation.CitationFixtures;
import com.nevis.citation.event.CitationJobEnqueuedEvent;
import com.nevis.citation.model.JobError;
import com.nevis.citation.model.JobErrorCode;
import com.nevis.citation.repository.CitationJobRepository;
import com.nevis.citation.service.SearchHistoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CitationJobMaintenanceWorkerTest {

    @Mock
    private CitationJobRepository jobRepository;
    @Mock
    private SearchHistoryService searchHistoryService;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private CitationJobMaintenanceWorker worker;

    @BeforeEach
    void setUp() {
        worker = new CitationJobMaintenanceWorker(jobRepository, searchHistoryService, eventPublisher,
            CitationFixtures.properties());
    }

    @Test
    @DisplayName("Timed-out jobs are failed and each affected search is invalidated once")
    void failsTimedOutJobs() {
        UUID searchId = UUID.randomUUID();
        UUID job1 = UUID.randomUUID();
        UUID job2 = UUID.randomUUID();
        when(jobRepository.failStaleProcessing(eq(Duration.ofSeconds(2)), any())).thenReturn(List.of(job1, job2));
        when(jobRepository.findById(job1)).thenReturn(Optional.of(CitationFixtures.processingJob(job1, searchId, "US1")));
        when(jobRepository.findById(job2)).thenReturn(Optional.of(CitationFixtures.processingJob(job2, searchId, "US2")));

        worker.failTimedOutJobs();

        ArgumentCaptor<JobError> error = ArgumentCaptor.forClass(JobError.class);
        verify(jobRepository).failStaleProcessing(eq(Duration.ofSeconds(2)), error.capture());
        assertThat(error.getValue().code()).isEqualTo(JobErrorCode.JOB_TIMEOUT);
        verify(searchHistoryService, times(1)).invalidateArtifacts(searchId);
    }

    @Test
    @DisplayName("Nothing timed out means nothing to invalidate")
    void noTimedOutJobs() {
        when(jobRepository.failStaleProcessing(any(), any())).thenReturn(List.of());

        worker.failTimedOutJobs();

        verifyNoInteractions(searchHistoryService);
    }

    @Test
    @DisplayName("Orphaned pending jobs are dispatched again")
    void redispatchesOrphans() {
        UUID job1 = UUID.randomUUID();
        UUID job2 = UUID.randomUUID();
        when(jobRepository.findOrphanedPending(Duration.ofMinutes(2))).thenReturn(List.of(job1, job2));

        worker.redispatchOrphanedJobs();

        verify(eventPublisher).publishEvent(new CitationJobEnqueuedEvent(job1));
        verify(eventPublisher).publishEvent(new CitationJobEnqueuedEvent(job2));
        verify(eventPublisher, times(2)).publishEvent(any(CitationJobEnqueuedEvent.class));
    }

    @Test
    @DisplayName("No orphans means no events")
    void noOrphans() {
        when(jobRepository.findOrphanedPending(any())).thenReturn(List.of());

        worker.redispatchOrphanedJobs();

        verifyNoInteractions(eventPublisher);
    }
}
