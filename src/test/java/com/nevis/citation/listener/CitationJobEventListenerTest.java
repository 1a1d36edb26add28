package com.nevis.citation.listener;

import com.nevis.citation.event.CitationJobEnqueuedEvent;
import com.nevis.citation.service.CitationJobExecutor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class CitationJobEventListenerTest {

    @Mock
    private CitationJobExecutor jobExecutor;

    @Test
    void shouldRunEnqueuedJob() {
        UUID jobId = UUID.randomUUID();
        CitationJobEventListener listener = new CitationJobEventListener(jobExecutor, new SyncTaskExecutor());

        listener.handleEnqueued(new CitationJobEnqueuedEvent(jobId));

        verify(jobExecutor).run(jobId);
    }

    @Test
    void saturatedExecutorLeavesJobPending() {
        CitationJobEventListener listener = new CitationJobEventListener(jobExecutor, task -> {
            throw new TaskRejectedException("queue full");
        });

        assertThatCode(() -> listener.handleEnqueued(new CitationJobEnqueuedEvent(UUID.randomUUID())))
            .doesNotThrowAnyException();

        verifyNoInteractions(jobExecutor);
    }
}
