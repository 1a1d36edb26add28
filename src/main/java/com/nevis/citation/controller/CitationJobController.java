package com.nevis.citation.controller;

import com.nevis.citation.model.CitationJob;
import com.nevis.citation.model.CitationJobStatus;
import com.nevis.citation.model.JobStatusCounts;
import com.nevis.citation.model.RequestContext;
import com.nevis.citation.service.CitationJobService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class CitationJobController {

    private final CitationJobService jobService;

    @PostMapping("/search-histories/{searchHistoryId}/citation-jobs")
    public ResponseEntity<CitationJobResponse> enqueue(
        RequestContext context,
        @PathVariable UUID searchHistoryId,
        @RequestParam(name = "await_ms", required = false) Long awaitMs,
        @Valid @RequestBody CitationJobRequest request) {

        CitationJob job = jobService.enqueue(context, searchHistoryId, request.reference(), request.elementIds());

        if (awaitMs != null && awaitMs > 0) {
            job = jobService.awaitTerminal(context, job.id(), Duration.ofMillis(awaitMs));
        }

        HttpStatus status = job.isTerminal() ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(CitationJobResponse.from(job));
    }

    @GetMapping("/citation-jobs/{jobId}")
    public ResponseEntity<CitationJobResponse> getJob(RequestContext context, @PathVariable UUID jobId) {
        return ResponseEntity.ok(CitationJobResponse.from(jobService.getJob(context, jobId)));
    }

    @GetMapping("/search-histories/{searchHistoryId}/citation-jobs")
    public ResponseEntity<List<CitationJobResponse>> listJobs(
        RequestContext context,
        @PathVariable UUID searchHistoryId,
        @RequestParam(name = "status", required = false) CitationJobStatus status) {

        List<CitationJobResponse> jobs = jobService.listJobs(context, searchHistoryId, Optional.ofNullable(status))
            .stream()
            .map(CitationJobResponse::from)
            .toList();
        return ResponseEntity.ok(jobs);
    }

    @GetMapping("/search-histories/{searchHistoryId}/citation-jobs/counts")
    public ResponseEntity<JobStatusCounts> countJobs(RequestContext context, @PathVariable UUID searchHistoryId) {
        return ResponseEntity.ok(jobService.countByStatus(context, searchHistoryId));
    }
}
