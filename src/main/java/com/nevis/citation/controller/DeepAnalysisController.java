package com.nevis.citation.controller;

import com.nevis.citation.model.DeepAnalysisResult;
import com.nevis.citation.model.RequestContext;
import com.nevis.citation.service.DeepAnalysisService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@RestController
@RequestMapping("/search-histories/{searchHistoryId}/deep-analyses")
public class DeepAnalysisController {

    private final DeepAnalysisService deepAnalysisService;
    private final Executor jobExecutor;

    public DeepAnalysisController(
        DeepAnalysisService deepAnalysisService,
        @Qualifier("citationJobExecutor") Executor jobExecutor
    ) {
        this.deepAnalysisService = deepAnalysisService;
        this.jobExecutor = jobExecutor;
    }

    /**
     * Model calls take seconds per element, so the request thread is released while they run.
     */
    @PostMapping
    public CompletableFuture<ResponseEntity<DeepAnalysisResult>> analyze(
        RequestContext context,
        @PathVariable UUID searchHistoryId,
        @Valid @RequestBody DeepAnalysisRequest request) {

        return CompletableFuture.supplyAsync(
            () -> deepAnalysisService.analyze(context, searchHistoryId, request.reference(),
                Optional.ofNullable(request.limit())),
            jobExecutor
        ).thenApply(ResponseEntity::ok);
    }

    @GetMapping("/{reference}")
    public ResponseEntity<DeepAnalysisResult> getDeepAnalysis(
        RequestContext context,
        @PathVariable UUID searchHistoryId,
        @PathVariable String reference) {

        return ResponseEntity.ok(deepAnalysisService.getDeepAnalysis(context, searchHistoryId, reference));
    }
}
