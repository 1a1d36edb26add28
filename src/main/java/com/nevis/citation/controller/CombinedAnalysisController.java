package com.nevis.citation.controller;

import com.nevis.citation.model.CombinedAnalysisRecord;
import com.nevis.citation.model.RequestContext;
import com.nevis.citation.service.CombinedAnalysisService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/search-histories/{searchHistoryId}/combined-analyses")
@RequiredArgsConstructor
public class CombinedAnalysisController {

    private final CombinedAnalysisService combinedAnalysisService;

    @PostMapping
    public ResponseEntity<CombinedAnalysisRecord> combine(
        RequestContext context,
        @PathVariable UUID searchHistoryId,
        @Valid @RequestBody CombinedAnalysisRequest request) {

        CombinedAnalysisRecord record = combinedAnalysisService.combine(
            context,
            searchHistoryId,
            request.claim1Text(),
            request.referenceNumbers()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }

    @GetMapping
    public ResponseEntity<CombinedAnalysesResponse> list(RequestContext context, @PathVariable UUID searchHistoryId) {
        return ResponseEntity.ok(new CombinedAnalysesResponse(
            combinedAnalysisService.listCombined(context, searchHistoryId)));
    }
}
