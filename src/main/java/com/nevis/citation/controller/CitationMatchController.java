package com.nevis.citation.controller;

import com.nevis.citation.model.CitationMatch;
import com.nevis.citation.model.ConsolidatedCitationResults;
import com.nevis.citation.model.MatchFilter;
import com.nevis.citation.model.RequestContext;
import com.nevis.citation.service.CitationQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RestController
@RequestMapping("/search-histories/{searchHistoryId}")
@RequiredArgsConstructor
public class CitationMatchController {

    private final CitationQueryService queryService;

    @GetMapping("/matches")
    public ResponseEntity<List<CitationMatch>> listMatches(
        RequestContext context,
        @PathVariable UUID searchHistoryId,
        @RequestParam(name = "reference", required = false) String reference,
        @RequestParam(name = "min_score", required = false) Double minScore,
        @RequestParam(name = "has_deep_analysis", required = false) Boolean hasDeepAnalysis) {

        if (minScore != null && (minScore < 0 || minScore > 1)) {
            throw new IllegalArgumentException("min_score must be between 0 and 1");
        }

        MatchFilter filter = new MatchFilter(
            Optional.ofNullable(reference).filter(r -> !r.isBlank()),
            Optional.ofNullable(minScore),
            Optional.ofNullable(hasDeepAnalysis)
        );
        return ResponseEntity.ok(queryService.listMatches(context, searchHistoryId, filter));
    }

    @GetMapping("/top-matches")
    public ResponseEntity<List<CitationMatch>> topMatches(
        RequestContext context,
        @PathVariable UUID searchHistoryId,
        @RequestParam(name = "reference", required = false) String reference,
        @RequestParam(name = "limit", defaultValue = "10") int limit) {

        if (limit < 1 || limit > 100) {
            throw new IllegalArgumentException("limit must be between 1 and 100");
        }
        return ResponseEntity.ok(queryService.topMatches(context, searchHistoryId,
            Optional.ofNullable(reference).filter(r -> !r.isBlank()), limit));
    }

    @GetMapping("/citations")
    public ResponseEntity<ConsolidatedCitationResults> consolidated(RequestContext context, @PathVariable UUID searchHistoryId) {
        return ResponseEntity.ok(queryService.consolidated(context, searchHistoryId));
    }
}
