package com.nevis.citation.service;

import com.nevis.citation.cache.ArtifactKind;
import com.nevis.citation.cache.CacheKey;
import com.nevis.citation.cache.ResultCache;
import com.nevis.citation.config.CitationProperties;
import com.nevis.citation.exception.EntityNotFoundException;
import com.nevis.citation.model.CitationJob;
import com.nevis.citation.model.CitationMatch;
import com.nevis.citation.model.Claim;
import com.nevis.citation.model.DeepAnalysisResult;
import com.nevis.citation.model.RequestContext;
import com.nevis.citation.model.SearchHistory;
import com.nevis.citation.repository.CitationJobRepository;
import com.nevis.citation.repository.CitationMatchRepository;
import com.nevis.citation.source.ClaimSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
public class DeepAnalysisServiceImpl implements DeepAnalysisService {

    private final SearchHistoryService searchHistoryService;
    private final CitationJobService jobService;
    private final CitationJobRepository jobRepository;
    private final CitationMatchRepository matchRepository;
    private final ClaimSource claimSource;
    private final DeepAnalysisEscalator escalator;
    private final ResultCache resultCache;
    private final int defaultLimit;

    public DeepAnalysisServiceImpl(
        SearchHistoryService searchHistoryService,
        CitationJobService jobService,
        CitationJobRepository jobRepository,
        CitationMatchRepository matchRepository,
        ClaimSource claimSource,
        DeepAnalysisEscalator escalator,
        ResultCache resultCache,
        CitationProperties properties
    ) {
        this.searchHistoryService = searchHistoryService;
        this.jobService = jobService;
        this.jobRepository = jobRepository;
        this.matchRepository = matchRepository;
        this.claimSource = claimSource;
        this.escalator = escalator;
        this.resultCache = resultCache;
        this.defaultLimit = properties.deepAnalysis().defaultLimit();
    }

    @Override
    public DeepAnalysisResult analyze(RequestContext context, UUID searchHistoryId, String reference, Optional<Integer> limit) {
        searchHistoryService.requireSearch(context, searchHistoryId);

        CitationJob job = jobRepository.findLatestCompleted(searchHistoryId, reference)
            .orElseThrow(() -> new EntityNotFoundException(searchHistoryId,
                "No completed citation job for reference " + reference));

        Claim claim = claimSource.getClaim(searchHistoryId);
        List<CitationMatch> matches = matchRepository.findByJob(job.id());
        int effectiveLimit = limit.filter(l -> l > 0).orElse(defaultLimit);

        DeepAnalysisResult result = escalator.escalate(claim, reference, matches, effectiveLimit);
        List<UUID> escalatedIds = escalator.select(matches, effectiveLimit).stream()
            .map(CitationMatch::id)
            .toList();

        if (jobService.recordDeepAnalysis(job.id(), escalatedIds, result)) {
            log.info("Search {}: deep analysis of {} stored on job {} ({} matches, relevance {})",
                searchHistoryId, reference, job.id(), escalatedIds.size(), result.overallRelevance());
        } else {
            log.warn("Search {}: job {} left COMPLETED during deep analysis, result not stored", searchHistoryId, job.id());
        }
        return result;
    }

    @Override
    public DeepAnalysisResult getDeepAnalysis(RequestContext context, UUID searchHistoryId, String reference) {
        SearchHistory search = searchHistoryService.requireSearch(context, searchHistoryId);

        DeepAnalysisResult result = resultCache.getOrLoad(
            CacheKey.of(search, ArtifactKind.DEEP_ANALYSIS, reference),
            DeepAnalysisResult.class,
            () -> jobRepository.findLatestDeepAnalyses(searchHistoryId, List.of(reference)).get(reference)
        );
        if (result == null) {
            throw new EntityNotFoundException(searchHistoryId, "No deep analysis for reference " + reference);
        }
        return result;
    }
}
