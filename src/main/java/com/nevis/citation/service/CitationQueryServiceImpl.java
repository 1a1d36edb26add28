package com.nevis.citation.service;

import com.nevis.citation.cache.ArtifactKind;
import com.nevis.citation.cache.CacheKey;
import com.nevis.citation.cache.ResultCache;
import com.nevis.citation.model.CitationMatch;
import com.nevis.citation.model.ConsolidatedCitationResults;
import com.nevis.citation.model.MatchFilter;
import com.nevis.citation.model.RequestContext;
import com.nevis.citation.model.SearchHistory;
import com.nevis.citation.repository.CitationMatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class CitationQueryServiceImpl implements CitationQueryService {

    private final SearchHistoryService searchHistoryService;
    private final CitationMatchRepository matchRepository;
    private final ResultCache resultCache;

    @Value("${app.citation.consolidated.top-limit:10}")
    private int consolidatedTopLimit;

    @Override
    public List<CitationMatch> topMatches(RequestContext context, UUID searchHistoryId, Optional<String> reference, int limit) {
        SearchHistory search = searchHistoryService.requireSearch(context, searchHistoryId);
        int effectiveLimit = Math.max(1, limit);

        return resultCache.getListOrLoad(
            CacheKey.of(search, ArtifactKind.TOP_MATCHES, reference.orElse("all") + "@" + effectiveLimit),
            CitationMatch.class,
            () -> matchRepository.findTopMatches(searchHistoryId, reference, effectiveLimit)
        );
    }

    @Override
    public ConsolidatedCitationResults consolidated(RequestContext context, UUID searchHistoryId) {
        SearchHistory search = searchHistoryService.requireSearch(context, searchHistoryId);

        return resultCache.getOrLoad(
            CacheKey.of(search, ArtifactKind.CONSOLIDATED, null),
            ConsolidatedCitationResults.class,
            () -> consolidate(searchHistoryId, matchRepository.findTopMatches(searchHistoryId, Optional.empty(), Integer.MAX_VALUE))
        );
    }

    @Override
    public List<CitationMatch> listMatches(RequestContext context, UUID searchHistoryId, MatchFilter filter) {
        SearchHistory search = searchHistoryService.requireSearch(context, searchHistoryId);
        String filterKey = filter.reference().orElse("*all*")
            + "|" + filter.minScore().map(String::valueOf).orElse("-")
            + "|" + filter.hasDeepAnalysis().map(String::valueOf).orElse("-");

        return resultCache.getListOrLoad(
            CacheKey.of(search, ArtifactKind.MATCHES, filterKey),
            CitationMatch.class,
            () -> matchRepository.findBySearchHistory(searchHistoryId, filter)
        );
    }

    private ConsolidatedCitationResults consolidate(UUID searchHistoryId, List<CitationMatch> matches) {
        Map<String, List<CitationMatch>> byReference = matches.stream()
            .sorted(CitationMatch.RANKING)
            .collect(Collectors.groupingBy(CitationMatch::reference, LinkedHashMap::new, Collectors.toList()));

        List<CitationMatch> top = matches.stream()
            .sorted(CitationMatch.RANKING)
            .limit(consolidatedTopLimit)
            .toList();

        log.debug("Search {}: consolidated {} matches across {} references", searchHistoryId, matches.size(), byReference.size());
        return new ConsolidatedCitationResults(searchHistoryId, matches.size(), byReference.size(), top, byReference);
    }
}
