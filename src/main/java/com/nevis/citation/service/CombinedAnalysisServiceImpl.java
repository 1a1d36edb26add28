package com.nevis.citation.service;

import com.nevis.citation.cache.ArtifactKind;
import com.nevis.citation.cache.CacheKey;
import com.nevis.citation.cache.ResultCache;
import com.nevis.citation.config.CitationProperties;
import com.nevis.citation.exception.IncompleteAnalysisException;
import com.nevis.citation.model.Claim;
import com.nevis.citation.model.ClaimElement;
import com.nevis.citation.model.CombinedAnalysis;
import com.nevis.citation.model.CombinedAnalysisRecord;
import com.nevis.citation.model.DeepAnalysisResult;
import com.nevis.citation.model.ElementAnalysis;
import com.nevis.citation.model.ElementComparison;
import com.nevis.citation.model.ReferenceRanking;
import com.nevis.citation.model.RequestContext;
import com.nevis.citation.model.SearchHistory;
import com.nevis.citation.repository.CitationJobRepository;
import com.nevis.citation.repository.CombinedAnalysisRepository;
import com.nevis.citation.source.ClaimSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.IntStream;

@Service
@Slf4j
public class CombinedAnalysisServiceImpl implements CombinedAnalysisService {

    private static final String ALL = "all";

    private final SearchHistoryService searchHistoryService;
    private final CitationJobRepository jobRepository;
    private final CombinedAnalysisRepository combinedAnalysisRepository;
    private final ClaimSource claimSource;
    private final ResultCache resultCache;
    private final double coverageThreshold;

    public CombinedAnalysisServiceImpl(
        SearchHistoryService searchHistoryService,
        CitationJobRepository jobRepository,
        CombinedAnalysisRepository combinedAnalysisRepository,
        ClaimSource claimSource,
        ResultCache resultCache,
        CitationProperties properties
    ) {
        this.searchHistoryService = searchHistoryService;
        this.jobRepository = jobRepository;
        this.combinedAnalysisRepository = combinedAnalysisRepository;
        this.claimSource = claimSource;
        this.resultCache = resultCache;
        this.coverageThreshold = properties.combined().coverageThreshold();
    }

    @Override
    public CombinedAnalysisRecord combine(RequestContext context, UUID searchHistoryId, String claim1Text,
                                          List<String> referenceNumbers) {
        SearchHistory search = searchHistoryService.requireSearch(context, searchHistoryId);

        Set<String> references = new LinkedHashSet<>(referenceNumbers == null ? List.of() : referenceNumbers);
        references.removeIf(r -> r == null || r.isBlank());
        if (references.isEmpty()) {
            throw new IllegalArgumentException("At least one reference number is required");
        }

        Claim claim = claimSource.getClaim(searchHistoryId);
        String claimText = claim1Text == null || claim1Text.isBlank() ? claim.text() : claim1Text;

        // only analyses run against this wording of the claim count
        Map<String, DeepAnalysisResult> analyses =
            jobRepository.findLatestDeepAnalyses(searchHistoryId, references, Claim.hashOf(claimText));
        List<String> missing = references.stream().filter(r -> !analyses.containsKey(r)).toList();
        if (!missing.isEmpty()) {
            Set<String> analysedEarlier = jobRepository.findLatestDeepAnalyses(searchHistoryId, missing).keySet();
            List<String> stale = missing.stream().filter(analysedEarlier::contains).toList();
            log.info("Search {}: cannot combine, deep analysis missing for {} (stale: {})", searchHistoryId, missing, stale);
            throw new IncompleteAnalysisException(missing, stale);
        }

        CombinedAnalysis analysis = merge(claim, references, analyses);

        CombinedAnalysisRecord saved = combinedAnalysisRepository.save(
            new CombinedAnalysisRecord(null, searchHistoryId, null, references, analysis, claimText));

        int dropped = resultCache.invalidate(CacheKey.kindPattern(search, ArtifactKind.COMBINED_ANALYSES));
        log.info("Search {}: combined analysis {} over {} created ({} cache entries dropped)",
            searchHistoryId, saved.id(), references, dropped);
        return saved;
    }

    @Override
    public List<CombinedAnalysisRecord> listCombined(RequestContext context, UUID searchHistoryId) {
        SearchHistory search = searchHistoryService.requireSearch(context, searchHistoryId);
        return resultCache.getListOrLoad(
            CacheKey.of(search, ArtifactKind.COMBINED_ANALYSES, ALL),
            CombinedAnalysisRecord.class,
            () -> combinedAnalysisRepository.findBySearchHistory(searchHistoryId)
        );
    }

    @Override
    public Optional<CombinedAnalysisRecord> findByReferenceSet(RequestContext context, UUID searchHistoryId,
                                                               Collection<String> referenceNumbers) {
        Set<String> wanted = Set.copyOf(referenceNumbers);
        return listCombined(context, searchHistoryId).stream()
            .filter(r -> Set.copyOf(r.referenceNumbers()).equals(wanted))
            .findFirst();
    }

    static CombinedAnalysis merge(Claim claim, Set<String> references, Map<String, DeepAnalysisResult> analyses,
                                  double coverageThreshold) {
        List<String> ordered = references.stream()
            .sorted(Comparator.comparingDouble((String r) -> analyses.get(r).overallRelevance()).reversed()
                .thenComparing(Comparator.naturalOrder()))
            .toList();
        List<ReferenceRanking> ranking = IntStream.range(0, ordered.size())
            .mapToObj(i -> new ReferenceRanking(i + 1, ordered.get(i), analyses.get(ordered.get(i)).overallRelevance()))
            .toList();

        List<ElementComparison> comparisons = new ArrayList<>();
        List<String> covered = new ArrayList<>();
        List<String> uncovered = new ArrayList<>();
        for (ClaimElement element : claim.elements()) {
            Map<String, Double> byReference = new LinkedHashMap<>();
            for (String reference : ordered) {
                analyses.get(reference).elementAnalysis().stream()
                    .filter(a -> a.elementId().equals(element.id()) && !a.failed())
                    .mapToDouble(ElementAnalysis::relevance)
                    .max()
                    .ifPresent(relevance -> byReference.put(reference, relevance));
            }

            String strongest = null;
            double strongestRelevance = 0.0;
            for (Map.Entry<String, Double> entry : byReference.entrySet()) {
                if (strongest == null || entry.getValue() > strongestRelevance) {
                    strongest = entry.getKey();
                    strongestRelevance = entry.getValue();
                }
            }

            comparisons.add(new ElementComparison(element.id(), byReference, strongest, strongestRelevance));
            if (strongest != null && strongestRelevance >= coverageThreshold) {
                covered.add(element.id());
            } else {
                uncovered.add(element.id());
            }
        }

        Set<String> findings = new LinkedHashSet<>();
        ordered.forEach(r -> findings.addAll(analyses.get(r).keyFindings()));

        return new CombinedAnalysis(ranking, comparisons, covered, uncovered, List.copyOf(findings));
    }

    private CombinedAnalysis merge(Claim claim, Set<String> references, Map<String, DeepAnalysisResult> analyses) {
        return merge(claim, references, analyses, coverageThreshold);
    }
}
