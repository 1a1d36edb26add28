package com.nevis.citation.service;

import com.nevis.citation.CitationFixtures;
import com.nevis.citation.cache.ResultCache;
import com.nevis.citation.exception.EntityNotFoundException;
import com.nevis.citation.model.CitationJob;
import com.nevis.citation.model.CitationMatch;
import com.nevis.citation.model.Claim;
import com.nevis.citation.model.DeepAnalysisResult;
import com.nevis.citation.model.ElementAnalysis;
import com.nevis.citation.model.SearchHistory;
import com.nevis.citation.repository.CitationJobRepository;
import com.nevis.citation.repository.CitationMatchRepository;
import com.nevis.citation.source.ClaimSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeepAnalysisServiceImplTest {

    @Mock
    private SearchHistoryService searchHistoryService;
    @Mock
    private CitationJobService jobService;
    @Mock
    private CitationJobRepository jobRepository;
    @Mock
    private CitationMatchRepository matchRepository;
    @Mock
    private ClaimSource claimSource;
    @Mock
    private DeepAnalysisEscalator escalator;

    private DeepAnalysisServiceImpl service;

    private final UUID searchId = UUID.randomUUID();
    private final SearchHistory search = CitationFixtures.search(searchId);
    private final Claim claim = CitationFixtures.claim(searchId);
    private final DeepAnalysisResult result = new DeepAnalysisResult(0.7,
        List.of(new ElementAnalysis("E1", 0.7, "disclosed", Set.of("coil"), false)), List.of("coil shown"), null);

    @BeforeEach
    void setUp() {
        service = new DeepAnalysisServiceImpl(searchHistoryService, jobService, jobRepository, matchRepository,
            claimSource, escalator, new ResultCache(Duration.ofMinutes(5), 100), CitationFixtures.properties());
    }

    @Test
    @DisplayName("Analyses the latest completed job and stores the result on it")
    void analyzeStoresResult() {
        UUID jobId = UUID.randomUUID();
        CitationJob job = CitationFixtures.processingJob(jobId, searchId, "US1");
        List<CitationMatch> matches = List.of(CitationFixtures.match("US1", "E1", 1, 0.8));

        when(jobRepository.findLatestCompleted(searchId, "US1")).thenReturn(Optional.of(job));
        when(claimSource.getClaim(searchId)).thenReturn(claim);
        when(matchRepository.findByJob(jobId)).thenReturn(matches);
        when(escalator.escalate(claim, "US1", matches, 5)).thenReturn(result);
        when(escalator.select(matches, 5)).thenReturn(matches);
        when(jobService.recordDeepAnalysis(jobId, List.of(matches.get(0).id()), result)).thenReturn(true);

        DeepAnalysisResult analysed = service.analyze(CitationFixtures.CONTEXT, searchId, "US1", Optional.empty());

        assertThat(analysed).isEqualTo(result);
        verify(jobService).recordDeepAnalysis(jobId, List.of(matches.get(0).id()), result);
    }

    @Test
    @DisplayName("Explicit limit is passed to the escalator")
    void analyzeHonoursLimit() {
        UUID jobId = UUID.randomUUID();
        when(jobRepository.findLatestCompleted(searchId, "US1"))
            .thenReturn(Optional.of(CitationFixtures.processingJob(jobId, searchId, "US1")));
        when(claimSource.getClaim(searchId)).thenReturn(claim);
        when(matchRepository.findByJob(jobId)).thenReturn(List.of());
        when(escalator.escalate(claim, "US1", List.of(), 1)).thenReturn(result);
        when(escalator.select(List.of(), 1)).thenReturn(List.of());

        service.analyze(CitationFixtures.CONTEXT, searchId, "US1", Optional.of(1));

        verify(escalator).escalate(claim, "US1", List.of(), 1);
    }

    @Test
    @DisplayName("Reference without a completed job cannot be analysed")
    void analyzeWithoutCompletedJob() {
        when(jobRepository.findLatestCompleted(searchId, "US9")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.analyze(CitationFixtures.CONTEXT, searchId, "US9", Optional.empty()))
            .isInstanceOf(EntityNotFoundException.class)
            .hasMessageContaining("US9");

        verifyNoInteractions(escalator);
        verify(jobService, never()).recordDeepAnalysis(any(), any(), any());
    }

    @Test
    @DisplayName("Stored deep analysis is served from the cache after the first read")
    void getDeepAnalysisCached() {
        when(searchHistoryService.requireSearch(CitationFixtures.CONTEXT, searchId)).thenReturn(search);
        when(jobRepository.findLatestDeepAnalyses(searchId, List.of("US1"))).thenReturn(Map.of("US1", result));

        assertThat(service.getDeepAnalysis(CitationFixtures.CONTEXT, searchId, "US1")).isEqualTo(result);
        assertThat(service.getDeepAnalysis(CitationFixtures.CONTEXT, searchId, "US1")).isEqualTo(result);

        verify(jobRepository, times(1)).findLatestDeepAnalyses(searchId, List.of("US1"));
    }

    @Test
    @DisplayName("Missing deep analysis is a not-found error")
    void getDeepAnalysisMissing() {
        when(searchHistoryService.requireSearch(CitationFixtures.CONTEXT, searchId)).thenReturn(search);
        when(jobRepository.findLatestDeepAnalyses(searchId, List.of("US2"))).thenReturn(Map.of());

        assertThatThrownBy(() -> service.getDeepAnalysis(CitationFixtures.CONTEXT, searchId, "US2"))
            .isInstanceOf(EntityNotFoundException.class)
            .hasMessageContaining("US2");
    }
}
