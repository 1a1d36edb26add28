package com.nevis.citation.repository;

import com.nevis.citation.model.CombinedAnalysis;
import com.nevis.citation.model.CombinedAnalysisRecord;
import com.nevis.citation.model.ElementComparison;
import com.nevis.citation.model.ReferenceRanking;
import com.nevis.citation.model.SearchHistory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcCombinedAnalysisRepositoryTest extends BaseIntegrationTest {

    @Autowired
    private CombinedAnalysisRepository combinedAnalysisRepository;

    @Autowired
    private SearchHistoryRepository searchHistoryRepository;

    @Test
    @DisplayName("Each save creates a separate immutable record")
    void saveCreatesNewRecords() {
        SearchHistory search = searchHistoryRepository.save(new SearchHistory(null, "tenant-1", "project-1", "q", null, null));
        CombinedAnalysis analysis = new CombinedAnalysis(
            List.of(new ReferenceRanking(1, "US2", 0.8), new ReferenceRanking(2, "US1", 0.3)),
            List.of(new ElementComparison("E1", Map.of("US2", 0.8, "US1", 0.3), "US2", 0.8)),
            List.of("E1"),
            List.of(),
            List.of("coil shown"));

        CombinedAnalysisRecord first = combinedAnalysisRepository.save(new CombinedAnalysisRecord(
            null, search.id(), null, new LinkedHashSet<>(List.of("US2", "US1")), analysis, "claim"));
        CombinedAnalysisRecord second = combinedAnalysisRepository.save(new CombinedAnalysisRecord(
            null, search.id(), null, new LinkedHashSet<>(List.of("US2", "US1")), analysis, "claim"));

        assertThat(first.id()).isNotEqualTo(second.id());
        assertThat(first.createdAt()).isNotNull();
        assertThat(first.referenceNumbers()).containsExactly("US2", "US1");
        assertThat(first.analysis()).isEqualTo(analysis);

        List<CombinedAnalysisRecord> stored = combinedAnalysisRepository.findBySearchHistory(search.id());
        assertThat(stored).extracting(CombinedAnalysisRecord::id).containsExactlyInAnyOrder(first.id(), second.id());
    }
}
