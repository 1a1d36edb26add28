package com.nevis.citation.repository;

import com.nevis.citation.model.CitationMatch;
import com.nevis.citation.model.DeepAnalysisResult;
import com.nevis.citation.model.MatchFilter;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CitationMatchRepository {
    void saveAll(List<CitationMatch> matches);
    List<CitationMatch> findByJob(UUID citationJobId);
    List<CitationMatch> findBySearchHistory(UUID searchHistoryId, MatchFilter filter);
    List<CitationMatch> findTopMatches(UUID searchHistoryId, Optional<String> reference, int limit);
    int attachDeepAnalysis(Collection<UUID> matchIds, DeepAnalysisResult deepAnalysis);
}
