package com.nevis.citation.repository;

import com.nevis.citation.model.CombinedAnalysisRecord;

import java.util.List;
import java.util.UUID;

public interface CombinedAnalysisRepository {
    CombinedAnalysisRecord save(CombinedAnalysisRecord record);
    List<CombinedAnalysisRecord> findBySearchHistory(UUID searchHistoryId);
}
