package com.nevis.citation.service;

import com.nevis.citation.model.CombinedAnalysisRecord;
import com.nevis.citation.model.RequestContext;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CombinedAnalysisService {

    /**
     * Merges the latest deep analysis of every listed reference into a new immutable record.
     *
     * @throws com.nevis.citation.exception.IncompleteAnalysisException when any reference has
     *         no deep analysis yet
     */
    CombinedAnalysisRecord combine(RequestContext context, UUID searchHistoryId, String claim1Text,
                                   List<String> referenceNumbers);

    /**
     * Newest first.
     */
    List<CombinedAnalysisRecord> listCombined(RequestContext context, UUID searchHistoryId);

    Optional<CombinedAnalysisRecord> findByReferenceSet(RequestContext context, UUID searchHistoryId,
                                                        Collection<String> referenceNumbers);
}
