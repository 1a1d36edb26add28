package com.nevis.citation.service;

import com.nevis.citation.model.DeepAnalysisResult;
import com.nevis.citation.model.RequestContext;

import java.util.Optional;
import java.util.UUID;

public interface DeepAnalysisService {

    /**
     * Escalates the latest completed job for the reference and stores the result on the job
     * and on every escalated match.
     */
    DeepAnalysisResult analyze(RequestContext context, UUID searchHistoryId, String reference, Optional<Integer> limit);

    DeepAnalysisResult getDeepAnalysis(RequestContext context, UUID searchHistoryId, String reference);
}
