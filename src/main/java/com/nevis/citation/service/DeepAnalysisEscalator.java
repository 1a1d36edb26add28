package com.nevis.citation.service;

import com.nevis.citation.model.CitationMatch;
import com.nevis.citation.model.Claim;
import com.nevis.citation.model.DeepAnalysisResult;

import java.util.List;

public interface DeepAnalysisEscalator {

    /**
     * Matches eligible for escalation: scored at or above the configured minimum, ranked,
     * capped at {@code limit}.
     */
    List<CitationMatch> select(List<CitationMatch> topMatches, int limit);

    /**
     * @throws com.nevis.citation.exception.AnalysisUnavailableException when nothing is
     *         eligible or every element analysis fails
     * @throws com.nevis.citation.exception.InvalidElementException when a match points at an
     *         element outside the claim
     */
    DeepAnalysisResult escalate(Claim claim, String reference, List<CitationMatch> topMatches, int limit);
}
