package com.nevis.citation.service;

import com.nevis.citation.model.CitationMatch;
import com.nevis.citation.model.ConsolidatedCitationResults;
import com.nevis.citation.model.MatchFilter;
import com.nevis.citation.model.RequestContext;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CitationQueryService {

    /**
     * Best matches from the latest completed job of each reference, ranked.
     */
    List<CitationMatch> topMatches(RequestContext context, UUID searchHistoryId, Optional<String> reference, int limit);

    ConsolidatedCitationResults consolidated(RequestContext context, UUID searchHistoryId);

    List<CitationMatch> listMatches(RequestContext context, UUID searchHistoryId, MatchFilter filter);
}
