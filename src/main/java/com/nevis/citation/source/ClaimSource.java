package com.nevis.citation.source;

import com.nevis.citation.model.Claim;

import java.util.UUID;

/**
 * Supplies the claim analysed by a search session, already decomposed into elements.
 */
public interface ClaimSource {

    /**
     * @throws com.nevis.citation.exception.EntityNotFoundException when the search has no claim
     */
    Claim getClaim(UUID searchHistoryId);
}
