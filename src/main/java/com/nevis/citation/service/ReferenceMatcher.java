package com.nevis.citation.service;

import com.nevis.citation.model.CitationMatch;
import com.nevis.citation.model.ClaimElement;
import com.nevis.citation.model.ReferenceDocument;

public interface ReferenceMatcher {

    /**
     * Scores how well the reference discloses a single claim element. A reference that
     * does not disclose the element yields a zero-score match, never an exception.
     *
     * @throws com.nevis.citation.exception.InvalidElementException when the element text is blank
     * @throws com.nevis.citation.exception.ReferenceUnavailableException when the reference has no readable text
     */
    CitationMatch match(ClaimElement element, ReferenceDocument reference);
}
