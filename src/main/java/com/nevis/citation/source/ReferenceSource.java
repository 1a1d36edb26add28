package com.nevis.citation.source;

import com.nevis.citation.model.ReferenceDocument;

/**
 * Supplies prior-art text by reference number.
 */
public interface ReferenceSource {

    /**
     * @throws com.nevis.citation.exception.ReferenceUnavailableException when the document is
     *         missing or has no readable text
     */
    ReferenceDocument getReference(String referenceNumber);
}
