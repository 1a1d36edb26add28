package com.nevis.citation.model;

import java.util.List;

/**
 * Where in a reference the supporting text of a match was found. Locations follow
 * document order.
 */
public record CitationLocation(
    String reference,
    String elementId,
    List<LocationSnippet> locations
) {
    public CitationLocation {
        if (locations == null || locations.isEmpty()) {
            throw new IllegalArgumentException("Citation location requires at least one snippet");
        }
        locations = List.copyOf(locations);
    }
}
