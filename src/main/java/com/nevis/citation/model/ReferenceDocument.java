package com.nevis.citation.model;

import java.util.List;

public record ReferenceDocument(
    String referenceNumber,
    String title,
    List<ReferenceSection> sections
) {
    public ReferenceDocument {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public boolean hasReadableText() {
        return sections.stream().anyMatch(s -> s.text() != null && !s.text().isBlank());
    }
}
