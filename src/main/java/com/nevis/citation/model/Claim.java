package com.nevis.citation.model;

import com.nevis.citation.exception.InvalidElementException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

public record Claim(
    UUID searchHistoryId,
    String text,
    List<ClaimElement> elements
) {
    public Claim {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    /**
     * SHA-256 of the claim text with whitespace collapsed. Jobs record it so analyses computed
     * against an earlier wording of the claim can be told apart.
     */
    public static String hashOf(String claimText) {
        String normalized = claimText == null ? "" : claimText.strip().replaceAll("\\s+", " ");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String textHash() {
        return hashOf(text);
    }

    public Optional<ClaimElement> element(String elementId) {
        return elements.stream()
            .filter(e -> e.id().equals(elementId))
            .findFirst();
    }

    /**
     * Elements a job works on: all of them when no restriction is given, otherwise the
     * requested subset in claim order. Unknown ids are rejected.
     */
    public List<ClaimElement> elementsInScope(Collection<String> elementIds) {
        if (elementIds == null || elementIds.isEmpty()) {
            return elements;
        }
        Set<String> known = elements.stream().map(ClaimElement::id).collect(Collectors.toSet());
        List<String> unknown = elementIds.stream().filter(id -> !known.contains(id)).toList();
        if (!unknown.isEmpty()) {
            throw new InvalidElementException(unknown.get(0), "Element is not part of the claim");
        }
        return elements.stream()
            .filter(e -> elementIds.contains(e.id()))
            .toList();
    }
}
