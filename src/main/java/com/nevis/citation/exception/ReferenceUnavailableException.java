package com.nevis.citation.exception;

import lombok.Getter;

@Getter
public class ReferenceUnavailableException extends RuntimeException {
    private final String reference;

    public ReferenceUnavailableException(String reference, String reason) {
        super("Reference " + reference + " is unavailable: " + reason);
        this.reference = reference;
    }
}
