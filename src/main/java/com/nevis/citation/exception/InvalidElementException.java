package com.nevis.citation.exception;

import lombok.Getter;

@Getter
public class InvalidElementException extends RuntimeException {
    private final String elementId;

    public InvalidElementException(String elementId, String reason) {
        super("Invalid claim element " + elementId + ": " + reason);
        this.elementId = elementId;
    }
}
