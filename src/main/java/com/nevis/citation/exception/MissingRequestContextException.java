package com.nevis.citation.exception;

public class MissingRequestContextException extends RuntimeException {

    public MissingRequestContextException(String header) {
        super("Missing required header: " + header);
    }
}
