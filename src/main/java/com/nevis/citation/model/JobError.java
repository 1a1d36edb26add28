package com.nevis.citation.model;

import java.util.Objects;

public record JobError(
    JobErrorCode code,
    String message
) {
    public JobError {
        Objects.requireNonNull(code, "code");
    }
}
