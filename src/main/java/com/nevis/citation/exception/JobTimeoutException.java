package com.nevis.citation.exception;

import lombok.Getter;

import java.time.Duration;
import java.util.UUID;

@Getter
public class JobTimeoutException extends RuntimeException {
    private final UUID jobId;

    public JobTimeoutException(UUID jobId, Duration timeout) {
        super("Citation job " + jobId + " exceeded processing timeout of " + timeout);
        this.jobId = jobId;
    }
}
