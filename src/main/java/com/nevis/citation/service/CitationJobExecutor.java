package com.nevis.citation.service;

import java.util.UUID;

public interface CitationJobExecutor {

    /**
     * Claims a PENDING job and drives it to COMPLETED or FAILED. A job that is no longer
     * PENDING is left alone.
     */
    void run(UUID jobId);
}
