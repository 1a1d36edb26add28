package com.nevis.citation.exception;

import com.nevis.citation.model.CitationJob;
import lombok.Getter;

@Getter
public class DuplicateJobException extends RuntimeException {
    private final CitationJob existingJob;

    public DuplicateJobException(CitationJob existingJob) {
        super("Citation job " + existingJob.id() + " for reference " + existingJob.reference()
            + " is already " + existingJob.status());
        this.existingJob = existingJob;
    }
}
