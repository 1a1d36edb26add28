package com.nevis.citation.model;

public enum JobErrorCode {
    REFERENCE_UNAVAILABLE,
    ALL_ELEMENTS_FAILED,
    JOB_TIMEOUT,
    INVALID_ELEMENT,
    SEARCH_DELETED,
    INTERNAL_ERROR
}
