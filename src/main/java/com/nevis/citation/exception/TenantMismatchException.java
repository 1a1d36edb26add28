package com.nevis.citation.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class TenantMismatchException extends RuntimeException {
    private final UUID searchHistoryId;

    public TenantMismatchException(UUID searchHistoryId) {
        super("Search history " + searchHistoryId + " does not belong to the current tenant");
        this.searchHistoryId = searchHistoryId;
    }
}
