package com.nevis.citation.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final UUID entityId;

    public EntityNotFoundException(UUID entityId) {
        this(entityId, "Entity not found: " + entityId);
    }

    public EntityNotFoundException(UUID entityId, String message) {
        super(message);
        this.entityId = entityId;
    }
}
