package com.reflow.ocr.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final UUID entityId;

    public EntityNotFoundException(String entityType, UUID entityId) {
        super(entityType + " not found: " + entityId);
        this.entityId = entityId;
    }
}
