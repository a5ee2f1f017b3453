package com.example.docstandards.exception;

import lombok.Getter;

@Getter
public class NotFoundException extends RuntimeException {

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }
}
