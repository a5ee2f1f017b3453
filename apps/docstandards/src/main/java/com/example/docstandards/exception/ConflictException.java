package com.example.docstandards.exception;

import lombok.Getter;

@Getter
public class ConflictException extends RuntimeException {

    public static final String STALE_LINEAGE = "stale_lineage";
    public static final String INVALID_STATE = "invalid_state";
    public static final String ROOT_EXISTS = "root_exists";

    private final String reason;

    public ConflictException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static ConflictException staleLineage(String predecessorId, String headId) {
        return new ConflictException(STALE_LINEAGE,
                "Standard " + predecessorId + " is not the head of its lineage (head is " + headId + ")");
    }

    public static ConflictException invalidState(String message) {
        return new ConflictException(INVALID_STATE, message);
    }
}
