package com.example.docstandards.exception;

import lombok.Getter;

// Promotion source could not be parsed. Never retried.
@Getter
public class InvalidSourceDocumentException extends RuntimeException {

    private final String documentId;

    public InvalidSourceDocumentException(String documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }
}
