package com.example.docstandards.exception;

// Blob store or database hiccup. Retryable.
public class TransientStorageException extends RuntimeException {

    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
