package com.example.docstandards.exception;

import java.time.Instant;

/**
 * Error body returned for every failed request. {@code correlationId} matches the
 * X-Correlation-Id response header and the id stored on audit events written by the request.
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        String correlationId
) {
    public static ErrorResponse of(int status, String error, String message, String path, String correlationId) {
        return new ErrorResponse(Instant.now(), status, error, message, path, correlationId);
    }
}
