package com.example.docstandards.folder.model.request;

/**
 * A null {@code standardId} clears the override.
 */
public record OverrideRequest(
        String standardId
) {}
