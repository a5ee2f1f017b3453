package com.example.docstandards.folder.model.request;

/**
 * A null {@code standardId} clears the assignment.
 */
public record AssignStandardRequest(
        String standardId
) {}
