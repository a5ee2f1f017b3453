package com.example.docstandards.folder.model;

import com.example.docstandards.folder.document.FolderDoc;

/**
 * Outcome of an assignment. {@code changed} is false for a no-op, which appends
 * nothing and re-enqueues nothing.
 */
public record AssignmentResult(
        FolderDoc folder,
        String previousStandardId,
        boolean changed,
        long revalidatedDocuments
) {
    public AssignmentResult withRevalidated(long count) {
        return new AssignmentResult(folder, previousStandardId, changed, count);
    }
}
