package com.example.docstandards.folder.model.response;

import com.example.docstandards.folder.model.AssignmentResult;

public record AssignmentResponse(
        String folderId,
        String standardId,
        String previousStandardId,
        boolean changed,
        long revalidatedDocuments
) {
    public static AssignmentResponse from(AssignmentResult result) {
        return new AssignmentResponse(
                result.folder().getId(),
                result.folder().getAssignedStandardId(),
                result.previousStandardId(),
                result.changed(),
                result.revalidatedDocuments());
    }
}
