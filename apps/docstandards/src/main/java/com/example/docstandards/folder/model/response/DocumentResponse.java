package com.example.docstandards.folder.model.response;

import com.example.docstandards.folder.document.DocumentDoc;
import com.example.docstandards.folder.model.DocumentChange;
import com.example.docstandards.folder.model.DocumentView;

import java.time.Instant;

public record DocumentResponse(
        String documentId,
        String folderId,
        String filename,
        String contentType,
        String contentKey,
        String contentSha256,
        long sizeBytes,
        int revision,
        String lifecycle,
        String overrideStandardId,
        ResolutionResponse resolvedStandard,
        String validationJobId,
        String uploadedBy,
        Instant createdAt,
        Instant updatedAt
) {
    public static DocumentResponse from(DocumentView view) {
        return of(view.document(), ResolutionResponse.from(view.resolution(), view.standard()), null);
    }

    public static DocumentResponse from(DocumentChange change) {
        return of(change.document(), null, change.job() != null ? change.job().getId() : null);
    }

    public static DocumentResponse from(DocumentDoc document) {
        return of(document, null, null);
    }

    private static DocumentResponse of(DocumentDoc document, ResolutionResponse resolution, String jobId) {
        return new DocumentResponse(
                document.getId(),
                document.getFolderId(),
                document.getFilename(),
                document.getContentType(),
                document.getContentKey(),
                document.getContentSha256(),
                document.getSizeBytes(),
                document.getRevision(),
                document.getLifecycle() != null ? document.getLifecycle().name() : null,
                document.getOverrideStandardId(),
                resolution,
                jobId,
                document.getUploadedBy(),
                document.getCreatedAt(),
                document.getUpdatedAt());
    }
}
