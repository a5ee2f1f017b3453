package com.example.docstandards.folder.model;

/**
 * Which Standard governs a document or folder, and where that came from.
 */
public record Resolution(
        String standardId,
        Source source,
        /** Document id for an override, folder id for an assignment, null otherwise. */
        String sourceId
) {
    public enum Source {
        OVERRIDE,
        FOLDER,
        NONE
    }

    private static final Resolution NONE = new Resolution(null, Source.NONE, null);

    public static Resolution override(String standardId, String documentId) {
        return new Resolution(standardId, Source.OVERRIDE, documentId);
    }

    public static Resolution folder(String standardId, String folderId) {
        return new Resolution(standardId, Source.FOLDER, folderId);
    }

    public static Resolution none() {
        return NONE;
    }

    public boolean isResolved() {
        return standardId != null;
    }
}
