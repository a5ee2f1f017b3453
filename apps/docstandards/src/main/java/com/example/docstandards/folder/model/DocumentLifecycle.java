package com.example.docstandards.folder.model;

public enum DocumentLifecycle {
    ACTIVE,
    /**
     * Kept for history. Never re-validated; pending jobs end SKIPPED.
     */
    ARCHIVED
}
