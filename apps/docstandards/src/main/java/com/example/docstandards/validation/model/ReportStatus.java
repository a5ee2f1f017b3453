package com.example.docstandards.validation.model;

/**
 * Validation status of a document, derived from its most recently enqueued job.
 */
public enum ReportStatus {
    NOT_YET_VALIDATED,
    PENDING,
    COMPLETED,
    SKIPPED,
    FAILED;

    public static ReportStatus of(JobState latestJobState) {
        if (latestJobState == null) {
            return NOT_YET_VALIDATED;
        }
        return switch (latestJobState) {
            case QUEUED, RUNNING -> PENDING;
            case SUCCEEDED -> COMPLETED;
            case SKIPPED -> SKIPPED;
            case FAILED -> FAILED;
        };
    }
}
