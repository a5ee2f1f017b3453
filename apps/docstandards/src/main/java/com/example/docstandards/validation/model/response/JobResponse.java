package com.example.docstandards.validation.model.response;

import com.example.docstandards.validation.document.ValidationJobDoc;

import java.time.Instant;

public record JobResponse(
        String jobId,
        String documentId,
        String state,
        String trigger,
        int attempts,
        int maxAttempts,
        String contentKey,
        String resolvedStandardId,
        Integer resolvedStandardVersion,
        String verdict,
        String reportId,
        String lastError,
        String followUpJobId,
        Instant enqueuedAt,
        Instant availableAt,
        Instant startedAt,
        Instant finishedAt
) {
    public static JobResponse from(ValidationJobDoc job) {
        return new JobResponse(
                job.getId(),
                job.getDocumentId(),
                job.getState() != null ? job.getState().name() : null,
                job.getTrigger() != null ? job.getTrigger().name() : null,
                job.getAttempts(),
                job.getMaxAttempts(),
                job.getContentKey(),
                job.getResolvedStandardId(),
                job.getResolvedStandardVersion(),
                job.getVerdict() != null ? job.getVerdict().name() : null,
                job.getReportId(),
                job.getLastError(),
                job.getFollowUpJobId(),
                job.getEnqueuedAt(),
                job.getAvailableAt(),
                job.getStartedAt(),
                job.getFinishedAt());
    }
}
