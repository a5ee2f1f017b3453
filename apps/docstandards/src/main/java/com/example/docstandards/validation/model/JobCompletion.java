package com.example.docstandards.validation.model;

import com.example.docstandards.compliance.model.Verdict;

import java.time.Instant;

/**
 * Result of one processing attempt, applied to the job by a claim-conditional update.
 * {@code state} is either terminal or {@link JobState#QUEUED} for a scheduled retry.
 */
public record JobCompletion(
        JobState state,
        Instant availableAt,
        String lastError,
        String reportId,
        Verdict verdict,
        String resolvedStandardId,
        Integer resolvedStandardVersion
) {
    public static JobCompletion succeeded(String reportId, Verdict verdict,
                                          String standardId, int standardVersion) {
        return new JobCompletion(JobState.SUCCEEDED, null, null, reportId, verdict, standardId, standardVersion);
    }

    public static JobCompletion skipped(String reason) {
        return new JobCompletion(JobState.SKIPPED, null, reason, null, null, null, null);
    }

    public static JobCompletion failed(String error) {
        return new JobCompletion(JobState.FAILED, null, error, null, null, null, null);
    }

    public static JobCompletion retryAt(Instant availableAt, String error) {
        return new JobCompletion(JobState.QUEUED, availableAt, error, null, null, null, null);
    }
}
