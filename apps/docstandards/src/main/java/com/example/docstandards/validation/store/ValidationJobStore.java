package com.example.docstandards.validation.store;

import com.example.docstandards.validation.document.ValidationJobDoc;
import com.example.docstandards.validation.model.EnqueueResult;
import com.example.docstandards.validation.model.JobCompletion;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Persistence and state transitions for validation jobs.
 *
 * <p>Every transition is a single conditional update: a worker only changes a job it still
 * holds, identified by {@code claimedBy} plus the attempt number it claimed. A lost race
 * completes empty rather than erroring.
 * Implementations can use MongoDB (shared by all instances) or in-memory storage (single pod).
 */
public interface ValidationJobStore {

    /**
     * Inserts {@code candidate} unless an existing job already covers it: a QUEUED job with the
     * same document and content key (coalesced), or a RUNNING job for the document.
     */
    @NonNull
    Mono<EnqueueResult> enqueue(@NonNull ValidationJobDoc candidate);

    @NonNull
    Mono<ValidationJobDoc> findById(@NonNull String jobId);

    /**
     * Most recently enqueued job of a document.
     */
    @NonNull
    Mono<ValidationJobDoc> findLatestByDocument(@NonNull String documentId);

    /**
     * Atomically claims the QUEUED job with the oldest {@code availableAt <= now}.
     * Increments {@code attempts}. Empty when nothing is claimable or another worker won.
     */
    @NonNull
    Mono<ValidationJobDoc> claimNext(@NonNull String workerId, @NonNull Instant now, @NonNull Duration lease);

    /**
     * Atomically claims a RUNNING job whose lease expired before {@code now}.
     * Increments {@code attempts}.
     */
    @NonNull
    Mono<ValidationJobDoc> reclaimExpired(@NonNull String workerId, @NonNull Instant now, @NonNull Duration lease);

    /**
     * Extends the lease of a held claim. Empty when the claim was lost.
     */
    @NonNull
    Mono<ValidationJobDoc> renewLease(@NonNull String jobId, @NonNull String workerId, int attempt,
                                      @NonNull Instant claimExpiresAt);

    /**
     * Applies the outcome of an attempt to a held claim. Empty when the claim was lost.
     */
    @NonNull
    Mono<ValidationJobDoc> complete(@NonNull String jobId, @NonNull String workerId, int attempt,
                                    @NonNull JobCompletion completion, @NonNull Instant now);

    @NonNull
    Mono<ValidationJobDoc> recordFollowUp(@NonNull String jobId, @NonNull String followUpJobId);

    /**
     * Moves a FAILED job back to QUEUED with a fresh attempt budget. Empty when the job is not FAILED.
     */
    @NonNull
    Mono<ValidationJobDoc> requeueFailed(@NonNull String jobId, @NonNull Instant now);
}
