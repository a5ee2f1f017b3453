package com.example.docstandards.validation.store;

import com.example.docstandards.validation.document.ValidationJobDoc;
import com.example.docstandards.validation.model.EnqueueResult;
import com.example.docstandards.validation.model.JobCompletion;
import com.example.docstandards.validation.model.JobState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * In-memory implementation of ValidationJobStore for single-pod deployments and tests.
 *
 * <p>Each transition runs inside {@link ConcurrentHashMap#computeIfPresent}, which is atomic
 * per key, so two workers racing for the same job cannot both win. Stored jobs are never
 * handed out directly; callers get copies.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
public class InMemoryValidationJobStore implements ValidationJobStore {

    private static final Comparator<ValidationJobDoc> BY_AVAILABLE_AT =
            Comparator.comparing(ValidationJobDoc::getAvailableAt);
    private static final Comparator<ValidationJobDoc> BY_CLAIM_EXPIRY =
            Comparator.comparing(ValidationJobDoc::getClaimExpiresAt);

    private final ConcurrentHashMap<String, ValidationJobDoc> jobs = new ConcurrentHashMap<>();
    private final Object enqueueMonitor = new Object();

    public InMemoryValidationJobStore() {
        log.info("In-memory validation job store initialized (single-pod mode)");
    }

    @Override
    @NonNull
    public Mono<EnqueueResult> enqueue(@NonNull ValidationJobDoc candidate) {
        return Mono.fromCallable(() -> {
            synchronized (enqueueMonitor) {
                for (ValidationJobDoc job : jobs.values()) {
                    if (job.getState() == JobState.QUEUED
                            && job.getDocumentId().equals(candidate.getDocumentId())
                            && job.getContentKey().equals(candidate.getContentKey())) {
                        return EnqueueResult.coalesced(copy(job));
                    }
                }
                for (ValidationJobDoc job : jobs.values()) {
                    if (job.getState() == JobState.RUNNING
                            && job.getDocumentId().equals(candidate.getDocumentId())) {
                        return EnqueueResult.running(copy(job));
                    }
                }
                ValidationJobDoc stored = copy(candidate);
                jobs.put(stored.getId(), stored);
                return EnqueueResult.created(copy(stored));
            }
        });
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> findById(@NonNull String jobId) {
        return Mono.fromCallable(() -> jobs.get(jobId)).map(InMemoryValidationJobStore::copy);
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> findLatestByDocument(@NonNull String documentId) {
        return Mono.fromCallable(() -> jobs.values().stream()
                        .filter(job -> job.getDocumentId().equals(documentId))
                        .max(Comparator.comparing(ValidationJobDoc::getEnqueuedAt))
                        .orElse(null))
                .map(InMemoryValidationJobStore::copy);
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> claimNext(@NonNull String workerId, @NonNull Instant now, @NonNull Duration lease) {
        Predicate<ValidationJobDoc> claimable = job -> job.getState() == JobState.QUEUED
                && !job.getAvailableAt().isAfter(now);
        return claimFirst(claimable, BY_AVAILABLE_AT, workerId, now, lease);
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> reclaimExpired(@NonNull String workerId, @NonNull Instant now,
                                                 @NonNull Duration lease) {
        Predicate<ValidationJobDoc> expired = job -> job.getState() == JobState.RUNNING
                && job.getClaimExpiresAt() != null
                && job.getClaimExpiresAt().isBefore(now);
        return claimFirst(expired, BY_CLAIM_EXPIRY, workerId, now, lease);
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> renewLease(@NonNull String jobId, @NonNull String workerId, int attempt,
                                             @NonNull Instant claimExpiresAt) {
        return transition(jobId, job -> isHeld(job, workerId, attempt),
                job -> job.toBuilder().claimExpiresAt(claimExpiresAt).build());
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> complete(@NonNull String jobId, @NonNull String workerId, int attempt,
                                           @NonNull JobCompletion completion, @NonNull Instant now) {
        return transition(jobId, job -> isHeld(job, workerId, attempt), job -> {
            ValidationJobDoc.ValidationJobDocBuilder next = job.toBuilder()
                    .state(completion.state())
                    .lastError(completion.lastError())
                    .claimExpiresAt(null);
            if (completion.state() == JobState.QUEUED) {
                next.availableAt(completion.availableAt()).claimedBy(null);
            } else {
                next.finishedAt(now)
                        .reportId(completion.reportId())
                        .verdict(completion.verdict())
                        .resolvedStandardId(completion.resolvedStandardId())
                        .resolvedStandardVersion(completion.resolvedStandardVersion());
            }
            return next.build();
        });
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> recordFollowUp(@NonNull String jobId, @NonNull String followUpJobId) {
        return transition(jobId, job -> true, job -> job.toBuilder().followUpJobId(followUpJobId).build());
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> requeueFailed(@NonNull String jobId, @NonNull Instant now) {
        return transition(jobId, job -> job.getState() == JobState.FAILED, job -> job.toBuilder()
                .state(JobState.QUEUED)
                .attempts(0)
                .availableAt(now)
                .claimedBy(null)
                .claimExpiresAt(null)
                .startedAt(null)
                .finishedAt(null)
                .build());
    }

    int size() {
        return jobs.size();
    }

    private Mono<ValidationJobDoc> claimFirst(Predicate<ValidationJobDoc> eligible,
                                              Comparator<ValidationJobDoc> order,
                                              String workerId, Instant now, Duration lease) {
        return Mono.fromCallable(() -> {
            List<String> candidates = jobs.values().stream()
                    .filter(eligible)
                    .sorted(order)
                    .map(ValidationJobDoc::getId)
                    .toList();
            for (String id : candidates) {
                ValidationJobDoc claimed = apply(id, eligible, job -> job.toBuilder()
                        .state(JobState.RUNNING)
                        .claimedBy(workerId)
                        .claimExpiresAt(now.plus(lease))
                        .startedAt(now)
                        .attempts(job.getAttempts() + 1)
                        .build());
                if (claimed != null) {
                    return claimed;
                }
                // Another worker took it between the scan and the compute; try the next one
            }
            return null;
        });
    }

    private Mono<ValidationJobDoc> transition(String jobId, Predicate<ValidationJobDoc> condition,
                                              Function<ValidationJobDoc, ValidationJobDoc> change) {
        return Mono.fromCallable(() -> apply(jobId, condition, change));
    }

    // Returns a copy of the updated job, or null when the condition did not hold
    private ValidationJobDoc apply(String jobId, Predicate<ValidationJobDoc> condition,
                                   Function<ValidationJobDoc, ValidationJobDoc> change) {
        AtomicReference<ValidationJobDoc> updated = new AtomicReference<>();
        jobs.computeIfPresent(jobId, (id, current) -> {
            if (!condition.test(current)) {
                return current;
            }
            ValidationJobDoc next = change.apply(current);
            updated.set(copy(next));
            return next;
        });
        return updated.get();
    }

    private static boolean isHeld(ValidationJobDoc job, String workerId, int attempt) {
        return job.getState() == JobState.RUNNING
                && Objects.equals(job.getClaimedBy(), workerId)
                && job.getAttempts() == attempt;
    }

    private static ValidationJobDoc copy(ValidationJobDoc job) {
        return job.toBuilder().build();
    }
}
