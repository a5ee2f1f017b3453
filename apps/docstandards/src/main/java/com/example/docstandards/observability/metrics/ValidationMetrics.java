package com.example.docstandards.observability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized recording of validation, promotion and storage metrics.
 * Uses bounded tag values to prevent high-cardinality metric explosion.
 */
@Component
public class ValidationMetrics {

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_FAILURE = "failure";
    private static final String TAG_UNKNOWN = "unknown";
    private static final int MAX_TAG_LENGTH = 50;

    private final MeterRegistry registry;

    private final Counter jobsEnqueued;
    private final Counter jobsCoalesced;
    private final Counter jobsClaimed;
    private final Counter jobsReclaimed;
    private final Counter jobsRetried;
    private final Counter jobsSuperseded;
    private final Timer evaluationTimer;

    private final Counter promotionSuccess;
    private final Counter promotionFailure;

    private final Counter documentUpload;
    private final DistributionSummary documentSize;

    private final Counter auditAppendFailure;

    public ValidationMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.jobsEnqueued = Counter.builder("validation.jobs.enqueued")
                .description("Validation jobs inserted")
                .register(registry);

        this.jobsCoalesced = Counter.builder("validation.jobs.coalesced")
                .description("Enqueue requests satisfied by an existing job")
                .register(registry);

        this.jobsClaimed = Counter.builder("validation.jobs.claimed")
                .tag("source", "queued")
                .description("Jobs claimed from the queue")
                .register(registry);

        this.jobsReclaimed = Counter.builder("validation.jobs.claimed")
                .tag("source", "orphan")
                .description("Jobs reclaimed after an expired lease")
                .register(registry);

        this.jobsRetried = Counter.builder("validation.jobs.retried")
                .description("Failed attempts scheduled for retry")
                .register(registry);

        this.jobsSuperseded = Counter.builder("validation.jobs.superseded")
                .description("Follow-up jobs enqueued on completion")
                .register(registry);

        this.evaluationTimer = Timer.builder("validation.evaluation")
                .description("Compliance evaluation duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.promotionSuccess = Counter.builder("standard.promotion")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Successful promotions")
                .register(registry);

        this.promotionFailure = Counter.builder("standard.promotion")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Failed promotions")
                .register(registry);

        this.documentUpload = Counter.builder("document.upload")
                .description("Document uploads and revisions")
                .register(registry);

        this.documentSize = DistributionSummary.builder("document.size.bytes")
                .description("Size of uploaded documents in bytes")
                .baseUnit("bytes")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(registry);

        this.auditAppendFailure = Counter.builder("audit.append.failure")
                .description("Audit appends that failed after retries")
                .register(registry);
    }

    public void recordEnqueued(@Nullable String trigger, boolean coalesced) {
        if (coalesced) {
            jobsCoalesced.increment();
            return;
        }
        jobsEnqueued.increment();
        registry.counter("validation.jobs.enqueued.by_trigger",
                Tags.of("trigger", sanitizeTag(trigger)))
                .increment();
    }

    public void recordClaimed(boolean reclaimed) {
        if (reclaimed) {
            jobsReclaimed.increment();
        } else {
            jobsClaimed.increment();
        }
    }

    public void recordRetryScheduled() {
        jobsRetried.increment();
    }

    public void recordSuperseded() {
        jobsSuperseded.increment();
    }

    public void recordJobFinished(@NonNull String state, @Nullable String verdict) {
        registry.counter("validation.jobs.finished",
                Tags.of("state", sanitizeTag(state), "verdict", sanitizeTag(verdict)))
                .increment();
    }

    public void recordEvaluation(@NonNull Duration duration) {
        evaluationTimer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void recordPromotion(boolean success) {
        if (success) {
            promotionSuccess.increment();
        } else {
            promotionFailure.increment();
        }
    }

    public void recordDocumentUpload(long sizeBytes) {
        documentUpload.increment();
        documentSize.record(sizeBytes);
    }

    public void recordAuditAppendFailure() {
        auditAppendFailure.increment();
    }

    public void recordBlobOperation(@NonNull String operation, boolean success, @NonNull Duration duration) {
        Timer.builder("blob.operation")
                .tag("operation", sanitizeTag(operation))
                .tag("outcome", success ? OUTCOME_SUCCESS : OUTCOME_FAILURE)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void registerCacheSizeGauge(@NonNull String cacheName, @NonNull Supplier<Number> sizeSupplier) {
        Gauge.builder("cache.size", sizeSupplier)
                .tag("cache", sanitizeTag(cacheName))
                .description("Estimated number of cache entries")
                .register(registry);
    }

    @NonNull
    private String sanitizeTag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return TAG_UNKNOWN;
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_-]", "_");
        if (sanitized.length() > MAX_TAG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_TAG_LENGTH);
        }
        return sanitized.isBlank() ? TAG_UNKNOWN : sanitized;
    }
}
