package com.example.docstandards.validation.worker;

import com.example.docstandards.audit.model.AuditEventKind;
import com.example.docstandards.audit.model.EntityRef;
import com.example.docstandards.audit.service.AuditLedger;
import com.example.docstandards.blob.BlobStore;
import com.example.docstandards.common.util.RetryUtils;
import com.example.docstandards.compliance.model.EvaluationResult;
import com.example.docstandards.compliance.service.ComplianceEvaluator;
import com.example.docstandards.config.AppProperties;
import com.example.docstandards.exception.NotFoundException;
import com.example.docstandards.folder.document.DocumentDoc;
import com.example.docstandards.folder.repository.DocumentRepository;
import com.example.docstandards.folder.service.StandardResolver;
import com.example.docstandards.observability.metrics.ValidationMetrics;
import com.example.docstandards.standard.document.StandardDoc;
import com.example.docstandards.standard.service.StandardRegistry;
import com.example.docstandards.validation.document.ComplianceReportDoc;
import com.example.docstandards.validation.document.ValidationJobDoc;
import com.example.docstandards.validation.model.JobCompletion;
import com.example.docstandards.validation.model.JobState;
import com.example.docstandards.validation.model.JobTrigger;
import com.example.docstandards.validation.repository.ComplianceReportRepository;
import com.example.docstandards.validation.service.ValidationJobService;
import com.example.docstandards.validation.store.ValidationJobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one claimed validation job through a single attempt.
 *
 * <p>Attempt: load document (missing is terminal, archived is SKIPPED), resolve its Standard
 * (none is SKIPPED), append {@code VALIDATE_START}, fetch the snapshot bytes, evaluate, persist
 * the report. The outcome is written back only while the claim is still held; a worker whose
 * lease was taken over discards its result.
 *
 * <p>Retryable failures go back to QUEUED with exponential backoff until the attempt budget
 * is spent. Every terminal state appends {@code VALIDATE_COMPLETE} and then checks whether the
 * document changed while the job ran, enqueuing a follow-up job if it did.
 */
@Slf4j
@Component
public class ValidationJobProcessor {

    static final String SYSTEM_ACTOR = "system";
    private static final int MAX_ERROR_LENGTH = 500;

    private final ValidationJobStore jobStore;
    private final ValidationJobService jobService;
    private final DocumentRepository documentRepository;
    private final StandardResolver resolver;
    private final StandardRegistry standardRegistry;
    private final BlobStore blobStore;
    private final ComplianceEvaluator evaluator;
    private final ComplianceReportRepository reportRepository;
    private final AuditLedger auditLedger;
    private final ValidationMetrics metrics;
    private final AppProperties.Validation config;

    public ValidationJobProcessor(ValidationJobStore jobStore,
                                  ValidationJobService jobService,
                                  DocumentRepository documentRepository,
                                  StandardResolver resolver,
                                  StandardRegistry standardRegistry,
                                  BlobStore blobStore,
                                  ComplianceEvaluator evaluator,
                                  ComplianceReportRepository reportRepository,
                                  AuditLedger auditLedger,
                                  ValidationMetrics metrics,
                                  AppProperties properties) {
        this.jobStore = jobStore;
        this.jobService = jobService;
        this.documentRepository = documentRepository;
        this.resolver = resolver;
        this.standardRegistry = standardRegistry;
        this.blobStore = blobStore;
        this.evaluator = evaluator;
        this.reportRepository = reportRepository;
        this.auditLedger = auditLedger;
        this.metrics = metrics;
        this.config = properties.getValidation();
    }

    /**
     * Claims and processes at most one job. Completes empty when nothing was claimable
     * or the claim was lost while processing.
     */
    @NonNull
    public Mono<ValidationJobDoc> processNext(@NonNull String workerId) {
        return jobStore.claimNext(workerId, Instant.now(), config.getClaimLease())
                .doOnNext(job -> metrics.recordClaimed(false))
                .switchIfEmpty(Mono.defer(() -> jobStore.reclaimExpired(workerId, Instant.now(), config.getClaimLease())
                        .doOnNext(job -> {
                            metrics.recordClaimed(true);
                            log.warn("Reclaimed job with expired lease: jobId={}, documentId={}, attempt={}",
                                    job.getId(), job.getDocumentId(), job.getAttempts());
                        })))
                .flatMap(job -> process(job, workerId));
    }

    Mono<ValidationJobDoc> process(ValidationJobDoc job, String workerId) {
        log.debug("Processing job: jobId={}, documentId={}, attempt={}/{}, worker={}",
                job.getId(), job.getDocumentId(), job.getAttempts(), job.getMaxAttempts(), workerId);

        // Reclaims count as attempts, so a job that keeps killing its worker still terminates
        if (job.getAttempts() > job.getMaxAttempts()) {
            return finish(job, workerId, JobCompletion.failed(
                    "Attempt budget exhausted after " + job.getMaxAttempts() + " attempts"));
        }

        return Mono.firstWithSignal(runAttempt(job, workerId), heartbeat(job, workerId))
                .onErrorResume(e -> !(e instanceof LeaseLostException), e -> Mono.just(classifyFailure(job, e)))
                .flatMap(completion -> finish(job, workerId, completion))
                .onErrorResume(LeaseLostException.class, e -> {
                    log.warn("Lease lost while processing, abandoning attempt: jobId={}, worker={}",
                            job.getId(), workerId);
                    return Mono.empty();
                });
    }

    /**
     * Delay before attempt {@code attempts + 1}: {@code min(base * 2^(attempts-1), max)}.
     */
    static Duration backoff(int attempts, Duration base, Duration max) {
        int exponent = Math.max(0, attempts - 1);
        if (exponent >= 31) {
            return max;
        }
        long millis = base.toMillis();
        long factor = 1L << exponent;
        if (millis > max.toMillis() / factor) {
            return max;
        }
        Duration delay = Duration.ofMillis(millis * factor);
        return delay.compareTo(max) > 0 ? max : delay;
    }

    private Mono<JobCompletion> runAttempt(ValidationJobDoc job, String workerId) {
        return documentRepository.findById(job.getDocumentId())
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Document", job.getDocumentId())))
                .flatMap(document -> {
                    if (!document.isActive()) {
                        return Mono.just(JobCompletion.skipped("Document is archived"));
                    }
                    return resolver.resolve(document)
                            .flatMap(resolution -> resolution.isResolved()
                                    ? standardRegistry.get(resolution.standardId())
                                            .flatMap(standard -> validate(job, workerId, standard))
                                    : Mono.just(JobCompletion.skipped("No applicable standard")));
                });
    }

    private Mono<JobCompletion> validate(ValidationJobDoc job, String workerId, StandardDoc standard) {
        Map<String, Object> startPayload = new LinkedHashMap<>();
        startPayload.put("jobId", job.getId());
        startPayload.put("attempt", job.getAttempts());
        startPayload.put("trigger", job.getTrigger());
        startPayload.put("standardId", standard.getId());
        startPayload.put("standardVersion", standard.getVersion());
        startPayload.put("contentKey", job.getContentKey());

        return auditLedger.append(AuditEventKind.VALIDATE_START, workerId,
                        EntityRef.document(job.getDocumentId()), startPayload)
                .then(blobStore.get(job.getContentKey()).timeout(config.getBlobFetchTimeout()))
                .flatMap(bytes -> timedEvaluation(bytes, standard))
                .flatMap(result -> reportRepository.save(ComplianceReportDoc.builder()
                        .id(ComplianceReportDoc.idForJob(job.getId()))
                        .jobId(job.getId())
                        .documentId(job.getDocumentId())
                        .standardId(standard.getId())
                        .standardVersion(standard.getVersion())
                        .contentKey(job.getContentKey())
                        .findings(result.findings())
                        .verdict(result.verdict())
                        .generatedAt(Instant.now())
                        .build()))
                .map(report -> JobCompletion.succeeded(report.getId(), report.getVerdict(),
                        standard.getId(), standard.getVersion()));
    }

    private Mono<EvaluationResult> timedEvaluation(byte[] bytes, StandardDoc standard) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return evaluator.evaluate(bytes, standard.getRules())
                    .timeout(config.getEvaluationTimeout())
                    .doOnSuccess(result -> metrics.recordEvaluation(Duration.ofNanos(System.nanoTime() - start)));
        });
    }

    // Never completes normally; errors with LeaseLostException once the claim is gone
    private Mono<JobCompletion> heartbeat(ValidationJobDoc job, String workerId) {
        return Flux.interval(config.getHeartbeatInterval())
                .concatMap(tick -> jobStore.renewLease(job.getId(), workerId, job.getAttempts(),
                                Instant.now().plus(config.getClaimLease()))
                        .switchIfEmpty(Mono.error(() -> new LeaseLostException(job.getId())))
                        .onErrorResume(e -> !(e instanceof LeaseLostException), e -> {
                            log.warn("Lease renewal failed, will retry on next heartbeat: jobId={}, error={}",
                                    job.getId(), e.getMessage());
                            return Mono.empty();
                        }))
                .then(Mono.never());
    }

    private JobCompletion classifyFailure(ValidationJobDoc job, Throwable error) {
        String message = describe(error);
        if (RetryUtils.isRetryable(error)) {
            if (job.getAttempts() < job.getMaxAttempts()) {
                Duration delay = backoff(job.getAttempts(), config.getInitialBackoff(), config.getMaxBackoff());
                log.warn("Attempt failed, retrying: jobId={}, attempt={}/{}, delay={}, error={}",
                        job.getId(), job.getAttempts(), job.getMaxAttempts(), delay, message);
                return JobCompletion.retryAt(Instant.now().plus(delay), message);
            }
            log.error("Attempts exhausted: jobId={}, attempts={}, error={}", job.getId(), job.getAttempts(), message);
            return JobCompletion.failed("Attempts exhausted: " + message);
        }
        if (error instanceof NotFoundException) {
            log.warn("Job failed terminally: jobId={}, error={}", job.getId(), message);
        } else {
            log.error("Job failed terminally: jobId={}", job.getId(), error);
        }
        return JobCompletion.failed(message);
    }

    private Mono<ValidationJobDoc> finish(ValidationJobDoc job, String workerId, JobCompletion completion) {
        return jobStore.complete(job.getId(), workerId, job.getAttempts(), completion, Instant.now())
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Claim lost before completion, result discarded: jobId={}, worker={}, outcome={}",
                            job.getId(), workerId, completion.state());
                    return Mono.empty();
                }))
                .flatMap(updated -> {
                    if (!updated.getState().isTerminal()) {
                        metrics.recordRetryScheduled();
                        return Mono.just(updated);
                    }
                    metrics.recordJobFinished(updated.getState().name(),
                            updated.getVerdict() != null ? updated.getVerdict().name() : null);
                    log.info("Job finished: jobId={}, documentId={}, state={}, verdict={}, attempts={}",
                            updated.getId(), updated.getDocumentId(), updated.getState(),
                            updated.getVerdict(), updated.getAttempts());
                    return auditLedger.append(AuditEventKind.VALIDATE_COMPLETE, workerId,
                                    EntityRef.document(updated.getDocumentId()), completePayload(updated))
                            .then(supersedeIfStale(updated));
                });
    }

    /**
     * Enqueues a follow-up job when the document's content or resolution changed after
     * this job snapshotted them. Completes with the job, carrying the follow-up id if any.
     */
    private Mono<ValidationJobDoc> supersedeIfStale(ValidationJobDoc finished) {
        return documentRepository.findById(finished.getDocumentId())
                .filter(DocumentDoc::isActive)
                .flatMap(document -> resolver.resolve(document)
                        .flatMap(current -> {
                            boolean contentChanged = !Objects.equals(document.getContentKey(), finished.getContentKey());
                            boolean resolutionChanged = finished.getState() != JobState.FAILED
                                    && !Objects.equals(current.standardId(), finished.getResolvedStandardId());
                            if (!contentChanged && !resolutionChanged) {
                                return Mono.empty();
                            }
                            log.info("Document changed during validation, enqueuing follow-up: jobId={}, "
                                            + "contentChanged={}, resolutionChanged={}",
                                    finished.getId(), contentChanged, resolutionChanged);
                            return jobService.enqueue(document, JobTrigger.SUPERSEDE, SYSTEM_ACTOR)
                                    .flatMap(result -> jobStore.recordFollowUp(finished.getId(), result.job().getId()))
                                    .doOnNext(updated -> metrics.recordSuperseded());
                        }))
                .defaultIfEmpty(finished);
    }

    private static Map<String, Object> completePayload(ValidationJobDoc job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobId", job.getId());
        payload.put("outcome", job.getState());
        payload.put("attempts", job.getAttempts());
        if (job.getVerdict() != null) {
            payload.put("verdict", job.getVerdict());
        }
        if (job.getReportId() != null) {
            payload.put("reportId", job.getReportId());
        }
        if (job.getResolvedStandardId() != null) {
            payload.put("standardId", job.getResolvedStandardId());
            payload.put("standardVersion", job.getResolvedStandardVersion());
        }
        if (job.getLastError() != null) {
            payload.put("reason", job.getLastError());
        }
        return payload;
    }

    private static String describe(Throwable error) {
        String message = error.getClass().getSimpleName()
                + (error.getMessage() != null ? ": " + error.getMessage() : "");
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }

    static final class LeaseLostException extends RuntimeException {
        LeaseLostException(String jobId) {
            super("Lease lost for job " + jobId);
        }
    }
}
