package com.example.docstandards.validation.service;

import com.example.docstandards.audit.model.AuditEventKind;
import com.example.docstandards.audit.model.EntityRef;
import com.example.docstandards.audit.service.AuditLedger;
import com.example.docstandards.config.AppProperties;
import com.example.docstandards.exception.ConflictException;
import com.example.docstandards.exception.NotFoundException;
import com.example.docstandards.folder.document.DocumentDoc;
import com.example.docstandards.folder.repository.DocumentRepository;
import com.example.docstandards.observability.metrics.ValidationMetrics;
import com.example.docstandards.validation.document.ValidationJobDoc;
import com.example.docstandards.validation.model.EnqueueResult;
import com.example.docstandards.validation.model.JobState;
import com.example.docstandards.validation.model.JobTrigger;
import com.example.docstandards.validation.store.ValidationJobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for requesting validation and for manual intervention on jobs.
 */
@Slf4j
@Service
public class ValidationJobService {

    private final ValidationJobStore jobStore;
    private final DocumentRepository documentRepository;
    private final AuditLedger auditLedger;
    private final ValidationMetrics metrics;
    private final AppProperties.Validation validationConfig;

    public ValidationJobService(ValidationJobStore jobStore,
                                DocumentRepository documentRepository,
                                AuditLedger auditLedger,
                                ValidationMetrics metrics,
                                AppProperties properties) {
        this.jobStore = jobStore;
        this.documentRepository = documentRepository;
        this.auditLedger = auditLedger;
        this.metrics = metrics;
        this.validationConfig = properties.getValidation();
    }

    /**
     * @throws NotFoundException unknown document
     */
    @NonNull
    public Mono<EnqueueResult> enqueue(@NonNull String documentId, @NonNull JobTrigger trigger,
                                       @NonNull String actor) {
        return documentRepository.findById(documentId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Document", documentId)))
                .flatMap(document -> enqueue(document, trigger, actor));
    }

    /**
     * Requests validation of the document's current content.
     * Completes empty for archived documents, which are never validated again.
     */
    @NonNull
    public Mono<EnqueueResult> enqueue(@NonNull DocumentDoc document, @NonNull JobTrigger trigger,
                                       @NonNull String actor) {
        if (!document.isActive()) {
            log.debug("Not enqueuing archived document: documentId={}, trigger={}", document.getId(), trigger);
            return Mono.empty();
        }

        Instant now = Instant.now();
        ValidationJobDoc candidate = ValidationJobDoc.builder()
                .id(UUID.randomUUID().toString())
                .documentId(document.getId())
                .contentKey(document.getContentKey())
                .state(JobState.QUEUED)
                .trigger(trigger)
                .requestedBy(actor)
                .attempts(0)
                .maxAttempts(validationConfig.getMaxAttempts())
                .enqueuedAt(now)
                .availableAt(now)
                .build();

        return jobStore.enqueue(candidate)
                .doOnNext(result -> {
                    metrics.recordEnqueued(trigger.name(), !result.isCreated());
                    log.info("Enqueue validation: documentId={}, trigger={}, outcome={}, jobId={}",
                            document.getId(), trigger, result.outcome(), result.job().getId());
                });
    }

    /**
     * @throws NotFoundException unknown job
     */
    @NonNull
    public Mono<ValidationJobDoc> getJob(@NonNull String jobId) {
        return jobStore.findById(jobId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Job", jobId)));
    }

    /**
     * Re-queues a terminally FAILED job with a fresh attempt budget.
     *
     * @throws NotFoundException unknown job
     * @throws ConflictException the job is not FAILED
     */
    @NonNull
    public Mono<ValidationJobDoc> retry(@NonNull String jobId, @NonNull String actor) {
        return getJob(jobId)
                .flatMap(job -> {
                    if (job.getState() != JobState.FAILED) {
                        return Mono.error(ConflictException.invalidState(
                                "Job " + jobId + " is " + job.getState() + "; only FAILED jobs can be retried"));
                    }
                    return jobStore.requeueFailed(jobId, Instant.now())
                            .switchIfEmpty(Mono.error(() -> ConflictException.invalidState(
                                    "Job " + jobId + " changed state concurrently")))
                            .flatMap(requeued -> auditLedger.append(AuditEventKind.JOB_RETRY, actor,
                                            EntityRef.job(jobId), retryPayload(job))
                                    .thenReturn(requeued));
                })
                .doOnSuccess(job -> log.info("Job re-queued by operator: jobId={}, actor={}", jobId, actor));
    }

    private static Map<String, Object> retryPayload(ValidationJobDoc failed) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("documentId", failed.getDocumentId());
        payload.put("previousAttempts", failed.getAttempts());
        if (failed.getLastError() != null) {
            payload.put("lastError", failed.getLastError());
        }
        return payload;
    }
}
