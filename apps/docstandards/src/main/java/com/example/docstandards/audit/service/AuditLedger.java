package com.example.docstandards.audit.service;

import com.example.docstandards.audit.document.AuditEventDoc;
import com.example.docstandards.audit.model.AuditEventKind;
import com.example.docstandards.audit.model.EntityRef;
import com.example.docstandards.audit.store.AuditEventStore;
import com.example.docstandards.common.util.RetryUtils;
import com.example.docstandards.config.AppProperties;
import com.example.docstandards.exception.TransientStorageException;
import com.example.docstandards.observability.filter.CorrelationIdFilter;
import com.example.docstandards.observability.metrics.ValidationMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail of every state change.
 *
 * <p>Appends are retried with backoff on retryable storage failures; once retries are
 * exhausted the error reaches the caller, so an event is never dropped silently.
 * Each stored event is also written as one JSON line on the {@code DOCSTANDARDS_AUDIT}
 * logger for SIEM ingestion.
 */
@Slf4j
@Service
public class AuditLedger {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("DOCSTANDARDS_AUDIT");
    private static final String NO_CORRELATION = "none";

    private final AuditEventStore store;
    private final ObjectMapper objectMapper;
    private final ValidationMetrics metrics;
    private final AppProperties.Audit auditConfig;

    public AuditLedger(AuditEventStore store, ObjectMapper objectMapper,
                       ValidationMetrics metrics, AppProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.auditConfig = properties.getAudit();
    }

    @NonNull
    public Mono<AuditEventDoc> append(@NonNull AuditEventKind kind, @NonNull String actor,
                                      @NonNull EntityRef entity, @Nullable Map<String, Object> payload) {
        return CorrelationIdFilter.getCorrelationId()
                .map(correlationId -> AuditEventDoc.builder()
                        .kind(kind)
                        .actor(actor)
                        .entityType(entity.type())
                        .entityId(entity.id())
                        .timestamp(Instant.now())
                        .correlationId(NO_CORRELATION.equals(correlationId) ? null : correlationId)
                        .payload(payload != null ? new LinkedHashMap<>(payload) : Map.of())
                        .build())
                .flatMap(draft -> Mono.defer(() -> store.append(draft))
                        .retryWhen(Retry.backoff(auditConfig.getAppendMaxRetries(), auditConfig.getAppendBackoff())
                                .filter(RetryUtils.retryablePredicate())
                                .onRetryExhaustedThrow((retrySpec, signal) -> new TransientStorageException(
                                        "Audit append failed after " + signal.totalRetries() + " retries",
                                        signal.failure()))))
                .doOnNext(this::logEvent)
                .doOnError(e -> {
                    metrics.recordAuditAppendFailure();
                    log.error("Audit append failed: kind={}, entity={}, actor={}", kind, entity, actor, e);
                });
    }

    /**
     * Lazy, ordered history of one entity. Restartable from any previously seen id.
     */
    @NonNull
    public Flux<AuditEventDoc> history(@NonNull EntityRef entity, @Nullable Long sinceId) {
        return store.history(entity, sinceId != null ? sinceId : 0L, 0);
    }

    /**
     * One page of history plus the cursor for the next page (null when exhausted).
     */
    @NonNull
    public Mono<AuditPage> page(@NonNull EntityRef entity, @Nullable Long sinceId, @Nullable Integer limit) {
        int pageSize = limit == null || limit <= 0
                ? auditConfig.getDefaultPageSize()
                : Math.min(limit, auditConfig.getMaxPageSize());
        long from = sinceId != null ? sinceId : 0L;

        // One extra row tells whether another page exists
        return store.history(entity, from, pageSize + 1)
                .collectList()
                .map(events -> {
                    boolean more = events.size() > pageSize;
                    List<AuditEventDoc> page = more ? events.subList(0, pageSize) : events;
                    Long next = more ? page.get(page.size() - 1).getId() : null;
                    return new AuditPage(List.copyOf(page), next);
                });
    }

    private void logEvent(AuditEventDoc event) {
        try {
            AUDIT_LOG.info(objectMapper.writeValueAsString(event.toStructuredLog()));
        } catch (JsonProcessingException e) {
            // Fallback to simple logging
            AUDIT_LOG.info("AUDIT: id={}, kind={}, entity={}:{}, actor={}",
                    event.getId(), event.getKind(), event.getEntityType(), event.getEntityId(), event.getActor());
        }
    }

    public record AuditPage(List<AuditEventDoc> events, Long nextSinceId) {
    }
}
