package com.example.docstandards.standard.service;

import com.example.docstandards.audit.model.AuditEventKind;
import com.example.docstandards.audit.model.EntityRef;
import com.example.docstandards.audit.service.AuditLedger;
import com.example.docstandards.blob.BlobStore;
import com.example.docstandards.common.concurrent.KeyedMutex;
import com.example.docstandards.common.util.StringSanitizer;
import com.example.docstandards.compliance.model.DocumentStructure;
import com.example.docstandards.compliance.parser.MalformedDocumentException;
import com.example.docstandards.compliance.parser.OdfStructureParser;
import com.example.docstandards.config.AppProperties;
import com.example.docstandards.exception.ConflictException;
import com.example.docstandards.exception.InvalidSourceDocumentException;
import com.example.docstandards.exception.NotFoundException;
import com.example.docstandards.folder.document.DocumentDoc;
import com.example.docstandards.folder.repository.DocumentRepository;
import com.example.docstandards.observability.metrics.ValidationMetrics;
import com.example.docstandards.standard.document.StandardDoc;
import com.example.docstandards.standard.model.RuleDefinition;
import com.example.docstandards.standard.model.StandardPage;
import com.example.docstandards.standard.repository.StandardRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores immutable, versioned Standards and creates them by promoting a golden document.
 *
 * <p>Promotion is serialized per source document and, when extending a lineage, per lineage,
 * so two concurrent promotions cannot both claim the same next version. The unique
 * {@code (lineageId, version)} index catches the same race across instances.
 *
 * <p>Standards never change after insert, so reads go through an in-process Caffeine cache
 * with no expiry. Cached instances are shared and must not be mutated by callers.
 */
@Slf4j
@Service
public class StandardRegistry {

    static final String DOCUMENT_LOCK_PREFIX = "promote:doc:";
    static final String LINEAGE_LOCK_PREFIX = "promote:lineage:";
    private static final String CACHE_NAME = "standards";

    private final StandardRepository standardRepository;
    private final DocumentRepository documentRepository;
    private final BlobStore blobStore;
    private final OdfStructureParser parser;
    private final RuleSetDeriver ruleSetDeriver;
    private final KeyedMutex keyedMutex;
    private final AuditLedger auditLedger;
    private final ValidationMetrics metrics;
    private final Cache<String, StandardDoc> cache;
    private final int defaultPageSize;
    private final int maxPageSize;

    public StandardRegistry(StandardRepository standardRepository,
                            DocumentRepository documentRepository,
                            BlobStore blobStore,
                            OdfStructureParser parser,
                            RuleSetDeriver ruleSetDeriver,
                            KeyedMutex keyedMutex,
                            AuditLedger auditLedger,
                            ValidationMetrics metrics,
                            AppProperties properties) {
        this.standardRepository = standardRepository;
        this.documentRepository = documentRepository;
        this.blobStore = blobStore;
        this.parser = parser;
        this.ruleSetDeriver = ruleSetDeriver;
        this.keyedMutex = keyedMutex;
        this.auditLedger = auditLedger;
        this.metrics = metrics;

        this.defaultPageSize = properties.getStandards().getDefaultPageSize();
        this.maxPageSize = properties.getStandards().getMaxPageSize();

        int maxSize = properties.getStandards().getCacheMaxSize();
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .build();
        metrics.registerCacheSizeGauge(CACHE_NAME, cache::estimatedSize);

        log.info("Standard registry initialized (cache max-entries={})", maxSize);
    }

    /**
     * Creates a Standard from the current content of {@code documentId}.
     *
     * <p>Without a predecessor a new lineage starts at version 1. With one, the predecessor
     * must be the head of its lineage and the new Standard becomes the next version.
     * Never enqueues validation: documents pick the new Standard up only through an
     * assignment or override.
     *
     * @throws NotFoundException              unknown document or predecessor
     * @throws InvalidSourceDocumentException the document is not a parseable ODF package
     * @throws ConflictException              the predecessor is no longer the lineage head
     */
    @NonNull
    public Mono<StandardDoc> promote(@NonNull String documentId, @NonNull String actor,
                                     @Nullable String name, @Nullable String predecessorId) {
        Mono<Optional<StandardDoc>> predecessor = predecessorId == null
                ? Mono.just(Optional.empty())
                : get(predecessorId).map(Optional::of);

        return predecessor
                .flatMap(pred -> {
                    List<String> lockKeys = new ArrayList<>();
                    lockKeys.add(DOCUMENT_LOCK_PREFIX + documentId);
                    pred.ifPresent(p -> lockKeys.add(LINEAGE_LOCK_PREFIX + p.getLineageId()));
                    return keyedMutex.withLocks(lockKeys,
                            () -> doPromote(documentId, actor, name, pred.orElse(null)));
                })
                .doOnSuccess(standard -> {
                    metrics.recordPromotion(true);
                    log.info("Promoted standard: id={}, lineage={}, version={}, source={}",
                            standard.getId(), standard.getLineageId(), standard.getVersion(),
                            StringSanitizer.forLog(documentId));
                })
                .doOnError(e -> {
                    metrics.recordPromotion(false);
                    log.warn("Promotion failed: documentId={}, predecessor={}, error={}",
                            StringSanitizer.forLog(documentId), StringSanitizer.forLog(predecessorId),
                            e.getMessage());
                });
    }

    /**
     * @throws NotFoundException unknown id
     */
    @NonNull
    public Mono<StandardDoc> get(@NonNull String standardId) {
        return findById(standardId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Standard", standardId)));
    }

    /**
     * Empty when the id is unknown.
     */
    @NonNull
    public Mono<StandardDoc> findById(@NonNull String standardId) {
        StandardDoc cached = cache.getIfPresent(standardId);
        if (cached != null) {
            return Mono.just(cached);
        }
        return standardRepository.findById(standardId)
                .doOnNext(standard -> cache.put(standard.getId(), standard));
    }

    /**
     * One page of all Standards ordered by name, then lineage and version.
     *
     * @param size page size, the configured default when null, capped at the configured maximum
     * @throws IllegalArgumentException negative page or non-positive size
     */
    @NonNull
    public Mono<StandardPage> list(int page, @Nullable Integer size) {
        int pageSize = size == null ? defaultPageSize : Math.min(size, maxPageSize);
        if (page < 0 || pageSize < 1) {
            return Mono.error(new IllegalArgumentException("page must be >= 0 and size >= 1"));
        }
        PageRequest pageable = PageRequest.of(page, pageSize,
                Sort.by("name", "lineageId", "version"));

        return Mono.zip(
                        standardRepository.findAllBy(pageable)
                                .doOnNext(standard -> cache.put(standard.getId(), standard))
                                .collectList(),
                        standardRepository.count())
                .map(tuple -> new StandardPage(tuple.getT1(), page, pageSize, tuple.getT2()));
    }

    /**
     * Every version of a lineage, oldest first.
     *
     * @throws NotFoundException unknown lineage
     */
    @NonNull
    public Flux<StandardDoc> lineage(@NonNull String lineageId) {
        return standardRepository.findByLineageIdOrderByVersionAsc(lineageId)
                .doOnNext(standard -> cache.put(standard.getId(), standard))
                .switchIfEmpty(Flux.error(() -> new NotFoundException("Lineage", lineageId)));
    }

    private Mono<StandardDoc> doPromote(String documentId, String actor, String name, StandardDoc predecessor) {
        return documentRepository.findById(documentId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Document", documentId)))
                .flatMap(document -> requireLineageHead(predecessor)
                        .then(blobStore.get(document.getContentKey()))
                        .flatMap(bytes -> parse(documentId, bytes))
                        .map(golden -> buildStandard(document, golden, actor, name, predecessor))
                        .flatMap(standard -> standardRepository.insert(standard)
                                .onErrorMap(DuplicateKeyException.class, e -> new ConflictException(
                                        ConflictException.STALE_LINEAGE,
                                        "Lineage " + standard.getLineageId() + " advanced concurrently")))
                        .flatMap(saved -> auditLedger.append(AuditEventKind.PROMOTE, actor,
                                        EntityRef.standard(saved.getId()), promotePayload(saved))
                                .thenReturn(saved)))
                .doOnNext(saved -> cache.put(saved.getId(), saved));
    }

    private Mono<Void> requireLineageHead(StandardDoc predecessor) {
        if (predecessor == null) {
            return Mono.empty();
        }
        return standardRepository.findFirstByLineageIdOrderByVersionDesc(predecessor.getLineageId())
                .flatMap(head -> head.getId().equals(predecessor.getId())
                        ? Mono.<Void>empty()
                        : Mono.error(ConflictException.staleLineage(predecessor.getId(), head.getId())))
                .then();
    }

    private Mono<DocumentStructure> parse(String documentId, byte[] bytes) {
        return Mono.fromCallable(() -> parser.parse(bytes))
                .subscribeOn(Schedulers.parallel())
                .onErrorMap(MalformedDocumentException.class, e -> new InvalidSourceDocumentException(
                        documentId, "Document " + documentId + " cannot be promoted: " + e.getMessage(), e));
    }

    private StandardDoc buildStandard(DocumentDoc document, DocumentStructure golden, String actor,
                                      String name, StandardDoc predecessor) {
        List<RuleDefinition> rules = ruleSetDeriver.derive(golden);
        String standardName = name != null && !name.isBlank()
                ? name.trim()
                : predecessor != null ? predecessor.getName() : baseName(document.getFilename());

        return StandardDoc.builder()
                .id(UUID.randomUUID().toString())
                .name(standardName)
                .lineageId(predecessor != null ? predecessor.getLineageId() : UUID.randomUUID().toString())
                .version(predecessor != null ? predecessor.getVersion() + 1 : 1)
                .predecessorId(predecessor != null ? predecessor.getId() : null)
                .rules(rules)
                .schemaVersion(golden.schemaVersion())
                .sourceDocumentId(document.getId())
                .sourceContentKey(document.getContentKey())
                .promotedBy(actor)
                .promotedAt(Instant.now())
                .build();
    }

    private static Map<String, Object> promotePayload(StandardDoc standard) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", standard.getName());
        payload.put("lineageId", standard.getLineageId());
        payload.put("version", standard.getVersion());
        if (standard.getPredecessorId() != null) {
            payload.put("predecessorId", standard.getPredecessorId());
        }
        payload.put("sourceDocumentId", standard.getSourceDocumentId());
        payload.put("sourceContentKey", standard.getSourceContentKey());
        payload.put("ruleCount", standard.getRules().size());
        return payload;
    }

    private static String baseName(String filename) {
        if (filename == null || filename.isBlank()) {
            return "Untitled standard";
        }
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
