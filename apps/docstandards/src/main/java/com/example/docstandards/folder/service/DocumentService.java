package com.example.docstandards.folder.service;

import com.example.docstandards.audit.model.AuditEventKind;
import com.example.docstandards.audit.model.EntityRef;
import com.example.docstandards.audit.service.AuditLedger;
import com.example.docstandards.blob.BlobStore;
import com.example.docstandards.common.concurrent.KeyedMutex;
import com.example.docstandards.common.util.StringSanitizer;
import com.example.docstandards.config.AppProperties;
import com.example.docstandards.exception.ConflictException;
import com.example.docstandards.exception.NotFoundException;
import com.example.docstandards.folder.document.DocumentDoc;
import com.example.docstandards.folder.model.DocumentChange;
import com.example.docstandards.folder.model.DocumentContent;
import com.example.docstandards.folder.model.DocumentLifecycle;
import com.example.docstandards.folder.model.DocumentView;
import com.example.docstandards.folder.repository.DocumentRepository;
import com.example.docstandards.observability.metrics.ValidationMetrics;
import com.example.docstandards.standard.service.StandardRegistry;
import com.example.docstandards.validation.model.EnqueueResult;
import com.example.docstandards.validation.model.JobTrigger;
import com.example.docstandards.validation.service.ValidationJobService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Document lifecycle: upload, new content revisions, moves, renames, overrides and archival.
 *
 * <p>Every mutation that can change what a document is validated against enqueues a
 * validation job once the change is persisted and audited.
 */
@Slf4j
@Service
public class DocumentService {

    static final String DOCUMENT_LOCK_PREFIX = "document:";

    private static final Map<String, String> ODF_MEDIA_TYPES = Map.of(
            "odt", "application/vnd.oasis.opendocument.text",
            "ott", "application/vnd.oasis.opendocument.text-template",
            "ods", "application/vnd.oasis.opendocument.spreadsheet",
            "ots", "application/vnd.oasis.opendocument.spreadsheet-template",
            "odp", "application/vnd.oasis.opendocument.presentation",
            "otp", "application/vnd.oasis.opendocument.presentation-template");

    private final DocumentRepository documentRepository;
    private final FolderTreeService folderTreeService;
    private final StandardResolver resolver;
    private final StandardRegistry standardRegistry;
    private final ValidationJobService jobService;
    private final BlobStore blobStore;
    private final KeyedMutex keyedMutex;
    private final AuditLedger auditLedger;
    private final ValidationMetrics metrics;
    private final AppProperties.Documents documentConfig;

    public DocumentService(DocumentRepository documentRepository,
                           FolderTreeService folderTreeService,
                           StandardResolver resolver,
                           StandardRegistry standardRegistry,
                           ValidationJobService jobService,
                           BlobStore blobStore,
                           KeyedMutex keyedMutex,
                           AuditLedger auditLedger,
                           ValidationMetrics metrics,
                           AppProperties properties) {
        this.documentRepository = documentRepository;
        this.folderTreeService = folderTreeService;
        this.resolver = resolver;
        this.standardRegistry = standardRegistry;
        this.jobService = jobService;
        this.blobStore = blobStore;
        this.keyedMutex = keyedMutex;
        this.auditLedger = auditLedger;
        this.metrics = metrics;
        this.documentConfig = properties.getDocuments();
    }

    /**
     * Stores the bytes, records the document in {@code folderId} and enqueues its first validation.
     *
     * @throws NotFoundException        unknown folder
     * @throws IllegalArgumentException unsupported file type or size
     */
    @NonNull
    public Mono<DocumentChange> upload(@NonNull String folderId, @Nullable String filename,
                                       @NonNull byte[] content, @NonNull String actor) {
        String safeName = StringSanitizer.filename(filename);
        return Mono.fromCallable(() -> mediaTypeFor(safeName, content))
                .flatMap(contentType -> folderTreeService.getFolder(folderId)
                        .then(blobStore.put(content, contentType))
                        .flatMap(blob -> documentRepository.save(DocumentDoc.builder()
                                .id(UUID.randomUUID().toString())
                                .folderId(folderId)
                                .filename(safeName)
                                .contentType(contentType)
                                .contentKey(blob.key())
                                .contentSha256(blob.sha256())
                                .sizeBytes(blob.sizeBytes())
                                .revision(1)
                                .lifecycle(DocumentLifecycle.ACTIVE)
                                .uploadedBy(actor)
                                .createdAt(Instant.now())
                                .build())))
                .flatMap(saved -> auditLedger.append(AuditEventKind.UPLOAD, actor, EntityRef.document(saved.getId()),
                                contentPayload(saved, "folderId", folderId))
                        .thenReturn(saved))
                .doOnNext(saved -> {
                    metrics.recordDocumentUpload(saved.getSizeBytes());
                    log.info("Uploaded document: id={}, folderId={}, size={}, contentKey={}",
                            saved.getId(), folderId, saved.getSizeBytes(), saved.getContentKey());
                })
                .flatMap(saved -> enqueue(saved, JobTrigger.UPLOAD, actor));
    }

    /**
     * Replaces the content of an ACTIVE document. Identical bytes are a no-op.
     *
     * @throws ConflictException the document is archived
     */
    @NonNull
    public Mono<DocumentChange> revise(@NonNull String documentId, @NonNull byte[] content, @NonNull String actor) {
        return keyedMutex.withLock(DOCUMENT_LOCK_PREFIX + documentId, () -> getDocument(documentId)
                        .flatMap(document -> {
                            if (!document.isActive()) {
                                return Mono.error(ConflictException.invalidState(
                                        "Document " + documentId + " is archived"));
                            }
                            String contentType = mediaTypeFor(document.getFilename(), content);
                            return blobStore.put(content, contentType)
                                    .flatMap(blob -> {
                                        if (blob.key().equals(document.getContentKey())) {
                                            return Mono.just(new Mutation(document, false));
                                        }
                                        String previousKey = document.getContentKey();
                                        document.setContentKey(blob.key());
                                        document.setContentSha256(blob.sha256());
                                        document.setSizeBytes(blob.sizeBytes());
                                        document.setContentType(contentType);
                                        document.setRevision(document.getRevision() + 1);
                                        return documentRepository.save(document)
                                                .flatMap(saved -> auditLedger.append(AuditEventKind.DOCUMENT_REVISE,
                                                                actor, EntityRef.document(saved.getId()),
                                                                contentPayload(saved, "previousContentKey", previousKey))
                                                        .thenReturn(new Mutation(saved, true)));
                                    });
                        }))
                .flatMap(mutation -> {
                    if (!mutation.changed()) {
                        log.debug("Revision identical to current content: documentId={}", documentId);
                        return Mono.just(new DocumentChange(mutation.document(), null));
                    }
                    metrics.recordDocumentUpload(mutation.document().getSizeBytes());
                    log.info("Revised document: id={}, revision={}", documentId, mutation.document().getRevision());
                    return enqueue(mutation.document(), JobTrigger.REVISE, actor);
                });
    }

    /**
     * Moves a document to another folder, locking both the source and destination subtrees.
     *
     * @throws NotFoundException unknown document or folder
     */
    @NonNull
    public Mono<DocumentChange> move(@NonNull String documentId, @NonNull String targetFolderId,
                                     @NonNull String actor) {
        return folderTreeService.withSubtreeLocks(
                        () -> getDocument(documentId).flatMap(document -> Mono.zip(
                                folderTreeService.subtreeLockKeys(document.getFolderId()),
                                folderTreeService.subtreeLockKeys(targetFolderId),
                                (source, target) -> {
                                    Set<String> keys = FolderTreeService.union(source, target);
                                    keys.add(DOCUMENT_LOCK_PREFIX + documentId);
                                    return keys;
                                })),
                        () -> Mono.zip(getDocument(documentId), folderTreeService.getFolder(targetFolderId))
                                .flatMap(pair -> {
                                    DocumentDoc document = pair.getT1();
                                    String sourceFolderId = document.getFolderId();
                                    if (sourceFolderId.equals(targetFolderId)) {
                                        return Mono.just(new Mutation(document, false));
                                    }
                                    document.setFolderId(targetFolderId);
                                    return documentRepository.save(document)
                                            .flatMap(saved -> auditLedger.append(AuditEventKind.DOCUMENT_MOVE, actor,
                                                            EntityRef.document(saved.getId()),
                                                            Map.of("fromFolderId", sourceFolderId,
                                                                    "toFolderId", targetFolderId))
                                                    .thenReturn(new Mutation(saved, true)));
                                }))
                .flatMap(mutation -> {
                    if (!mutation.changed()) {
                        return Mono.just(new DocumentChange(mutation.document(), null));
                    }
                    log.info("Moved document: id={}, folderId={}", documentId, targetFolderId);
                    return enqueue(mutation.document(), JobTrigger.MOVE, actor);
                });
    }

    /**
     * Sets a per-document Standard override, or clears it when {@code standardId} is null.
     *
     * @throws NotFoundException unknown document or Standard
     */
    @NonNull
    public Mono<DocumentChange> setOverride(@NonNull String documentId, @Nullable String standardId,
                                            @NonNull String actor) {
        Mono<Void> standardExists = standardId == null
                ? Mono.empty()
                : standardRegistry.get(standardId).then();

        return standardExists
                .then(keyedMutex.withLock(DOCUMENT_LOCK_PREFIX + documentId, () -> getDocument(documentId)
                        .flatMap(document -> {
                            String previous = document.getOverrideStandardId();
                            if (Objects.equals(previous, standardId)) {
                                return Mono.just(new Mutation(document, false));
                            }
                            AuditEventKind kind = standardId != null
                                    ? AuditEventKind.OVERRIDE_SET
                                    : AuditEventKind.OVERRIDE_CLEAR;
                            Map<String, Object> payload = new LinkedHashMap<>();
                            if (standardId != null) {
                                payload.put("standardId", standardId);
                            }
                            if (previous != null) {
                                payload.put("previousStandardId", previous);
                            }
                            document.setOverrideStandardId(standardId);
                            return documentRepository.save(document)
                                    .flatMap(saved -> auditLedger.append(kind, actor,
                                                    EntityRef.document(saved.getId()), payload)
                                            .thenReturn(new Mutation(saved, true)));
                        })))
                .flatMap(mutation -> {
                    if (!mutation.changed()) {
                        return Mono.just(new DocumentChange(mutation.document(), null));
                    }
                    log.info("Override {}: documentId={}, standardId={}",
                            standardId != null ? "set" : "cleared", documentId, standardId);
                    return enqueue(mutation.document(), JobTrigger.OVERRIDE, actor);
                });
    }

    /**
     * Renames an ACTIVE document. The extension must stay the same because it fixes the
     * media type the content was accepted as. Names play no part in validation, so nothing
     * is re-enqueued.
     *
     * @throws ConflictException        the document is archived
     * @throws IllegalArgumentException the new name changes the extension
     */
    @NonNull
    public Mono<DocumentDoc> rename(@NonNull String documentId, @NonNull String filename, @NonNull String actor) {
        String newName = StringSanitizer.filename(filename);
        return keyedMutex.withLock(DOCUMENT_LOCK_PREFIX + documentId, () -> getDocument(documentId)
                .flatMap(document -> {
                    if (!document.isActive()) {
                        return Mono.error(ConflictException.invalidState("Document " + documentId + " is archived"));
                    }
                    String previousName = document.getFilename();
                    if (newName.equals(previousName)) {
                        return Mono.just(document);
                    }
                    if (!extension(newName).equals(extension(previousName))) {
                        return Mono.error(new IllegalArgumentException(
                                "Renaming must keep the ." + extension(previousName) + " extension"));
                    }
                    document.setFilename(newName);
                    return documentRepository.save(document)
                            .flatMap(saved -> auditLedger.append(AuditEventKind.DOCUMENT_RENAME, actor,
                                            EntityRef.document(saved.getId()),
                                            Map.of("previousName", previousName, "name", newName))
                                    .thenReturn(saved))
                            .doOnNext(saved -> log.info("Renamed document: id={}", documentId));
                }));
    }

    /**
     * Documents placed directly in a folder, optionally only those in one lifecycle state.
     *
     * @throws NotFoundException unknown folder
     */
    @NonNull
    public Flux<DocumentDoc> documentsIn(@NonNull String folderId, @Nullable DocumentLifecycle lifecycle) {
        return folderTreeService.getFolder(folderId)
                .flatMapMany(folder -> lifecycle == null
                        ? documentRepository.findByFolderId(folder.getId())
                        : documentRepository.findByFolderIdAndLifecycle(folder.getId(), lifecycle));
    }

    /**
     * Current content of a document, archived ones included.
     *
     * @throws NotFoundException unknown document, or its blob is missing
     */
    @NonNull
    public Mono<DocumentContent> getContent(@NonNull String documentId) {
        return getDocument(documentId)
                .flatMap(document -> blobStore.get(document.getContentKey())
                        .map(bytes -> new DocumentContent(document, bytes)));
    }

    /**
     * Archives a document. Archived documents are never validated again; their pending
     * jobs end SKIPPED.
     */
    @NonNull
    public Mono<DocumentDoc> archive(@NonNull String documentId, @NonNull String actor) {
        return keyedMutex.withLock(DOCUMENT_LOCK_PREFIX + documentId, () -> getDocument(documentId)
                .flatMap(document -> {
                    if (!document.isActive()) {
                        return Mono.just(document);
                    }
                    document.setLifecycle(DocumentLifecycle.ARCHIVED);
                    return documentRepository.save(document)
                            .flatMap(saved -> auditLedger.append(AuditEventKind.DOCUMENT_ARCHIVE, actor,
                                            EntityRef.document(saved.getId()),
                                            Map.of("folderId", saved.getFolderId()))
                                    .thenReturn(saved))
                            .doOnNext(saved -> log.info("Archived document: id={}", documentId));
                }));
    }

    /**
     * The document with the Standard that currently governs it.
     *
     * @throws NotFoundException unknown document
     */
    @NonNull
    public Mono<DocumentView> getDocumentView(@NonNull String documentId) {
        return getDocument(documentId)
                .flatMap(document -> resolver.resolve(document)
                        .flatMap(resolution -> resolution.isResolved()
                                ? standardRegistry.findById(resolution.standardId())
                                        .map(standard -> new DocumentView(document, resolution, standard))
                                        .defaultIfEmpty(new DocumentView(document, resolution, null))
                                : Mono.just(new DocumentView(document, resolution, null))));
    }

    /**
     * @throws NotFoundException unknown document
     */
    @NonNull
    public Mono<DocumentDoc> getDocument(@NonNull String documentId) {
        return documentRepository.findById(documentId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Document", documentId)));
    }

    private Mono<DocumentChange> enqueue(DocumentDoc document, JobTrigger trigger, String actor) {
        return jobService.enqueue(document, trigger, actor)
                .map(EnqueueResult::job)
                .map(job -> new DocumentChange(document, job))
                .defaultIfEmpty(new DocumentChange(document, null));
    }

    private static String extension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot >= 0 ? filename.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    // Validates extension and size; returns the ODF media type for the extension
    private String mediaTypeFor(String filename, byte[] content) {
        String extension = extension(filename);
        if (!documentConfig.getAllowedExtensions().contains(extension) || !ODF_MEDIA_TYPES.containsKey(extension)) {
            throw new IllegalArgumentException("Unsupported file type: " + (extension.isEmpty() ? "none" : extension)
                    + ". Allowed: " + String.join(", ", documentConfig.getAllowedExtensions()));
        }
        if (content.length == 0) {
            throw new IllegalArgumentException("File is empty");
        }
        long maxBytes = (long) documentConfig.getMaxFileSizeMb() * 1024 * 1024;
        if (content.length > maxBytes) {
            throw new IllegalArgumentException("File exceeds maximum size of " + documentConfig.getMaxFileSizeMb() + "MB");
        }
        return ODF_MEDIA_TYPES.get(extension);
    }

    private static Map<String, Object> contentPayload(DocumentDoc document, String extraKey, String extraValue) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("filename", document.getFilename());
        payload.put("revision", document.getRevision());
        payload.put("contentKey", document.getContentKey());
        payload.put("sizeBytes", document.getSizeBytes());
        if (extraValue != null) {
            payload.put(extraKey, extraValue);
        }
        return payload;
    }

    private record Mutation(DocumentDoc document, boolean changed) {
    }
}
