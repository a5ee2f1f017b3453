package com.example.docstandards.folder.service;

import com.example.docstandards.audit.model.AuditEventKind;
import com.example.docstandards.audit.model.EntityRef;
import com.example.docstandards.audit.service.AuditLedger;
import com.example.docstandards.common.concurrent.KeyedMutex;
import com.example.docstandards.exception.ConflictException;
import com.example.docstandards.exception.CycleRejectedException;
import com.example.docstandards.exception.LockTimeoutException;
import com.example.docstandards.exception.NotFoundException;
import com.example.docstandards.folder.document.FolderDoc;
import com.example.docstandards.folder.model.AssignmentResult;
import com.example.docstandards.folder.model.DocumentLifecycle;
import com.example.docstandards.folder.model.Resolution;
import com.example.docstandards.folder.repository.DocumentRepository;
import com.example.docstandards.folder.repository.FolderRepository;
import com.example.docstandards.standard.service.StandardRegistry;
import com.example.docstandards.validation.model.JobTrigger;
import com.example.docstandards.validation.service.ValidationJobService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Mutations of the folder tree: creation, re-parenting and Standard assignment.
 *
 * <p>Mutations are serialized per top-level subtree, the subtree rooted at the root's child on
 * the path to the folder. Mutations of the root itself lock the whole tree. Lock keys are
 * recomputed after acquisition; if a concurrent move changed them, the locks are released and
 * acquisition starts over.
 */
@Slf4j
@Service
public class FolderTreeService {

    static final String TREE_LOCK_PREFIX = "tree:";
    static final String ROOT_LOCK = TREE_LOCK_PREFIX + "/";
    private static final int MAX_LOCK_ATTEMPTS = 3;

    private final FolderRepository folderRepository;
    private final DocumentRepository documentRepository;
    private final StandardResolver resolver;
    private final StandardRegistry standardRegistry;
    private final ValidationJobService jobService;
    private final KeyedMutex keyedMutex;
    private final AuditLedger auditLedger;

    public FolderTreeService(FolderRepository folderRepository,
                             DocumentRepository documentRepository,
                             StandardResolver resolver,
                             StandardRegistry standardRegistry,
                             ValidationJobService jobService,
                             KeyedMutex keyedMutex,
                             AuditLedger auditLedger) {
        this.folderRepository = folderRepository;
        this.documentRepository = documentRepository;
        this.resolver = resolver;
        this.standardRegistry = standardRegistry;
        this.jobService = jobService;
        this.keyedMutex = keyedMutex;
        this.auditLedger = auditLedger;
    }

    /**
     * Creates a folder under {@code parentId}, or the root when {@code parentId} is null.
     *
     * @throws NotFoundException unknown parent
     * @throws ConflictException a root already exists
     */
    @NonNull
    public Mono<FolderDoc> createFolder(@NonNull String name, @Nullable String parentId, @NonNull String actor) {
        String folderName = name.trim();
        if (parentId == null) {
            return keyedMutex.withLock(ROOT_LOCK, () -> folderRepository.findByParentIdIsNull()
                    .hasElements()
                    .flatMap(rootExists -> rootExists
                            ? Mono.error(new ConflictException(ConflictException.ROOT_EXISTS,
                                    "A root folder already exists"))
                            : insertFolder(folderName, null, actor)));
        }
        return withSubtreeLocks(() -> subtreeLockKeys(parentId),
                () -> getFolder(parentId).flatMap(parent -> insertFolder(folderName, parent.getId(), actor)));
    }

    /**
     * @throws NotFoundException unknown folder
     */
    @NonNull
    public Mono<FolderDoc> getFolder(@NonNull String folderId) {
        return folderRepository.findById(folderId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Folder", folderId)));
    }

    @NonNull
    public Flux<FolderDoc> children(@NonNull String folderId) {
        return folderRepository.findByParentId(folderId);
    }

    @NonNull
    public Mono<Resolution> effectiveStandard(@NonNull String folderId) {
        return resolver.effectiveStandard(folderId);
    }

    /**
     * Re-parents a folder with its whole subtree and re-enqueues the documents whose
     * inheritance chain changed.
     *
     * @throws CycleRejectedException the new parent is the folder itself or one of its descendants
     * @throws ConflictException      the folder is the root
     */
    @NonNull
    public Mono<FolderDoc> moveFolder(@NonNull String folderId, @NonNull String newParentId, @NonNull String actor) {
        return withSubtreeLocks(
                () -> Mono.zip(subtreeLockKeys(folderId), subtreeLockKeys(newParentId), FolderTreeService::union),
                () -> Mono.zip(getFolder(folderId), getFolder(newParentId))
                        .flatMap(pair -> relocate(pair.getT1(), pair.getT2(), actor)))
                .flatMap(change -> {
                    FolderDoc folder = change.folder();
                    // An own assignment shadows everything below, so nothing inherits differently
                    if (!change.changed() || folder.getAssignedStandardId() != null) {
                        return Mono.just(folder);
                    }
                    return revalidate(folder, JobTrigger.MOVE, actor).thenReturn(folder);
                });
    }

    /**
     * Renames a folder. Names play no part in resolution, so nothing is re-enqueued.
     *
     * @throws NotFoundException unknown folder
     */
    @NonNull
    public Mono<FolderDoc> renameFolder(@NonNull String folderId, @NonNull String name, @NonNull String actor) {
        String newName = name.trim();
        if (newName.isEmpty()) {
            return Mono.error(new IllegalArgumentException("Folder name must not be blank"));
        }
        return withSubtreeLocks(() -> subtreeLockKeys(folderId), () -> getFolder(folderId)
                .flatMap(folder -> {
                    String previousName = folder.getName();
                    if (newName.equals(previousName)) {
                        return Mono.just(folder);
                    }
                    folder.setName(newName);
                    return folderRepository.save(folder)
                            .flatMap(saved -> auditLedger.append(AuditEventKind.FOLDER_RENAME, actor,
                                            EntityRef.folder(saved.getId()),
                                            Map.of("previousName", previousName, "name", newName))
                                    .thenReturn(saved))
                            .doOnNext(saved -> log.info("Renamed folder: id={}", saved.getId()));
                }));
    }

    /**
     * Assigns a Standard to a folder, or clears the assignment when {@code standardId} is null.
     *
     * @throws NotFoundException unknown folder or Standard
     */
    @NonNull
    public Mono<AssignmentResult> assignStandard(@NonNull String folderId, @Nullable String standardId,
                                                 @NonNull String actor) {
        Mono<Void> standardExists = standardId == null
                ? Mono.empty()
                : standardRegistry.get(standardId).then();

        return standardExists
                .then(withSubtreeLocks(() -> subtreeLockKeys(folderId),
                        () -> getFolder(folderId).flatMap(folder -> applyAssignment(folder, standardId, actor))))
                .flatMap(result -> result.changed()
                        ? revalidate(result.folder(), JobTrigger.ASSIGN, actor).map(result::withRevalidated)
                        : Mono.just(result));
    }

    /**
     * Enqueues every ACTIVE document at or below {@code start} that inherits through it,
     * skipping subtrees with their own assignment and documents with an override.
     */
    Mono<Long> revalidate(FolderDoc start, JobTrigger trigger, String actor) {
        return Flux.just(start)
                .expand(folder -> folderRepository.findByParentId(folder.getId())
                        .filter(child -> child.getAssignedStandardId() == null))
                .concatMap(folder -> documentRepository.findByFolderIdAndLifecycle(folder.getId(), DocumentLifecycle.ACTIVE))
                .filter(document -> document.getOverrideStandardId() == null)
                .concatMap(document -> jobService.enqueue(document, trigger, actor)
                        .onErrorResume(e -> {
                            log.error("Failed to enqueue revalidation: documentId={}, trigger={}",
                                    document.getId(), trigger, e);
                            return Mono.empty();
                        }))
                .count()
                .doOnNext(count -> log.info("Revalidation requested: folderId={}, trigger={}, documents={}",
                        start.getId(), trigger, count));
    }

    /**
     * Runs {@code action} holding the locks named by {@code lockKeys}, re-checking the keys
     * once held. Package-private for document mutations that touch folder membership.
     */
    <T> Mono<T> withSubtreeLocks(Supplier<Mono<Set<String>>> lockKeys, Supplier<Mono<T>> action) {
        return Mono.defer(() -> lockKeys.get()
                        .flatMap(keys -> keyedMutex.withLocks(keys, () -> lockKeys.get()
                                .flatMap(current -> keys.containsAll(current)
                                        ? action.get()
                                        : Mono.<T>error(new SubtreeChangedException())))))
                .retryWhen(Retry.max(MAX_LOCK_ATTEMPTS - 1)
                        .filter(SubtreeChangedException.class::isInstance)
                        .onRetryExhaustedThrow((retrySpec, signal) -> new LockTimeoutException(
                                "Folder tree kept changing while acquiring locks")));
    }

    /**
     * Lock keys guarding the subtree that contains {@code folderId}.
     *
     * @throws NotFoundException unknown folder
     */
    Mono<Set<String>> subtreeLockKeys(String folderId) {
        return getFolder(folderId)
                .flatMap(folder -> resolver.ancestry(folder).collectList())
                .flatMap(path -> {
                    if (path.size() == 1) {
                        return wholeTreeLockKeys(path.get(0));
                    }
                    FolderDoc topLevel = path.get(path.size() - 2);
                    return Mono.just(Set.of(TREE_LOCK_PREFIX + topLevel.getId()));
                });
    }

    static Set<String> union(Set<String> first, Set<String> second) {
        Set<String> keys = new HashSet<>(first);
        keys.addAll(second);
        return keys;
    }

    private Mono<Set<String>> wholeTreeLockKeys(FolderDoc root) {
        return folderRepository.findByParentId(root.getId())
                .map(child -> TREE_LOCK_PREFIX + child.getId())
                .collectList()
                .map(childKeys -> {
                    Set<String> keys = new HashSet<>(childKeys);
                    keys.add(ROOT_LOCK);
                    return keys;
                });
    }

    private Mono<FolderDoc> insertFolder(String name, String parentId, String actor) {
        FolderDoc folder = FolderDoc.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .parentId(parentId)
                .createdBy(actor)
                .createdAt(Instant.now())
                .build();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", name);
        if (parentId != null) {
            payload.put("parentId", parentId);
        }

        return folderRepository.save(folder)
                .flatMap(saved -> auditLedger.append(AuditEventKind.FOLDER_CREATE, actor,
                                EntityRef.folder(saved.getId()), payload)
                        .thenReturn(saved))
                .doOnNext(saved -> log.info("Created folder: id={}, parentId={}", saved.getId(), parentId));
    }

    private Mono<FolderChange> relocate(FolderDoc folder, FolderDoc newParent, String actor) {
        if (folder.isRoot()) {
            return Mono.error(ConflictException.invalidState("The root folder cannot be moved"));
        }
        if (newParent.getId().equals(folder.getParentId())) {
            return Mono.just(new FolderChange(folder, false));
        }
        if (newParent.getId().equals(folder.getId())) {
            return Mono.error(new CycleRejectedException(folder.getId(), newParent.getId()));
        }

        return resolver.ancestry(newParent)
                .any(ancestor -> ancestor.getId().equals(folder.getId()))
                .flatMap(wouldCycle -> {
                    if (wouldCycle) {
                        return Mono.error(new CycleRejectedException(folder.getId(), newParent.getId()));
                    }
                    String previousParentId = folder.getParentId();
                    folder.setParentId(newParent.getId());
                    return folderRepository.save(folder)
                            .flatMap(saved -> auditLedger.append(AuditEventKind.FOLDER_MOVE, actor,
                                            EntityRef.folder(saved.getId()),
                                            Map.of("fromParentId", previousParentId, "toParentId", newParent.getId()))
                                    .thenReturn(new FolderChange(saved, true)));
                })
                .doOnNext(change -> {
                    if (change.changed()) {
                        log.info("Moved folder: id={}, newParentId={}", folder.getId(), newParent.getId());
                    }
                });
    }

    private Mono<AssignmentResult> applyAssignment(FolderDoc folder, String standardId, String actor) {
        String previous = folder.getAssignedStandardId();
        if (Objects.equals(previous, standardId)) {
            log.debug("Assignment unchanged: folderId={}, standardId={}", folder.getId(), standardId);
            return Mono.just(new AssignmentResult(folder, previous, false, 0));
        }

        AuditEventKind kind = previous == null ? AuditEventKind.ASSIGN : AuditEventKind.REASSIGN;
        Map<String, Object> payload = new LinkedHashMap<>();
        if (standardId != null) {
            payload.put("standardId", standardId);
        }
        if (previous != null) {
            payload.put("previousStandardId", previous);
        }

        folder.setAssignedStandardId(standardId);
        return folderRepository.save(folder)
                .flatMap(saved -> auditLedger.append(kind, actor, EntityRef.folder(saved.getId()), payload)
                        .thenReturn(new AssignmentResult(saved, previous, true, 0)))
                .doOnNext(result -> log.info("{} standard: folderId={}, standardId={}, previous={}",
                        kind, folder.getId(), standardId, previous));
    }

    private record FolderChange(FolderDoc folder, boolean changed) {
    }

    // Signals that lock keys drifted between computing and acquiring them
    private static final class SubtreeChangedException extends RuntimeException {
        SubtreeChangedException() {
            super("Subtree changed while acquiring locks", null, false, false);
        }
    }
}
