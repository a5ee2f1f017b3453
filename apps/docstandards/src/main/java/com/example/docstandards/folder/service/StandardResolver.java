package com.example.docstandards.folder.service;

import com.example.docstandards.exception.NotFoundException;
import com.example.docstandards.folder.document.DocumentDoc;
import com.example.docstandards.folder.document.FolderDoc;
import com.example.docstandards.folder.model.Resolution;
import com.example.docstandards.folder.repository.DocumentRepository;
import com.example.docstandards.folder.repository.FolderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Resolves the Standard that governs a document.
 *
 * <p>A document override wins unconditionally. Otherwise the nearest assignment on the
 * path from the document's folder up to the root applies. With neither, the document is
 * exempt and {@link Resolution#none()} is returned.
 */
@Slf4j
@Service
public class StandardResolver {

    // Guards the upward walk against a corrupted parent chain
    static final int MAX_DEPTH = 1024;

    private final FolderRepository folderRepository;
    private final DocumentRepository documentRepository;

    public StandardResolver(FolderRepository folderRepository, DocumentRepository documentRepository) {
        this.folderRepository = folderRepository;
        this.documentRepository = documentRepository;
    }

    /**
     * @throws NotFoundException unknown document
     */
    @NonNull
    public Mono<Resolution> resolveStandard(@NonNull String documentId) {
        return documentRepository.findById(documentId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Document", documentId)))
                .flatMap(this::resolve);
    }

    @NonNull
    public Mono<Resolution> resolve(@NonNull DocumentDoc document) {
        if (document.getOverrideStandardId() != null) {
            return Mono.just(Resolution.override(document.getOverrideStandardId(), document.getId()));
        }
        return folderRepository.findById(document.getFolderId())
                .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                        "Folder " + document.getFolderId() + " of document " + document.getId() + " does not exist")))
                .flatMap(this::resolveFrom);
    }

    /**
     * The same walk as for documents, starting at a folder.
     *
     * @throws NotFoundException unknown folder
     */
    @NonNull
    public Mono<Resolution> effectiveStandard(@NonNull String folderId) {
        return folderRepository.findById(folderId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Folder", folderId)))
                .flatMap(this::resolveFrom);
    }

    /**
     * The folder followed by its ancestors, ending at the root.
     * Errors when the chain is broken or deeper than {@link #MAX_DEPTH}.
     */
    @NonNull
    public Flux<FolderDoc> ancestry(@NonNull FolderDoc folder) {
        return Flux.just(folder)
                .expand(current -> current.isRoot()
                        ? Mono.empty()
                        : folderRepository.findById(current.getParentId())
                                .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                                        "Parent " + current.getParentId() + " of folder " + current.getId()
                                                + " does not exist"))))
                .index()
                .map(indexed -> {
                    if (indexed.getT1() >= MAX_DEPTH) {
                        throw new IllegalStateException("Folder chain above " + folder.getId()
                                + " exceeds " + MAX_DEPTH + " levels");
                    }
                    return indexed.getT2();
                });
    }

    private Mono<Resolution> resolveFrom(FolderDoc folder) {
        return ancestry(folder)
                .filter(candidate -> candidate.getAssignedStandardId() != null)
                .next()
                .map(assigned -> Resolution.folder(assigned.getAssignedStandardId(), assigned.getId()))
                .defaultIfEmpty(Resolution.none());
    }
}
