package com.example.docstandards.folder.controller;

import com.example.docstandards.folder.model.DocumentLifecycle;
import com.example.docstandards.folder.model.request.AssignStandardRequest;
import com.example.docstandards.folder.model.request.CreateFolderRequest;
import com.example.docstandards.folder.model.request.MoveFolderRequest;
import com.example.docstandards.folder.model.request.RenameRequest;
import com.example.docstandards.folder.model.response.AssignmentResponse;
import com.example.docstandards.folder.model.response.DocumentResponse;
import com.example.docstandards.folder.model.response.FolderResponse;
import com.example.docstandards.folder.model.response.ResolutionResponse;
import com.example.docstandards.folder.service.DocumentService;
import com.example.docstandards.folder.service.FolderTreeService;
import com.example.docstandards.security.annotation.RequiredRole;
import com.example.docstandards.security.annotation.ResolvedAuth;
import com.example.docstandards.security.context.AuthContext;
import com.example.docstandards.security.context.Role;
import com.example.docstandards.standard.service.StandardRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/folders")
@RequiredArgsConstructor
public class FolderController {

    private final FolderTreeService folderTreeService;
    private final StandardRegistry standardRegistry;
    private final DocumentService documentService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @RequiredRole({Role.EDITOR, Role.STANDARDS_ADMIN})
    public Mono<FolderResponse> createFolder(
            @ResolvedAuth AuthContext auth,
            @Valid @RequestBody CreateFolderRequest request) {

        log.debug("POST /folders - subject: {}, parentId: {}", auth.subject(), request.parentId());
        return folderTreeService.createFolder(request.name(), request.parentId(), auth.subject())
                .map(folder -> FolderResponse.from(folder, List.of()));
    }

    @GetMapping("/{folderId}")
    public Mono<FolderResponse> getFolder(@PathVariable String folderId) {
        log.debug("GET /folders/{}", folderId);
        return folderTreeService.getFolder(folderId)
                .flatMap(folder -> folderTreeService.children(folderId)
                        .collectList()
                        .map(children -> FolderResponse.from(folder, children)));
    }

    @PostMapping("/{folderId}/move")
    @RequiredRole({Role.EDITOR, Role.STANDARDS_ADMIN})
    public Mono<FolderResponse> moveFolder(
            @ResolvedAuth AuthContext auth,
            @PathVariable String folderId,
            @Valid @RequestBody MoveFolderRequest request) {

        log.debug("POST /folders/{}/move - subject: {}, parentId: {}", folderId, auth.subject(), request.parentId());
        return folderTreeService.moveFolder(folderId, request.parentId(), auth.subject())
                .map(folder -> FolderResponse.from(folder, List.of()));
    }

    @PostMapping("/{folderId}/rename")
    @RequiredRole({Role.EDITOR, Role.STANDARDS_ADMIN})
    public Mono<FolderResponse> renameFolder(
            @ResolvedAuth String actor,
            @PathVariable String folderId,
            @Valid @RequestBody RenameRequest request) {

        log.debug("POST /folders/{}/rename - subject: {}", folderId, actor);
        return folderTreeService.renameFolder(folderId, request.name(), actor)
                .map(folder -> FolderResponse.from(folder, List.of()));
    }

    @GetMapping("/{folderId}/documents")
    public Flux<DocumentResponse> getFolderDocuments(
            @PathVariable String folderId,
            @RequestParam(value = "lifecycle", required = false) DocumentLifecycle lifecycle) {

        log.debug("GET /folders/{}/documents - lifecycle: {}", folderId, lifecycle);
        return documentService.documentsIn(folderId, lifecycle)
                .map(DocumentResponse::from);
    }

    @PostMapping("/{folderId}/assign")
    @RequiredRole(Role.STANDARDS_ADMIN)
    public Mono<AssignmentResponse> assignStandard(
            @ResolvedAuth AuthContext auth,
            @PathVariable String folderId,
            @RequestBody AssignStandardRequest request) {

        log.debug("POST /folders/{}/assign - subject: {}, standardId: {}",
                folderId, auth.subject(), request.standardId());
        return folderTreeService.assignStandard(folderId, blankToNull(request.standardId()), auth.subject())
                .map(AssignmentResponse::from);
    }

    @GetMapping("/{folderId}/effective-standard")
    public Mono<ResolutionResponse> getEffectiveStandard(@PathVariable String folderId) {
        log.debug("GET /folders/{}/effective-standard", folderId);
        return folderTreeService.effectiveStandard(folderId)
                .flatMap(resolution -> resolution.isResolved()
                        ? standardRegistry.findById(resolution.standardId())
                                .map(standard -> ResolutionResponse.from(resolution, standard))
                                .defaultIfEmpty(ResolutionResponse.from(resolution, null))
                        : Mono.just(ResolutionResponse.from(resolution, null)));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
