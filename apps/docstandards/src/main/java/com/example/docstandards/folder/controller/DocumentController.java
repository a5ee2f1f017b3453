package com.example.docstandards.folder.controller;

import com.example.docstandards.config.AppProperties;
import com.example.docstandards.folder.model.request.MoveDocumentRequest;
import com.example.docstandards.folder.model.request.OverrideRequest;
import com.example.docstandards.folder.model.request.RenameRequest;
import com.example.docstandards.folder.model.response.DocumentResponse;
import com.example.docstandards.folder.service.DocumentService;
import com.example.docstandards.security.annotation.RequiredRole;
import com.example.docstandards.security.annotation.ResolvedAuth;
import com.example.docstandards.security.context.AuthContext;
import com.example.docstandards.security.context.Role;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

@Slf4j
@RestController
@RequestMapping("/api/v1/documents")
public class DocumentController {

    private final DocumentService documentService;
    private final int maxFileBytes;

    public DocumentController(DocumentService documentService, AppProperties properties) {
        this.documentService = documentService;
        this.maxFileBytes = properties.getDocuments().getMaxFileSizeMb() * 1024 * 1024;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    @RequiredRole({Role.EDITOR, Role.STANDARDS_ADMIN})
    public Mono<DocumentResponse> upload(
            @ResolvedAuth AuthContext auth,
            @RequestPart("folderId") String folderId,
            @RequestPart("file") FilePart file) {

        log.debug("POST /documents - subject: {}, folderId: {}, filename: {}",
                auth.subject(), folderId, file.filename());
        return readContent(file)
                .flatMap(content -> documentService.upload(folderId.trim(), file.filename(), content, auth.subject()))
                .map(DocumentResponse::from);
    }

    @PutMapping(value = "/{documentId}/content", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @RequiredRole({Role.EDITOR, Role.STANDARDS_ADMIN})
    public Mono<DocumentResponse> revise(
            @ResolvedAuth AuthContext auth,
            @PathVariable String documentId,
            @RequestPart("file") FilePart file) {

        log.debug("PUT /documents/{}/content - subject: {}", documentId, auth.subject());
        return readContent(file)
                .flatMap(content -> documentService.revise(documentId, content, auth.subject()))
                .map(DocumentResponse::from);
    }

    @PostMapping("/{documentId}/move")
    @RequiredRole({Role.EDITOR, Role.STANDARDS_ADMIN})
    public Mono<DocumentResponse> move(
            @ResolvedAuth AuthContext auth,
            @PathVariable String documentId,
            @Valid @RequestBody MoveDocumentRequest request) {

        log.debug("POST /documents/{}/move - subject: {}, folderId: {}", documentId, auth.subject(), request.folderId());
        return documentService.move(documentId, request.folderId(), auth.subject())
                .map(DocumentResponse::from);
    }

    @PostMapping("/{documentId}/override")
    @RequiredRole(Role.STANDARDS_ADMIN)
    public Mono<DocumentResponse> setOverride(
            @ResolvedAuth AuthContext auth,
            @PathVariable String documentId,
            @RequestBody OverrideRequest request) {

        String standardId = request.standardId() == null || request.standardId().isBlank()
                ? null
                : request.standardId();
        log.debug("POST /documents/{}/override - subject: {}, standardId: {}", documentId, auth.subject(), standardId);
        return documentService.setOverride(documentId, standardId, auth.subject())
                .map(DocumentResponse::from);
    }

    @PostMapping("/{documentId}/rename")
    @RequiredRole({Role.EDITOR, Role.STANDARDS_ADMIN})
    public Mono<DocumentResponse> rename(
            @ResolvedAuth String actor,
            @PathVariable String documentId,
            @Valid @RequestBody RenameRequest request) {

        log.debug("POST /documents/{}/rename - subject: {}", documentId, actor);
        return documentService.rename(documentId, request.name(), actor)
                .map(DocumentResponse::from);
    }

    @GetMapping("/{documentId}/content")
    public Mono<ResponseEntity<byte[]>> getContent(@PathVariable String documentId) {
        log.debug("GET /documents/{}/content", documentId);
        return documentService.getContent(documentId)
                .map(content -> ResponseEntity.ok()
                        .contentType(content.document().getContentType() != null
                                ? MediaType.parseMediaType(content.document().getContentType())
                                : MediaType.APPLICATION_OCTET_STREAM)
                        .contentLength(content.content().length)
                        .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                                .filename(content.document().getFilename(), StandardCharsets.UTF_8)
                                .build()
                                .toString())
                        .body(content.content()));
    }

    @PostMapping("/{documentId}/archive")
    @RequiredRole({Role.EDITOR, Role.STANDARDS_ADMIN})
    public Mono<DocumentResponse> archive(
            @ResolvedAuth AuthContext auth,
            @PathVariable String documentId) {

        log.debug("POST /documents/{}/archive - subject: {}", documentId, auth.subject());
        return documentService.archive(documentId, auth.subject())
                .map(DocumentResponse::from);
    }

    @GetMapping("/{documentId}")
    public Mono<DocumentResponse> getDocument(@PathVariable String documentId) {
        log.debug("GET /documents/{}", documentId);
        return documentService.getDocumentView(documentId)
                .map(DocumentResponse::from);
    }

    private Mono<byte[]> readContent(FilePart file) {
        return DataBufferUtils.join(file.content(), maxFileBytes)
                .map(buffer -> {
                    try {
                        byte[] bytes = new byte[buffer.readableByteCount()];
                        buffer.read(bytes);
                        return bytes;
                    } finally {
                        DataBufferUtils.release(buffer);
                    }
                })
                .defaultIfEmpty(new byte[0])
                .onErrorMap(DataBufferLimitException.class, e -> new IllegalArgumentException(
                        "File exceeds maximum size of " + (maxFileBytes / (1024 * 1024)) + "MB"));
    }
}
