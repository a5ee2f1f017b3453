package com.example.docstandards.standard.controller;

import com.example.docstandards.security.annotation.RequiredRole;
import com.example.docstandards.security.annotation.ResolvedAuth;
import com.example.docstandards.security.context.Role;
import com.example.docstandards.standard.model.request.PromoteRequest;
import com.example.docstandards.standard.model.response.LineageResponse;
import com.example.docstandards.standard.model.response.StandardListResponse;
import com.example.docstandards.standard.model.response.StandardResponse;
import com.example.docstandards.standard.service.StandardRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/standards")
@RequiredArgsConstructor
public class StandardController {

    private final StandardRegistry standardRegistry;

    @PostMapping("/promote")
    @ResponseStatus(HttpStatus.CREATED)
    @RequiredRole(Role.STANDARDS_ADMIN)
    public Mono<StandardResponse> promote(
            @ResolvedAuth String actor,
            @Valid @RequestBody PromoteRequest request) {

        log.debug("POST /standards/promote - subject: {}, documentId: {}, predecessor: {}",
                actor, request.documentId(), request.predecessorStandardId());
        return standardRegistry.promote(request.documentId(), actor, request.name(),
                        request.predecessorStandardId())
                .map(StandardResponse::from);
    }

    @GetMapping
    public Mono<StandardListResponse> listStandards(
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", required = false) Integer size) {

        log.debug("GET /standards - page: {}, size: {}", page, size);
        return standardRegistry.list(page, size).map(StandardListResponse::from);
    }

    @GetMapping("/{standardId}")
    public Mono<StandardResponse> getStandard(@PathVariable String standardId) {
        log.debug("GET /standards/{}", standardId);
        return standardRegistry.get(standardId).map(StandardResponse::from);
    }

    @GetMapping("/lineages/{lineageId}")
    public Mono<LineageResponse> getLineage(@PathVariable String lineageId) {
        log.debug("GET /standards/lineages/{}", lineageId);
        return standardRegistry.lineage(lineageId)
                .map(StandardResponse::from)
                .collectList()
                .map(versions -> new LineageResponse(lineageId, versions));
    }
}
