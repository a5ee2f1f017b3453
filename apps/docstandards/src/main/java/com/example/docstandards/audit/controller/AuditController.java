package com.example.docstandards.audit.controller;

import com.example.docstandards.audit.dto.AuditEventResponse;
import com.example.docstandards.audit.dto.AuditPageResponse;
import com.example.docstandards.audit.model.EntityRef;
import com.example.docstandards.audit.service.AuditLedger;
import com.example.docstandards.security.annotation.ResolvedAuth;
import com.example.docstandards.security.context.AuthContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditLedger auditLedger;

    @GetMapping
    public Mono<AuditPageResponse> history(
            @ResolvedAuth AuthContext auth,
            @RequestParam("entity") String entity,
            @RequestParam(value = "sinceId", required = false) Long sinceId,
            @RequestParam(value = "limit", required = false) Integer limit) {

        EntityRef ref = EntityRef.parse(entity);
        log.debug("GET /audit - subject: {}, entity: {}, sinceId: {}", auth.subject(), ref, sinceId);
        return auditLedger.page(ref, sinceId, limit)
                .map(page -> new AuditPageResponse(
                        page.events().stream().map(AuditEventResponse::from).toList(),
                        page.nextSinceId()));
    }
}
