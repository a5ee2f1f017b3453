package com.example.docstandards.audit.dto;

import com.example.docstandards.audit.document.AuditEventDoc;
import com.example.docstandards.audit.model.AuditEventKind;

import java.time.Instant;
import java.util.Map;

public record AuditEventResponse(
        long id,
        AuditEventKind kind,
        String actor,
        String entity,
        Instant timestamp,
        String correlationId,
        Map<String, Object> payload
) {
    public static AuditEventResponse from(AuditEventDoc doc) {
        return new AuditEventResponse(
                doc.getId(),
                doc.getKind(),
                doc.getActor(),
                doc.getEntityType() + ":" + doc.getEntityId(),
                doc.getTimestamp(),
                doc.getCorrelationId(),
                doc.getPayload());
    }
}
