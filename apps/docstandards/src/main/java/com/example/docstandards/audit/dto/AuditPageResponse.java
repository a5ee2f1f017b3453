package com.example.docstandards.audit.dto;

import java.util.List;

public record AuditPageResponse(
        List<AuditEventResponse> events,
        Long nextSinceId
) {
}
