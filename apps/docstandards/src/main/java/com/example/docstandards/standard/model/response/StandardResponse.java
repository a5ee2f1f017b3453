package com.example.docstandards.standard.model.response;

import com.example.docstandards.standard.document.StandardDoc;
import com.example.docstandards.standard.model.RuleDefinition;

import java.time.Instant;
import java.util.List;

public record StandardResponse(
        String id,
        String name,
        String lineageId,
        int version,
        String predecessorId,
        String schemaVersion,
        List<RuleDefinition> rules,
        String sourceDocumentId,
        String promotedBy,
        Instant promotedAt
) {
    public static StandardResponse from(StandardDoc standard) {
        return new StandardResponse(
                standard.getId(),
                standard.getName(),
                standard.getLineageId(),
                standard.getVersion(),
                standard.getPredecessorId(),
                standard.getSchemaVersion(),
                standard.getRules(),
                standard.getSourceDocumentId(),
                standard.getPromotedBy(),
                standard.getPromotedAt());
    }
}
