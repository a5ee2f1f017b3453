package com.example.docstandards.folder.model.response;

import com.example.docstandards.folder.model.Resolution;
import com.example.docstandards.standard.document.StandardDoc;

public record ResolutionResponse(
        String standardId,
        String standardName,
        Integer standardVersion,
        String source,
        String sourceId
) {
    public static ResolutionResponse from(Resolution resolution, StandardDoc standard) {
        return new ResolutionResponse(
                resolution.standardId(),
                standard != null ? standard.getName() : null,
                standard != null ? standard.getVersion() : null,
                resolution.source().name(),
                resolution.sourceId());
    }
}
