package com.example.docstandards.standard.model.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PromoteRequest(
        @NotBlank(message = "Document ID is required")
        String documentId,

        @Size(max = 200, message = "Name must not exceed 200 characters")
        String name,

        // Extends the predecessor's lineage when set; starts a new lineage otherwise
        String predecessorStandardId
) {}
