package com.example.docstandards.folder.model.request;

import jakarta.validation.constraints.NotBlank;

public record MoveDocumentRequest(
        @NotBlank(message = "Folder ID is required")
        String folderId
) {}
