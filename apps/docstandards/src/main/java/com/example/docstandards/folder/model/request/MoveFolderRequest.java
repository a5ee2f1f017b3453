package com.example.docstandards.folder.model.request;

import jakarta.validation.constraints.NotBlank;

public record MoveFolderRequest(
        @NotBlank(message = "Parent ID is required")
        String parentId
) {}
