package com.example.docstandards.folder.model.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

// Shared by folder and document renames
public record RenameRequest(
        @NotBlank(message = "Name is required")
        @Size(max = 255, message = "Name must not exceed 255 characters")
        String name
) {}
