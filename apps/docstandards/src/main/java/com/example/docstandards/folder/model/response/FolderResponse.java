package com.example.docstandards.folder.model.response;

import com.example.docstandards.folder.document.FolderDoc;

import java.time.Instant;
import java.util.List;

public record FolderResponse(
        String folderId,
        String name,
        String parentId,
        String assignedStandardId,
        List<ChildFolder> children,
        String createdBy,
        Instant createdAt,
        Instant updatedAt
) {
    public record ChildFolder(
            String folderId,
            String name,
            String assignedStandardId
    ) {}

    public static FolderResponse from(FolderDoc folder, List<FolderDoc> children) {
        return new FolderResponse(
                folder.getId(),
                folder.getName(),
                folder.getParentId(),
                folder.getAssignedStandardId(),
                children.stream()
                        .map(child -> new ChildFolder(child.getId(), child.getName(), child.getAssignedStandardId()))
                        .toList(),
                folder.getCreatedBy(),
                folder.getCreatedAt(),
                folder.getUpdatedAt());
    }
}
