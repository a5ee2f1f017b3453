package com.example.docstandards.exception;

import lombok.Getter;

@Getter
public class CycleRejectedException extends RuntimeException {

    private final String folderId;
    private final String targetParentId;

    public CycleRejectedException(String folderId, String targetParentId) {
        super("Moving folder " + folderId + " under " + targetParentId + " would create a cycle");
        this.folderId = folderId;
        this.targetParentId = targetParentId;
    }
}
