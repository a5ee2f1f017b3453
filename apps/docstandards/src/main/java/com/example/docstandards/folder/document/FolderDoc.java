package com.example.docstandards.folder.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * MongoDB document for a folder of the single-rooted tree.
 */
@Data
@Builder(toBuilder = true)
@Document(collection = "folders")
public class FolderDoc {

    @Id
    private String id;

    private String name;

    /**
     * Null only for the root folder.
     */
    @Indexed
    private String parentId;

    /**
     * Standard inherited by every document below this folder unless a closer
     * folder assigns another one or the document overrides it.
     */
    private String assignedStandardId;

    private String createdBy;

    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    public boolean isRoot() {
        return parentId == null;
    }
}
