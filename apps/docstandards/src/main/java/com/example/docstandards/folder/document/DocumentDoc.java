package com.example.docstandards.folder.document;

import com.example.docstandards.folder.model.DocumentLifecycle;
import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * MongoDB document for document metadata.
 * Bytes live in the blob store under {@code contentKey}; this stores placement and lifecycle.
 */
@Data
@Builder(toBuilder = true)
@Document(collection = "documents")
@CompoundIndexes({
        @CompoundIndex(name = "folder_lifecycle_idx", def = "{'folderId': 1, 'lifecycle': 1}")
})
public class DocumentDoc {

    @Id
    private String id;

    private String folderId;

    /**
     * Original filename as provided by the uploader.
     */
    private String filename;

    private String contentType;

    /**
     * Blob key of the current revision.
     */
    private String contentKey;

    private String contentSha256;

    private long sizeBytes;

    /**
     * 1 on upload, incremented by every new content revision.
     */
    private int revision;

    /**
     * When set, governs the document regardless of folder assignments.
     */
    private String overrideStandardId;

    private DocumentLifecycle lifecycle;

    private String uploadedBy;

    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    public boolean isActive() {
        return lifecycle == DocumentLifecycle.ACTIVE;
    }
}
