package com.example.docstandards.standard.document;

import com.example.docstandards.standard.model.RuleDefinition;
import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * MongoDB document for a promoted Standard.
 * Written once on promotion and never updated; a new version is a new document in the same lineage.
 */
@Data
@Builder
@Document(collection = "standards")
@CompoundIndexes({
        @CompoundIndex(name = "lineage_version_idx", def = "{'lineageId': 1, 'version': 1}", unique = true)
})
public class StandardDoc {

    @Id
    private String id;

    private String name;

    /**
     * Shared by every version promoted from the same original Standard.
     */
    private String lineageId;

    /**
     * 1 for the first Standard of a lineage, predecessor version + 1 afterwards.
     */
    private int version;

    private String predecessorId;

    private List<RuleDefinition> rules;

    /**
     * {@code office:version} of the golden document, null when it declared none.
     */
    private String schemaVersion;

    private String sourceDocumentId;

    /**
     * Blob key of the golden document bytes at promotion time.
     */
    private String sourceContentKey;

    private String promotedBy;

    private Instant promotedAt;
}
