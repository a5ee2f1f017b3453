package com.example.docstandards.validation.document;

import com.example.docstandards.compliance.model.Finding;
import com.example.docstandards.compliance.model.Verdict;
import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * MongoDB document for the outcome of one successful validation.
 * Retained for history; the current report of a document is its latest by {@code generatedAt}.
 */
@Data
@Builder
@Document(collection = "compliance_reports")
@CompoundIndexes({
        @CompoundIndex(name = "document_generated_idx", def = "{'documentId': 1, 'generatedAt': -1}")
})
public class ComplianceReportDoc {

    /**
     * Derived from the job id, so a re-run attempt of the same job overwrites rather than duplicates.
     */
    @Id
    private String id;

    @Indexed
    private String jobId;

    private String documentId;

    private String standardId;

    private int standardVersion;

    private String contentKey;

    private List<Finding> findings;

    private Verdict verdict;

    private Instant generatedAt;

    public static String idForJob(String jobId) {
        return "report-" + jobId;
    }
}
