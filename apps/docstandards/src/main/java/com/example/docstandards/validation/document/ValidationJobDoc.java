package com.example.docstandards.validation.document;

import com.example.docstandards.compliance.model.Verdict;
import com.example.docstandards.validation.model.JobState;
import com.example.docstandards.validation.model.JobTrigger;
import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * MongoDB document for one validation job.
 * State changes only through conditional find-and-modify updates in the job store.
 */
@Data
@Builder(toBuilder = true)
@Document(collection = "validation_jobs")
@CompoundIndexes({
        @CompoundIndex(name = "claim_idx", def = "{'state': 1, 'availableAt': 1}"),
        @CompoundIndex(name = "lease_idx", def = "{'state': 1, 'claimExpiresAt': 1}"),
        @CompoundIndex(name = "document_idx", def = "{'documentId': 1, 'state': 1, 'enqueuedAt': -1}")
})
public class ValidationJobDoc {

    @Id
    private String id;

    private String documentId;

    /**
     * Blob key of the document content when the job was enqueued.
     */
    private String contentKey;

    private String resolvedStandardId;

    private Integer resolvedStandardVersion;

    private JobState state;

    private JobTrigger trigger;

    private String requestedBy;

    /**
     * Number of claims so far, including the current one while RUNNING.
     */
    private int attempts;

    private int maxAttempts;

    private Instant enqueuedAt;

    /**
     * Earliest time a worker may claim the job; pushed forward by retry backoff.
     */
    private Instant availableAt;

    private Instant startedAt;

    private Instant finishedAt;

    private String claimedBy;

    private Instant claimExpiresAt;

    private String lastError;

    private String reportId;

    private Verdict verdict;

    /**
     * Job enqueued on completion because the document or its resolution changed meanwhile.
     */
    private String followUpJobId;
}
