package com.example.docstandards.validation.store;

import com.example.docstandards.validation.document.ValidationJobDoc;
import com.example.docstandards.validation.model.EnqueueResult;
import com.example.docstandards.validation.model.JobCompletion;
import com.example.docstandards.validation.model.JobState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * MongoDB job store. Claims and transitions are single-document find-and-modify
 * operations, which MongoDB applies atomically.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo", matchIfMissing = true)
public class MongoValidationJobStore implements ValidationJobStore {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final ReactiveMongoTemplate mongoTemplate;

    public MongoValidationJobStore(ReactiveMongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
        log.info("MongoDB validation job store initialized");
    }

    @Override
    @NonNull
    public Mono<EnqueueResult> enqueue(@NonNull ValidationJobDoc candidate) {
        Query queued = Query.query(Criteria.where("documentId").is(candidate.getDocumentId())
                .and("contentKey").is(candidate.getContentKey())
                .and("state").is(JobState.QUEUED));
        Query running = Query.query(Criteria.where("documentId").is(candidate.getDocumentId())
                .and("state").is(JobState.RUNNING));

        return mongoTemplate.findOne(queued, ValidationJobDoc.class)
                .map(EnqueueResult::coalesced)
                .switchIfEmpty(Mono.defer(() -> mongoTemplate.findOne(running, ValidationJobDoc.class)
                        .map(EnqueueResult::running)))
                // Upsert on the coalescing key so concurrent enqueues of one snapshot converge on one job
                .switchIfEmpty(Mono.defer(() -> mongoTemplate.findAndModify(queued, insertOnly(candidate),
                                FindAndModifyOptions.options().upsert(true).returnNew(true), ValidationJobDoc.class)
                        .map(job -> candidate.getId().equals(job.getId())
                                ? EnqueueResult.created(job)
                                : EnqueueResult.coalesced(job))));
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> findById(@NonNull String jobId) {
        return mongoTemplate.findById(jobId, ValidationJobDoc.class);
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> findLatestByDocument(@NonNull String documentId) {
        Query query = Query.query(Criteria.where("documentId").is(documentId))
                .with(Sort.by(Sort.Direction.DESC, "enqueuedAt"));
        return mongoTemplate.findOne(query, ValidationJobDoc.class);
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> claimNext(@NonNull String workerId, @NonNull Instant now, @NonNull Duration lease) {
        Query query = Query.query(Criteria.where("state").is(JobState.QUEUED)
                        .and("availableAt").lte(now))
                .with(Sort.by(Sort.Direction.ASC, "availableAt"));
        return mongoTemplate.findAndModify(query, claim(workerId, now, lease), RETURN_NEW, ValidationJobDoc.class);
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> reclaimExpired(@NonNull String workerId, @NonNull Instant now,
                                                 @NonNull Duration lease) {
        Query query = Query.query(Criteria.where("state").is(JobState.RUNNING)
                        .and("claimExpiresAt").lt(now))
                .with(Sort.by(Sort.Direction.ASC, "claimExpiresAt"));
        return mongoTemplate.findAndModify(query, claim(workerId, now, lease), RETURN_NEW, ValidationJobDoc.class);
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> renewLease(@NonNull String jobId, @NonNull String workerId, int attempt,
                                             @NonNull Instant claimExpiresAt) {
        return mongoTemplate.findAndModify(held(jobId, workerId, attempt),
                new Update().set("claimExpiresAt", claimExpiresAt), RETURN_NEW, ValidationJobDoc.class);
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> complete(@NonNull String jobId, @NonNull String workerId, int attempt,
                                           @NonNull JobCompletion completion, @NonNull Instant now) {
        Update update = new Update()
                .set("state", completion.state())
                .set("lastError", completion.lastError())
                .unset("claimExpiresAt");

        if (completion.state() == JobState.QUEUED) {
            update.set("availableAt", completion.availableAt())
                    .unset("claimedBy");
        } else {
            update.set("finishedAt", now)
                    .set("reportId", completion.reportId())
                    .set("verdict", completion.verdict())
                    .set("resolvedStandardId", completion.resolvedStandardId())
                    .set("resolvedStandardVersion", completion.resolvedStandardVersion());
        }
        return mongoTemplate.findAndModify(held(jobId, workerId, attempt), update, RETURN_NEW, ValidationJobDoc.class);
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> recordFollowUp(@NonNull String jobId, @NonNull String followUpJobId) {
        return mongoTemplate.findAndModify(Query.query(Criteria.where("_id").is(jobId)),
                new Update().set("followUpJobId", followUpJobId), RETURN_NEW, ValidationJobDoc.class);
    }

    @Override
    @NonNull
    public Mono<ValidationJobDoc> requeueFailed(@NonNull String jobId, @NonNull Instant now) {
        Query query = Query.query(Criteria.where("_id").is(jobId).and("state").is(JobState.FAILED));
        Update update = new Update()
                .set("state", JobState.QUEUED)
                .set("attempts", 0)
                .set("availableAt", now)
                .unset("claimedBy")
                .unset("claimExpiresAt")
                .unset("startedAt")
                .unset("finishedAt");
        return mongoTemplate.findAndModify(query, update, RETURN_NEW, ValidationJobDoc.class);
    }

    private static Query held(String jobId, String workerId, int attempt) {
        return Query.query(Criteria.where("_id").is(jobId)
                .and("state").is(JobState.RUNNING)
                .and("claimedBy").is(workerId)
                .and("attempts").is(attempt));
    }

    private static Update claim(String workerId, Instant now, Duration lease) {
        return new Update()
                .set("state", JobState.RUNNING)
                .set("claimedBy", workerId)
                .set("claimExpiresAt", now.plus(lease))
                .set("startedAt", now)
                .inc("attempts", 1);
    }

    private static Update insertOnly(ValidationJobDoc job) {
        // Query fields (documentId, contentKey, state) are copied into the upserted document
        return new Update()
                .setOnInsert("_id", job.getId())
                .setOnInsert("trigger", job.getTrigger())
                .setOnInsert("requestedBy", job.getRequestedBy())
                .setOnInsert("attempts", job.getAttempts())
                .setOnInsert("maxAttempts", job.getMaxAttempts())
                .setOnInsert("enqueuedAt", job.getEnqueuedAt())
                .setOnInsert("availableAt", job.getAvailableAt());
    }
}
