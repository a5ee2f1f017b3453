package com.example.docstandards.audit.store;

import com.example.docstandards.audit.document.AuditEventDoc;
import com.example.docstandards.audit.document.AuditSequenceDoc;
import com.example.docstandards.audit.model.EntityRef;
import com.example.docstandards.common.concurrent.KeyedMutex;
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
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Audit ledger in MongoDB with ids taken from a counter row.
 *
 * <p>Allocation and insert run under one in-process lock, so an id is only handed out once
 * every smaller id is either stored or abandoned. A reader paging with {@code _id > sinceId}
 * therefore never sees id n+1 while n can still appear behind it.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo", matchIfMissing = true)
public class MongoAuditEventStore implements AuditEventStore {

    static final String SEQUENCE_NAME = "audit_events";
    static final String APPEND_LOCK = "audit:append";

    private final ReactiveMongoTemplate mongoTemplate;
    private final KeyedMutex keyedMutex;

    public MongoAuditEventStore(ReactiveMongoTemplate mongoTemplate, KeyedMutex keyedMutex) {
        this.mongoTemplate = mongoTemplate;
        this.keyedMutex = keyedMutex;
        log.info("MongoDB audit event store initialized");
    }

    @Override
    @NonNull
    public Mono<AuditEventDoc> append(@NonNull AuditEventDoc event) {
        // Ids are strictly increasing; a failed insert leaves a gap, never a duplicate
        return keyedMutex.withLock(APPEND_LOCK, () -> nextId()
                .map(id -> event.toBuilder().id(id).build())
                .flatMap(mongoTemplate::insert));
    }

    @Override
    @NonNull
    public Flux<AuditEventDoc> history(@NonNull EntityRef entity, long sinceId, int limit) {
        Query query = Query.query(Criteria.where("entityType").is(entity.type())
                        .and("entityId").is(entity.id())
                        .and("_id").gt(sinceId))
                .with(Sort.by(Sort.Direction.ASC, "_id"));
        if (limit > 0) {
            query.limit(limit);
        }
        return mongoTemplate.find(query, AuditEventDoc.class);
    }

    private Mono<Long> nextId() {
        return mongoTemplate.findAndModify(
                        Query.query(Criteria.where("_id").is(SEQUENCE_NAME)),
                        new Update().inc("value", 1L),
                        FindAndModifyOptions.options().returnNew(true).upsert(true),
                        AuditSequenceDoc.class)
                .map(AuditSequenceDoc::getValue);
    }
}
