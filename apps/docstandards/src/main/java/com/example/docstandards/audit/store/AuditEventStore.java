package com.example.docstandards.audit.store;

import com.example.docstandards.audit.document.AuditEventDoc;
import com.example.docstandards.audit.model.EntityRef;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence for the audit ledger.
 * Implementations can use MongoDB (durable, shared by all instances) or in-memory storage (single pod).
 */
public interface AuditEventStore {

    /**
     * Assigns the next id to the event and stores it.
     */
    @NonNull
    Mono<AuditEventDoc> append(@NonNull AuditEventDoc event);

    /**
     * Events of one entity with {@code id > sinceId}, ascending by id.
     *
     * @param limit maximum number of events, or 0 for no limit
     */
    @NonNull
    Flux<AuditEventDoc> history(@NonNull EntityRef entity, long sinceId, int limit);
}
