package com.example.docstandards.audit.store;

import com.example.docstandards.audit.document.AuditEventDoc;
import com.example.docstandards.audit.model.EntityRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of AuditEventStore for single-pod deployments and tests.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
public class InMemoryAuditEventStore implements AuditEventStore {

    private final ConcurrentSkipListMap<Long, AuditEventDoc> events = new ConcurrentSkipListMap<>();
    private long lastId;

    public InMemoryAuditEventStore() {
        log.info("In-memory audit event store initialized (single-pod mode)");
    }

    @Override
    @NonNull
    public Mono<AuditEventDoc> append(@NonNull AuditEventDoc event) {
        return Mono.fromCallable(() -> {
            // Allocation and insert under one monitor so readers never see id n+1 before n
            synchronized (events) {
                long id = ++lastId;
                AuditEventDoc stored = event.toBuilder().id(id).build();
                events.put(id, stored);
                return stored;
            }
        });
    }

    @Override
    @NonNull
    public Flux<AuditEventDoc> history(@NonNull EntityRef entity, long sinceId, int limit) {
        Flux<AuditEventDoc> matching = Flux.defer(() -> Flux.fromIterable(events.tailMap(sinceId, false).values()))
                .filter(event -> event.getEntityType() == entity.type()
                        && entity.id().equals(event.getEntityId()));
        return limit > 0 ? matching.take(limit) : matching;
    }
}
