package com.example.docstandards.audit.document;

import com.example.docstandards.audit.model.AuditEventKind;
import com.example.docstandards.audit.model.EntityRef;
import com.example.docstandards.audit.model.EntityType;
import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only audit record. Never updated or deleted once written.
 */
@Data
@Builder(toBuilder = true)
@Document(collection = "audit_events")
@CompoundIndexes({
        @CompoundIndex(name = "entity_id_idx", def = "{'entityType': 1, 'entityId': 1, '_id': 1}")
})
public class AuditEventDoc {

    /**
     * Monotonically increasing sequence number, assigned by the store on append.
     */
    @Id
    private Long id;

    private AuditEventKind kind;

    /**
     * Subject that caused the event, or the worker id for validation events.
     */
    private String actor;

    private EntityType entityType;

    private String entityId;

    private Instant timestamp;

    private String correlationId;

    private Map<String, Object> payload;

    public EntityRef entityRef() {
        return new EntityRef(entityType, entityId);
    }

    public Map<String, Object> toStructuredLog() {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("eventId", id);
        log.put("kind", kind);
        log.put("actor", actor);
        log.put("entity", entityType + ":" + entityId);
        log.put("timestamp", timestamp != null ? timestamp.toString() : null);
        if (correlationId != null) {
            log.put("correlationId", correlationId);
        }
        log.put("payload", payload);
        return log;
    }
}
