package com.example.docstandards.audit.document;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

// Counter row backing audit event ids
@Data
@Document(collection = "audit_sequences")
public class AuditSequenceDoc {

    @Id
    private String id;

    private long value;
}
