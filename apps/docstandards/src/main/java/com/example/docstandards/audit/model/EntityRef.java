package com.example.docstandards.audit.model;

import java.util.Locale;

/**
 * Typed reference to an audited entity, rendered as {@code TYPE:id}.
 */
public record EntityRef(EntityType type, String id) {

    public EntityRef {
        if (type == null) {
            throw new IllegalArgumentException("Entity type is required");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entity id is required");
        }
    }

    public static EntityRef folder(String id) {
        return new EntityRef(EntityType.FOLDER, id);
    }

    public static EntityRef document(String id) {
        return new EntityRef(EntityType.DOCUMENT, id);
    }

    public static EntityRef standard(String id) {
        return new EntityRef(EntityType.STANDARD, id);
    }

    public static EntityRef job(String id) {
        return new EntityRef(EntityType.JOB, id);
    }

    public static EntityRef parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Entity reference is required (TYPE:id)");
        }
        int separator = value.indexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("Entity reference must look like TYPE:id");
        }
        try {
            EntityType type = EntityType.valueOf(value.substring(0, separator).toUpperCase(Locale.ROOT));
            return new EntityRef(type, value.substring(separator + 1));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown entity type in " + value);
        }
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
