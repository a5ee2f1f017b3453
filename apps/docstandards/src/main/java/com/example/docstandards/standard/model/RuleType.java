package com.example.docstandards.standard.model;

import lombok.Getter;

/**
 * Rule predicates known to the evaluator, in derivation order.
 */
@Getter
public enum RuleType {
    SCHEMA_VERSION("Schema version", Severity.ERROR),
    NO_MACROS("No embedded macros", Severity.ERROR),
    REQUIRED_METADATA("Required metadata fields", Severity.ERROR),
    METADATA_VALUE("Metadata values", Severity.WARNING),
    REQUIRED_HEADINGS("Required top-level headings", Severity.ERROR),
    HEADING_HIERARCHY("Heading hierarchy", Severity.WARNING),
    STYLE_PROPERTIES("Named style properties", Severity.WARNING),
    ALLOWED_FONTS("Allowed fonts", Severity.WARNING);

    private final String displayName;
    private final Severity defaultSeverity;

    RuleType(String displayName, Severity defaultSeverity) {
        this.displayName = displayName;
        this.defaultSeverity = defaultSeverity;
    }
}
