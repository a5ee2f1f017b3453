package com.example.docstandards.standard.model;

import java.util.Map;

/**
 * One rule of a Standard: the predicate is {@code type} applied with {@code params}.
 */
public record RuleDefinition(
        String id,
        String name,
        RuleType type,
        Severity severity,
        Map<String, Object> params
) {
    public RuleDefinition {
        params = params != null ? Map.copyOf(params) : Map.of();
    }
}
