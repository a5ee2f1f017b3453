package com.example.docstandards.compliance.model;

import java.util.Map;

/**
 * A {@code style:style} element. Property keys are {@code text:<attr>} or {@code paragraph:<attr>}.
 */
public record StyleDefinition(
        String name,
        String family,
        String parent,
        boolean automatic,
        Map<String, String> properties
) {
}
