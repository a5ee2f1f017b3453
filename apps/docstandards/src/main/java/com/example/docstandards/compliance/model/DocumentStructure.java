package com.example.docstandards.compliance.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized structural form of an ODF package, shared by promotion and evaluation.
 * Immutable, so rules evaluated in parallel can read it without coordination.
 *
 * @param schemaVersion   {@code office:version} of the content root, null if undeclared
 * @param mimeType        content of the {@code mimetype} entry
 * @param metadata        meta.xml fields in document order; user-defined fields keyed {@code user-defined:<name>}
 * @param namedStyles     common styles from styles.xml, by name
 * @param automaticStyles automatic styles from styles.xml and content.xml, by name
 * @param fonts           declared font face names, first occurrence order
 * @param headings        {@code text:h} elements in document order
 * @param entries         every entry name of the package
 */
public record DocumentStructure(
        String schemaVersion,
        String mimeType,
        Map<String, String> metadata,
        Map<String, StyleDefinition> namedStyles,
        Map<String, StyleDefinition> automaticStyles,
        List<String> fonts,
        List<Heading> headings,
        List<String> entries
) {
    public DocumentStructure {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        namedStyles = Collections.unmodifiableMap(new LinkedHashMap<>(namedStyles));
        automaticStyles = Collections.unmodifiableMap(new LinkedHashMap<>(automaticStyles));
        fonts = List.copyOf(fonts);
        headings = List.copyOf(headings);
        entries = List.copyOf(entries);
    }
}
