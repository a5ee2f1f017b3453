package com.example.docstandards.compliance.rule;

import com.example.docstandards.compliance.model.DocumentStructure;
import com.example.docstandards.compliance.model.Finding;
import com.example.docstandards.standard.model.RuleDefinition;
import com.example.docstandards.standard.model.RuleType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One rule predicate: knows how to derive its parameters from a golden document
 * and how to check a document against them.
 *
 * <p>Implementations must be stateless. The evaluator runs rules of one Standard in
 * parallel against the same {@link DocumentStructure}.
 */
public interface ComplianceRule {

    RuleType getType();

    /**
     * Human-readable description of the rule.
     */
    default String getDescription() {
        return getType().getDisplayName();
    }

    /**
     * Parameters captured from a golden document.
     * Empty when the golden document gives no basis for this rule, in which case
     * the Standard does not carry it.
     */
    Optional<Map<String, Object>> derive(DocumentStructure golden);

    /**
     * Findings for {@code document}, all carrying {@code rule.id()} and {@code rule.severity()}.
     * An empty list means the rule holds.
     */
    List<Finding> evaluate(RuleDefinition rule, DocumentStructure document);
}
