package com.example.docstandards.compliance.rule;

import com.example.docstandards.compliance.model.DocumentStructure;
import com.example.docstandards.compliance.model.Finding;
import com.example.docstandards.standard.model.RuleDefinition;
import com.example.docstandards.standard.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pins the values of metadata fields that describe the document class rather than one
 * instance. Absence is reported by {@link RequiredMetadataRule}.
 */
@Component
public class MetadataValueRule implements ComplianceRule {

    static final String PARAM_VALUES = "values";
    static final List<String> PINNED_FIELDS = List.of("language", "subject");

    @Override
    public RuleType getType() {
        return RuleType.METADATA_VALUE;
    }

    @Override
    public Optional<Map<String, Object>> derive(DocumentStructure golden) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String field : PINNED_FIELDS) {
            String value = golden.metadata().get(field);
            if (value != null && !value.isEmpty()) {
                values.put(field, value);
            }
        }
        if (values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Map.of(PARAM_VALUES, values));
    }

    @Override
    public List<Finding> evaluate(RuleDefinition rule, DocumentStructure document) {
        List<Finding> findings = new ArrayList<>();
        RuleParams.stringMap(rule, PARAM_VALUES).forEach((field, expected) -> {
            String actual = document.metadata().get(field);
            if (actual != null && !actual.equals(expected)) {
                findings.add(new Finding(rule.id(), rule.severity(), "meta:" + field,
                        "Metadata '" + field + "' expected '" + expected + "' but found '" + actual + "'"));
            }
        });
        return findings;
    }
}
