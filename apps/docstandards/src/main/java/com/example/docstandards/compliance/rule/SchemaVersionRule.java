package com.example.docstandards.compliance.rule;

import com.example.docstandards.compliance.model.DocumentStructure;
import com.example.docstandards.compliance.model.Finding;
import com.example.docstandards.standard.model.RuleDefinition;
import com.example.docstandards.standard.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Component
public class SchemaVersionRule implements ComplianceRule {

    static final String PARAM_VERSION = "version";

    @Override
    public RuleType getType() {
        return RuleType.SCHEMA_VERSION;
    }

    @Override
    public Optional<Map<String, Object>> derive(DocumentStructure golden) {
        if (golden.schemaVersion() == null) {
            return Optional.empty();
        }
        return Optional.of(Map.of(PARAM_VERSION, golden.schemaVersion()));
    }

    @Override
    public List<Finding> evaluate(RuleDefinition rule, DocumentStructure document) {
        String expected = RuleParams.string(rule, PARAM_VERSION);
        String actual = document.schemaVersion();
        if (Objects.equals(expected, actual)) {
            return List.of();
        }
        return List.of(new Finding(rule.id(), rule.severity(), "office:version",
                "Expected ODF version " + expected + " but found "
                        + (actual != null ? actual : "no declared version")));
    }
}
