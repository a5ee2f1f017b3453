package com.example.docstandards.compliance.rule;

import com.example.docstandards.compliance.model.DocumentStructure;
import com.example.docstandards.compliance.model.Finding;
import com.example.docstandards.standard.model.RuleDefinition;
import com.example.docstandards.standard.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
public class RequiredMetadataRule implements ComplianceRule {

    static final String PARAM_KEYS = "keys";

    // Fields that change on every save or depend on who edited the file
    static final Set<String> VOLATILE_FIELDS = Set.of(
            "generator", "date", "creation-date", "print-date", "printed-by",
            "editing-cycles", "editing-duration", "document-statistic",
            "creator", "initial-creator");

    @Override
    public RuleType getType() {
        return RuleType.REQUIRED_METADATA;
    }

    @Override
    public Optional<Map<String, Object>> derive(DocumentStructure golden) {
        List<String> keys = golden.metadata().keySet().stream()
                .filter(key -> !VOLATILE_FIELDS.contains(key))
                .sorted()
                .toList();
        if (keys.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Map.of(PARAM_KEYS, keys));
    }

    @Override
    public List<Finding> evaluate(RuleDefinition rule, DocumentStructure document) {
        return RuleParams.stringList(rule, PARAM_KEYS).stream()
                .filter(key -> !document.metadata().containsKey(key))
                .map(key -> new Finding(rule.id(), rule.severity(), "meta:" + key,
                        "Missing required metadata field '" + key + "'"))
                .toList();
    }
}
