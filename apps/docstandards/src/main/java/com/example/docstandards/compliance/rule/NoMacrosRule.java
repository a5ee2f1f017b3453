package com.example.docstandards.compliance.rule;

import com.example.docstandards.compliance.model.DocumentStructure;
import com.example.docstandards.compliance.model.Finding;
import com.example.docstandards.standard.model.RuleDefinition;
import com.example.docstandards.standard.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Macro libraries live under {@code Basic/} (StarBasic) and {@code Scripts/} (other script languages).
 */
@Component
public class NoMacrosRule implements ComplianceRule {

    static final String PARAM_FORBIDDEN_PREFIXES = "forbiddenPrefixes";
    static final List<String> MACRO_PREFIXES = List.of("Basic/", "Scripts/");

    @Override
    public RuleType getType() {
        return RuleType.NO_MACROS;
    }

    @Override
    public Optional<Map<String, Object>> derive(DocumentStructure golden) {
        // A golden document carrying macros cannot ask others not to
        boolean goldenHasMacros = golden.entries().stream()
                .anyMatch(entry -> MACRO_PREFIXES.stream().anyMatch(entry::startsWith));
        if (goldenHasMacros) {
            return Optional.empty();
        }
        return Optional.of(Map.of(PARAM_FORBIDDEN_PREFIXES, MACRO_PREFIXES));
    }

    @Override
    public List<Finding> evaluate(RuleDefinition rule, DocumentStructure document) {
        List<Finding> findings = new ArrayList<>();
        for (String prefix : RuleParams.stringList(rule, PARAM_FORBIDDEN_PREFIXES)) {
            long count = document.entries().stream().filter(entry -> entry.startsWith(prefix)).count();
            if (count > 0) {
                findings.add(new Finding(rule.id(), rule.severity(), "package:" + prefix,
                        "Macros are not allowed: " + count + " entries under " + prefix));
            }
        }
        return findings;
    }
}
