package com.example.docstandards.standard.service;

import com.example.docstandards.compliance.model.DocumentStructure;
import com.example.docstandards.compliance.rule.ComplianceRule;
import com.example.docstandards.compliance.service.ComplianceEvaluator;
import com.example.docstandards.standard.model.RuleDefinition;
import com.example.docstandards.standard.model.RuleType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives the rule set of a new Standard from the structural profile of a golden document.
 *
 * <p>Rule ids are {@code R<nn>-<TYPE>} where {@code nn} is the position of the type in
 * {@link RuleType}, so the same rule keeps its id across versions of a lineage.
 */
@Slf4j
@Component
public class RuleSetDeriver {

    private final ComplianceEvaluator evaluator;

    public RuleSetDeriver(ComplianceEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public List<RuleDefinition> derive(DocumentStructure golden) {
        Map<RuleType, ComplianceRule> available = evaluator.getRules();
        List<RuleDefinition> rules = new ArrayList<>();

        for (RuleType type : RuleType.values()) {
            ComplianceRule rule = available.get(type);
            if (rule == null) {
                continue;
            }
            Optional<Map<String, Object>> params = rule.derive(golden);
            if (params.isEmpty()) {
                log.debug("Golden document gives no basis for rule type {}", type);
                continue;
            }
            rules.add(new RuleDefinition(
                    ruleId(type),
                    type.getDisplayName(),
                    type,
                    type.getDefaultSeverity(),
                    params.get()));
        }
        return List.copyOf(rules);
    }

    static String ruleId(RuleType type) {
        return String.format("R%02d-%s", type.ordinal() + 1, type.name());
    }
}
