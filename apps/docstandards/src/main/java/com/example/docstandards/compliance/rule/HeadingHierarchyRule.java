package com.example.docstandards.compliance.rule;

import com.example.docstandards.compliance.model.DocumentStructure;
import com.example.docstandards.compliance.model.Finding;
import com.example.docstandards.compliance.model.Heading;
import com.example.docstandards.standard.model.RuleDefinition;
import com.example.docstandards.standard.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outline levels may only deepen one step at a time (no level 1 followed by level 3).
 */
@Component
public class HeadingHierarchyRule implements ComplianceRule {

    static final String PARAM_MAX_STEP = "maxStep";
    static final int MAX_STEP = 1;

    @Override
    public RuleType getType() {
        return RuleType.HEADING_HIERARCHY;
    }

    @Override
    public Optional<Map<String, Object>> derive(DocumentStructure golden) {
        if (golden.headings().isEmpty() || !skippedLevels(golden.headings(), MAX_STEP).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Map.of(PARAM_MAX_STEP, MAX_STEP));
    }

    @Override
    public List<Finding> evaluate(RuleDefinition rule, DocumentStructure document) {
        int maxStep = Integer.parseInt(RuleParams.string(rule, PARAM_MAX_STEP));
        List<Finding> findings = new ArrayList<>();
        for (Heading heading : skippedLevels(document.headings(), maxStep)) {
            findings.add(new Finding(rule.id(), rule.severity(), String.format("heading[%04d]", heading.index()),
                    "Heading '" + heading.text() + "' at level " + heading.level() + " skips an outline level"));
        }
        return findings;
    }

    private static List<Heading> skippedLevels(List<Heading> headings, int maxStep) {
        List<Heading> offenders = new ArrayList<>();
        int previous = 0;
        for (Heading heading : headings) {
            if (heading.level() > previous + maxStep) {
                offenders.add(heading);
            }
            previous = heading.level();
        }
        return offenders;
    }
}
