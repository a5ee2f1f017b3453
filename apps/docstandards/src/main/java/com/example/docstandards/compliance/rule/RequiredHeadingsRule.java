package com.example.docstandards.compliance.rule;

import com.example.docstandards.compliance.model.DocumentStructure;
import com.example.docstandards.compliance.model.Finding;
import com.example.docstandards.compliance.model.Heading;
import com.example.docstandards.standard.model.RuleDefinition;
import com.example.docstandards.standard.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The golden document's top-level sections must appear, in the same relative order.
 * Extra sections in between are allowed.
 */
@Component
public class RequiredHeadingsRule implements ComplianceRule {

    static final String PARAM_HEADINGS = "headings";
    static final String PARAM_LEVEL = "level";
    static final int TOP_LEVEL = 1;

    @Override
    public RuleType getType() {
        return RuleType.REQUIRED_HEADINGS;
    }

    @Override
    public Optional<Map<String, Object>> derive(DocumentStructure golden) {
        List<String> headings = golden.headings().stream()
                .filter(h -> h.level() == TOP_LEVEL && !h.text().isEmpty())
                .map(Heading::text)
                .toList();
        if (headings.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Map.of(PARAM_HEADINGS, headings, PARAM_LEVEL, TOP_LEVEL));
    }

    @Override
    public List<Finding> evaluate(RuleDefinition rule, DocumentStructure document) {
        int level = Integer.parseInt(RuleParams.string(rule, PARAM_LEVEL));
        List<String> required = RuleParams.stringList(rule, PARAM_HEADINGS);
        List<String> actual = document.headings().stream()
                .filter(h -> h.level() == level)
                .map(h -> normalize(h.text()))
                .toList();

        // Greedy subsequence match: each required heading must occur after the previous match
        List<Finding> findings = new ArrayList<>();
        int cursor = 0;
        for (int i = 0; i < required.size(); i++) {
            String wanted = normalize(required.get(i));
            int found = indexFrom(actual, wanted, cursor);
            if (found >= 0) {
                cursor = found + 1;
                continue;
            }
            boolean presentEarlier = indexFrom(actual, wanted, 0) >= 0;
            findings.add(new Finding(rule.id(), rule.severity(), String.format("heading[%04d]", i),
                    presentEarlier
                            ? "Required heading '" + required.get(i) + "' is out of order"
                            : "Missing required heading '" + required.get(i) + "'"));
        }
        return findings;
    }

    private static int indexFrom(List<String> headings, String wanted, int from) {
        for (int i = from; i < headings.size(); i++) {
            if (headings.get(i).equals(wanted)) {
                return i;
            }
        }
        return -1;
    }

    private static String normalize(String text) {
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
