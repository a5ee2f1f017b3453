package com.example.docstandards.compliance.rule;

import com.example.docstandards.compliance.model.DocumentStructure;
import com.example.docstandards.compliance.model.Finding;
import com.example.docstandards.compliance.model.StyleDefinition;
import com.example.docstandards.standard.model.RuleDefinition;
import com.example.docstandards.standard.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named styles the document shares with the golden document must keep the golden
 * text and paragraph properties. Styles the document does not define, and properties
 * it leaves to inheritance, are not checked. Automatic styles are per-file and ignored.
 */
@Component
public class StylePropertiesRule implements ComplianceRule {

    static final String PARAM_STYLES = "styles";

    @Override
    public RuleType getType() {
        return RuleType.STYLE_PROPERTIES;
    }

    @Override
    public Optional<Map<String, Object>> derive(DocumentStructure golden) {
        Map<String, Map<String, String>> styles = new LinkedHashMap<>();
        golden.namedStyles().values().stream()
                .filter(style -> !style.properties().isEmpty())
                .forEach(style -> styles.put(style.name(), new LinkedHashMap<>(style.properties())));
        if (styles.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Map.of(PARAM_STYLES, styles));
    }

    @Override
    public List<Finding> evaluate(RuleDefinition rule, DocumentStructure document) {
        List<Finding> findings = new ArrayList<>();
        RuleParams.nestedStringMap(rule, PARAM_STYLES).forEach((styleName, expectedProperties) -> {
            StyleDefinition style = document.namedStyles().get(styleName);
            if (style == null) {
                return;
            }
            expectedProperties.forEach((property, expected) -> {
                String actual = style.properties().get(property);
                if (actual != null && !actual.equals(expected)) {
                    findings.add(new Finding(rule.id(), rule.severity(), "style:" + styleName + "/" + property,
                            "Style '" + styleName + "' " + property + " expected '" + expected
                                    + "' but found '" + actual + "'"));
                }
            });
        });
        return findings;
    }
}
