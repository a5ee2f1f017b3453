package com.example.docstandards.compliance.rule;

import com.example.docstandards.compliance.model.DocumentStructure;
import com.example.docstandards.compliance.model.Finding;
import com.example.docstandards.standard.model.RuleDefinition;
import com.example.docstandards.standard.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
public class AllowedFontsRule implements ComplianceRule {

    static final String PARAM_FONTS = "fonts";

    @Override
    public RuleType getType() {
        return RuleType.ALLOWED_FONTS;
    }

    @Override
    public Optional<Map<String, Object>> derive(DocumentStructure golden) {
        if (golden.fonts().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Map.of(PARAM_FONTS, golden.fonts().stream().sorted().toList()));
    }

    @Override
    public List<Finding> evaluate(RuleDefinition rule, DocumentStructure document) {
        Set<String> allowed = new HashSet<>(RuleParams.stringList(rule, PARAM_FONTS));
        return document.fonts().stream()
                .filter(font -> !allowed.contains(font))
                .map(font -> new Finding(rule.id(), rule.severity(), "font:" + font,
                        "Font '" + font + "' is not in the allowed set"))
                .toList();
    }
}
