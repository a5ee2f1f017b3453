package com.example.docstandards.compliance.model;

import com.example.docstandards.standard.model.Severity;

import java.util.List;

public record EvaluationResult(
        List<Finding> findings,
        Verdict verdict
) {
    public static final String MALFORMED_DOCUMENT = "malformed-document";
    public static final String RULE_EVALUATION_ERROR = "rule-evaluation-error";

    public static EvaluationResult of(List<Finding> findings) {
        return new EvaluationResult(List.copyOf(findings), aggregate(findings));
    }

    public static EvaluationResult malformed(String reason) {
        return of(List.of(new Finding(MALFORMED_DOCUMENT, Severity.ERROR, "document",
                "Document could not be parsed: " + reason)));
    }

    static Verdict aggregate(List<Finding> findings) {
        if (findings.stream().anyMatch(f -> f.severity() == Severity.ERROR)) {
            return Verdict.NON_COMPLIANT;
        }
        if (findings.stream().anyMatch(f -> f.severity() == Severity.WARNING)) {
            return Verdict.COMPLIANT_WITH_WARNINGS;
        }
        return Verdict.COMPLIANT;
    }
}
