package com.example.docstandards.compliance.service;

import com.example.docstandards.compliance.model.DocumentStructure;
import com.example.docstandards.compliance.model.EvaluationResult;
import com.example.docstandards.compliance.model.Finding;
import com.example.docstandards.compliance.parser.MalformedDocumentException;
import com.example.docstandards.compliance.parser.OdfStructureParser;
import com.example.docstandards.compliance.rule.ComplianceRule;
import com.example.docstandards.standard.model.RuleDefinition;
import com.example.docstandards.standard.model.RuleType;
import com.example.docstandards.standard.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates document bytes against the rule set of a Standard.
 *
 * <p>Total: every input yields an {@link EvaluationResult}. Parse failures become a single
 * {@code malformed-document} finding; an unknown rule type or a crashing rule becomes a
 * {@code rule-evaluation-error} finding for that rule.
 *
 * <p>Rules run independently on the parallel scheduler. Findings are ordered by rule
 * declaration order, then location, then message, so identical inputs always produce
 * identical output.
 *
 * <p>Rules are auto-discovered via Spring component scanning. To add a rule type, add a
 * {@link RuleType} constant and a {@link ComplianceRule} component for it.
 */
@Slf4j
@Service
public class ComplianceEvaluator {

    private final OdfStructureParser parser;
    private final Map<RuleType, ComplianceRule> rulesByType;

    public ComplianceEvaluator(OdfStructureParser parser, List<ComplianceRule> rules) {
        this.parser = parser;
        Map<RuleType, ComplianceRule> byType = new EnumMap<>(RuleType.class);
        for (ComplianceRule rule : rules) {
            ComplianceRule previous = byType.put(rule.getType(), rule);
            if (previous != null) {
                throw new IllegalStateException("Two rules registered for " + rule.getType() + ": "
                        + previous.getClass().getSimpleName() + ", " + rule.getClass().getSimpleName());
            }
        }
        this.rulesByType = Collections.unmodifiableMap(byType);

        log.info("Compliance evaluator initialized with {} rule types", this.rulesByType.size());
        this.rulesByType.values().forEach(r -> log.debug("  - {}: {}", r.getType(), r.getDescription()));
    }

    public Mono<EvaluationResult> evaluate(byte[] content, List<RuleDefinition> rules) {
        return Mono.fromCallable(() -> parser.parse(content))
                .subscribeOn(Schedulers.parallel())
                .flatMap(structure -> evaluate(structure, rules))
                .onErrorResume(MalformedDocumentException.class, e -> {
                    log.debug("Document is malformed: {}", e.getMessage());
                    return Mono.just(EvaluationResult.malformed(e.getMessage()));
                });
    }

    public Mono<EvaluationResult> evaluate(DocumentStructure structure, List<RuleDefinition> rules) {
        return Flux.fromIterable(rules)
                .flatMapSequential(rule -> Mono.fromCallable(() -> evaluateRule(rule, structure))
                        .subscribeOn(Schedulers.parallel()))
                .concatMapIterable(findings -> findings)
                .collectList()
                .map(EvaluationResult::of);
    }

    /**
     * Rule types this evaluator can check.
     */
    public Map<RuleType, ComplianceRule> getRules() {
        return rulesByType;
    }

    private List<Finding> evaluateRule(RuleDefinition rule, DocumentStructure structure) {
        ComplianceRule evaluator = rule.type() != null ? rulesByType.get(rule.type()) : null;
        if (evaluator == null) {
            log.warn("No evaluator for rule {} of type {}", rule.id(), rule.type());
            return List.of(evaluationError(rule, "unknown rule type " + rule.type()));
        }
        try {
            List<Finding> findings = new ArrayList<>(evaluator.evaluate(rule, structure));
            findings.sort(Finding.BY_LOCATION_THEN_MESSAGE);
            return findings;
        } catch (RuntimeException e) {
            log.warn("Rule {} ({}) failed to evaluate: {}", rule.id(), rule.type(), e.getMessage());
            return List.of(evaluationError(rule, e.getMessage()));
        }
    }

    private static Finding evaluationError(RuleDefinition rule, String reason) {
        return new Finding(rule.id(), Severity.ERROR, "rule",
                EvaluationResult.RULE_EVALUATION_ERROR + ": " + reason);
    }
}
