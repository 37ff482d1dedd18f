package com.geocompliance.rules;

import com.geocompliance.evidence.EvidenceNormalizer;
import com.geocompliance.evidence.EvidencePack;
import com.geocompliance.evidence.NormalizedEvidence;
import com.geocompliance.logic.EvaluationOutcome;
import com.geocompliance.logic.ExpressionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs a {@link RuleCatalog} against an evidence pack.
 *
 * Each enabled rule is evaluated in catalog order and in isolation: a rule
 * whose evaluation fails is recorded in {@code failed_rules}, counted as
 * non-matching, and does not affect any other rule.
 *
 * Confidence is the sum of matched severity weights divided by the number of
 * rules in the whole catalog (disabled ones included), capped at 1.0. A single
 * match therefore lands in a low, review-worthy band.
 *
 * Stateless; the same engine and catalog may serve concurrent evaluations.
 */
public class RulesEngine {

    private static final Logger log = LoggerFactory.getLogger(RulesEngine.class);

    private final EvidenceNormalizer normalizer;
    private final ExpressionEvaluator evaluator;

    public RulesEngine(EvidenceNormalizer normalizer, ExpressionEvaluator evaluator) {
        this.normalizer = normalizer;
        this.evaluator = evaluator;
    }

    public RulesResult evaluate(EvidencePack evidence, RuleCatalog catalog) {
        if (evidence == null) {
            throw new IllegalArgumentException("evidence is required");
        }
        if (catalog == null) {
            throw new IllegalArgumentException("rule catalog is required");
        }

        log.info("Evaluating {} rules against evidence for {}", catalog.size(), evidence.featureId());
        NormalizedEvidence normalized = normalizer.normalize(evidence);

        List<String> matchedRules = new ArrayList<>();
        Set<String> missingControls = new LinkedHashSet<>();
        List<RulesResult.RuleFailure> failures = new ArrayList<>();
        double accumulator = 0.0;

        for (CompiledRule entry : catalog.entries()) {
            ComplianceRule rule = entry.rule();
            if (!rule.enabled()) {
                continue;
            }

            EvaluationOutcome outcome = entry.test(evaluator, normalized.context());
            if (outcome instanceof EvaluationOutcome.Err err) {
                log.warn("Failed to evaluate rule {} for {}: {}", rule.id(), evidence.featureId(), err.reason());
                failures.add(new RulesResult.RuleFailure(rule.id(), err.reason()));
                continue;
            }
            if (outcome instanceof EvaluationOutcome.Ok ok && ok.matched()) {
                log.debug("Rule {} matched for {}", rule.id(), evidence.featureId());
                matchedRules.add(rule.id());
                missingControls.addAll(rule.requiresControls());
                accumulator += rule.severity().weight();
            }
        }

        double confidence = catalog.size() == 0 ? 0.0 : Math.min(accumulator / catalog.size(), 1.0);

        return new RulesResult(
            evidence.featureId(),
            !matchedRules.isEmpty(),
            confidence,
            matchedRules,
            missingControls,
            failures,
            Instant.now()
        );
    }
}
