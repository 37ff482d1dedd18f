package com.geocompliance.rules;

import com.geocompliance.logic.EvaluationOutcome;
import com.geocompliance.logic.Expression;
import com.geocompliance.logic.ExpressionEvaluator;
import com.geocompliance.logic.ExpressionParseException;
import com.geocompliance.logic.ExpressionParser;

import java.util.Map;

/**
 * A catalog entry with its logic parsed into a typed tree.
 *
 * A rule whose logic does not parse keeps its place in the catalog with the
 * parse error recorded; testing it always yields {@link EvaluationOutcome.Err}.
 */
public record CompiledRule(ComplianceRule rule, Expression logic, String compileError) {

    static CompiledRule compile(ComplianceRule rule, ExpressionParser parser) {
        try {
            return new CompiledRule(rule, parser.parse(rule.logic()), null);
        } catch (ExpressionParseException ex) {
            return new CompiledRule(rule, null, ex.getMessage());
        }
    }

    public boolean isCompiled() {
        return logic != null;
    }

    public EvaluationOutcome test(ExpressionEvaluator evaluator, Map<String, ?> context) {
        if (!isCompiled()) {
            return EvaluationOutcome.err("invalid logic: " + compileError);
        }
        return evaluator.test(logic, context);
    }

    CompiledRule withEnabled(boolean enabled) {
        return new CompiledRule(rule.withEnabled(enabled), logic, compileError);
    }
}
