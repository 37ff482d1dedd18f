package com.geocompliance.logic;

/**
 * Result of testing one rule's logic against one evidence context.
 */
public sealed interface EvaluationOutcome {

    record Ok(boolean matched) implements EvaluationOutcome {}

    record Err(String reason) implements EvaluationOutcome {}

    static EvaluationOutcome ok(boolean matched) {
        return new Ok(matched);
    }

    static EvaluationOutcome err(String reason) {
        return new Err(reason);
    }
}
