package com.geocompliance.logic;

/**
 * Thrown when a well-formed expression cannot be evaluated against a
 * particular context, e.g. a numeric comparison between a number and a string.
 */
public class ExpressionEvaluationException extends RuntimeException {

    public ExpressionEvaluationException(String message) {
        super(message);
    }
}
