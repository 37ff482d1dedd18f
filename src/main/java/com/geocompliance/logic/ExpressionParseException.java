package com.geocompliance.logic;

/**
 * Thrown when a logic document cannot be turned into an {@link Expression}:
 * unknown operator, wrong arity, or a malformed operand.
 */
public class ExpressionParseException extends RuntimeException {

    public ExpressionParseException(String message) {
        super(message);
    }
}
