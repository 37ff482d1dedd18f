package com.geocompliance.logic;

import java.util.Arrays;

/**
 * Static factories for building expression trees in code.
 */
public final class Expressions {

    private Expressions() {
    }

    public static Expression and(Expression... operands) {
        return new Expression.And(Arrays.asList(operands));
    }

    public static Expression or(Expression... operands) {
        return new Expression.Or(Arrays.asList(operands));
    }

    public static Expression eq(Expression left, Expression right) {
        return new Expression.Eq(left, right);
    }

    public static Expression lt(Expression left, Expression right) {
        return new Expression.Lt(left, right);
    }

    public static Expression in(Expression needle, Expression haystack) {
        return new Expression.In(needle, haystack);
    }

    public static Expression var(String path) {
        return new Expression.Var(PathExpression.parse(path));
    }

    public static Expression literal(Object value) {
        return new Expression.Literal(value);
    }

    public static Expression list(Object... values) {
        return new Expression.Literal(Arrays.asList(values));
    }
}
