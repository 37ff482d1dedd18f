package com.geocompliance.logic;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Recursive interpreter for {@link Expression} trees over a nested
 * map/list evaluation context.
 *
 * Unknown path segments resolve to {@code null} instead of failing, so a
 * misspelled path silently makes its enclosing predicate false.
 */
public class ExpressionEvaluator {

    /**
     * Evaluates the expression and reports the truthiness of the result.
     * Never throws: evaluation failures come back as {@link EvaluationOutcome.Err}.
     */
    public EvaluationOutcome test(Expression expression, Map<String, ?> context) {
        try {
            return EvaluationOutcome.ok(isTruthy(evaluate(expression, context)));
        } catch (ExpressionEvaluationException ex) {
            return EvaluationOutcome.err(ex.getMessage());
        } catch (RuntimeException ex) {
            return EvaluationOutcome.err(ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }

    /**
     * @return a boolean, scalar, list or map depending on the expression
     * @throws ExpressionEvaluationException on operand type mismatches
     */
    public Object evaluate(Expression expression, Map<String, ?> context) {
        if (expression instanceof Expression.And and) {
            for (Expression operand : and.operands()) {
                if (!isTruthy(evaluate(operand, context))) {
                    return false;
                }
            }
            return true;
        }
        if (expression instanceof Expression.Or or) {
            for (Expression operand : or.operands()) {
                if (isTruthy(evaluate(operand, context))) {
                    return true;
                }
            }
            return false;
        }
        if (expression instanceof Expression.Eq eq) {
            return valuesEqual(evaluate(eq.left(), context), evaluate(eq.right(), context));
        }
        if (expression instanceof Expression.Lt lt) {
            return lessThan(evaluate(lt.left(), context), evaluate(lt.right(), context));
        }
        if (expression instanceof Expression.In in) {
            return contains(evaluate(in.haystack(), context), evaluate(in.needle(), context));
        }
        if (expression instanceof Expression.Var var) {
            return resolve(context, var.path().segments(), 0);
        }
        if (expression instanceof Expression.Literal literal) {
            return literal.value();
        }
        throw new ExpressionEvaluationException("unsupported expression: " + expression);
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    static boolean valuesEqual(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        if (left instanceof Collection<?> a && right instanceof Collection<?> b) {
            if (a.size() != b.size()) {
                return false;
            }
            Iterator<?> ia = a.iterator();
            Iterator<?> ib = b.iterator();
            while (ia.hasNext()) {
                if (!valuesEqual(ia.next(), ib.next())) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    private boolean lessThan(Object left, Object right) {
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) < 0;
        }
        throw new ExpressionEvaluationException(
            "< expects numeric operands, got " + typeName(left) + " and " + typeName(right));
    }

    private boolean contains(Object haystack, Object needle) {
        if (haystack == null) {
            return false;
        }
        if (haystack instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (valuesEqual(element, needle)) {
                    return true;
                }
            }
            return false;
        }
        if (haystack instanceof String text) {
            if (!(needle instanceof String fragment)) {
                throw new ExpressionEvaluationException(
                    "in with a string haystack expects a string needle, got " + typeName(needle));
            }
            return text.contains(fragment);
        }
        throw new ExpressionEvaluationException(
            "in expects a list or string haystack, got " + typeName(haystack));
    }

    private Object resolve(Object current, List<PathExpression.Segment> segments, int index) {
        if (index == segments.size()) {
            return current;
        }
        if (current == null) {
            return null;
        }

        PathExpression.Segment segment = segments.get(index);
        if (segment instanceof PathExpression.Segment.Wildcard) {
            if (!(current instanceof Collection<?> elements)) {
                return null;
            }
            // project the rest of the path over every element, flattening one level
            Set<Object> projected = new LinkedHashSet<>();
            for (Object element : elements) {
                Object value = resolve(element, segments, index + 1);
                if (value instanceof Collection<?> nested) {
                    for (Object item : nested) {
                        if (item != null) {
                            projected.add(item);
                        }
                    }
                } else if (value != null) {
                    projected.add(value);
                }
            }
            return new ArrayList<>(projected);
        }

        String name = ((PathExpression.Segment.Field) segment).name();
        if (current instanceof Map<?, ?> map) {
            return resolve(map.get(name), segments, index + 1);
        }
        if (current instanceof List<?> list && isIndex(name)) {
            int position = Integer.parseInt(name);
            return position < list.size() ? resolve(list.get(position), segments, index + 1) : null;
        }
        return null;
    }

    private static boolean isIndex(String name) {
        if (name.isEmpty() || name.length() > 9) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!Character.isDigit(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
