package com.geocompliance.logic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Writes an {@link Expression} back into its JSON-logic document form.
 * {@code parse(write(e))} yields an expression equal to {@code e}.
 */
public class ExpressionWriter {

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public JsonNode write(Expression expression) {
        if (expression instanceof Expression.And and) {
            return operator("and", writeAll(and.operands()));
        }
        if (expression instanceof Expression.Or or) {
            return operator("or", writeAll(or.operands()));
        }
        if (expression instanceof Expression.Eq eq) {
            return operator("==", writeAll(List.of(eq.left(), eq.right())));
        }
        if (expression instanceof Expression.Lt lt) {
            return operator("<", writeAll(List.of(lt.left(), lt.right())));
        }
        if (expression instanceof Expression.In in) {
            return operator("in", writeAll(List.of(in.needle(), in.haystack())));
        }
        if (expression instanceof Expression.Var var) {
            ObjectNode node = nodes.objectNode();
            node.put("var", var.path().source());
            return node;
        }
        if (expression instanceof Expression.Literal literal) {
            return literal(literal.value());
        }
        throw new IllegalArgumentException("unsupported expression: " + expression);
    }

    private ObjectNode operator(String name, ArrayNode operands) {
        ObjectNode node = nodes.objectNode();
        node.set(name, operands);
        return node;
    }

    private ArrayNode writeAll(List<Expression> operands) {
        ArrayNode array = nodes.arrayNode();
        operands.forEach(operand -> array.add(write(operand)));
        return array;
    }

    private JsonNode literal(Object value) {
        if (value == null) {
            return nodes.nullNode();
        }
        if (value instanceof String text) {
            return nodes.textNode(text);
        }
        if (value instanceof Boolean flag) {
            return nodes.booleanNode(flag);
        }
        if (value instanceof Integer number) {
            return nodes.numberNode(number);
        }
        if (value instanceof Long number) {
            return nodes.numberNode(number);
        }
        if (value instanceof BigInteger number) {
            return nodes.numberNode(number);
        }
        if (value instanceof BigDecimal number) {
            return nodes.numberNode(number);
        }
        if (value instanceof Number number) {
            return nodes.numberNode(number.doubleValue());
        }
        if (value instanceof List<?> list) {
            ArrayNode array = nodes.arrayNode();
            list.forEach(element -> array.add(literal(element)));
            return array;
        }
        throw new IllegalArgumentException("unsupported literal type: " + value.getClass().getName());
    }
}
