package com.geocompliance.logic;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses the JSON-logic document form of a rule into a typed {@link Expression}.
 *
 * Supported operators: {@code and}, {@code or} (n-ary, at least one operand),
 * {@code ==}, {@code <}, {@code in} (binary) and {@code var} (one string path).
 * Arrays are list literals and may only hold scalars.
 */
public class ExpressionParser {

    public Expression parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new Expression.Literal(null);
        }
        if (node.isObject()) {
            return parseOperator(node);
        }
        if (node.isArray()) {
            return new Expression.Literal(listLiteral(node));
        }
        return new Expression.Literal(scalar(node));
    }

    private Expression parseOperator(JsonNode node) {
        if (node.size() != 1) {
            throw new ExpressionParseException(
                "operator object must have exactly one key, got " + node.size());
        }
        Map.Entry<String, JsonNode> entry = node.fields().next();
        String operator = entry.getKey();
        List<JsonNode> args = arguments(entry.getValue());

        return switch (operator) {
            case "and" -> new Expression.And(parseAll(operator, args));
            case "or" -> new Expression.Or(parseAll(operator, args));
            case "==" -> {
                requireArity(operator, args, 2);
                yield new Expression.Eq(parse(args.get(0)), parse(args.get(1)));
            }
            case "<" -> {
                requireArity(operator, args, 2);
                yield new Expression.Lt(parse(args.get(0)), parse(args.get(1)));
            }
            case "in" -> {
                requireArity(operator, args, 2);
                yield new Expression.In(parse(args.get(0)), parse(args.get(1)));
            }
            case "var" -> {
                requireArity(operator, args, 1);
                JsonNode path = args.get(0);
                if (!path.isTextual()) {
                    throw new ExpressionParseException("var expects a string path, got " + path.getNodeType());
                }
                yield new Expression.Var(PathExpression.parse(path.asText()));
            }
            default -> throw new ExpressionParseException("unknown operator: " + operator);
        };
    }

    // {"var": "a.b"} is shorthand for {"var": ["a.b"]}
    private List<JsonNode> arguments(JsonNode value) {
        List<JsonNode> args = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(args::add);
        } else {
            args.add(value);
        }
        return args;
    }

    private List<Expression> parseAll(String operator, List<JsonNode> args) {
        if (args.isEmpty()) {
            throw new ExpressionParseException(operator + " requires at least one operand");
        }
        List<Expression> operands = new ArrayList<>(args.size());
        for (JsonNode arg : args) {
            operands.add(parse(arg));
        }
        return operands;
    }

    private void requireArity(String operator, List<JsonNode> args, int expected) {
        if (args.size() != expected) {
            throw new ExpressionParseException(
                operator + " expects " + expected + " operand(s), got " + args.size());
        }
    }

    private List<Object> listLiteral(JsonNode array) {
        List<Object> values = new ArrayList<>(array.size());
        Iterator<JsonNode> elements = array.elements();
        while (elements.hasNext()) {
            JsonNode element = elements.next();
            if (element.isContainerNode()) {
                throw new ExpressionParseException("list literals may only contain scalar values");
            }
            values.add(scalar(element));
        }
        return values;
    }

    private Object scalar(JsonNode node) {
        if (node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        throw new ExpressionParseException("unsupported literal: " + node.getNodeType());
    }
}
