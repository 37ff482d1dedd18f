package com.geocompliance.logic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionParserTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExpressionParser parser = new ExpressionParser();
    private final ExpressionWriter writer = new ExpressionWriter();

    private Expression parse(String json) throws Exception {
        return parser.parse(mapper.readTree(json));
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @Test
        void parsesNestedLogic() throws Exception {
            Expression expression = parse("""
                {"and": [
                  {"<": [{"var": "runtime.persona.age"}, 18]},
                  {"in": ["UT", {"var": "static.geo_branching.*.countries"}]}
                ]}
                """);

            Expression.And and = assertInstanceOf(Expression.And.class, expression);
            assertEquals(2, and.operands().size());
            Expression.Lt lt = assertInstanceOf(Expression.Lt.class, and.operands().get(0));
            Expression.Var var = assertInstanceOf(Expression.Var.class, lt.left());
            assertEquals("runtime.persona.age", var.path().source());
            assertEquals(new Expression.Literal(18), lt.right());

            Expression.In in = assertInstanceOf(Expression.In.class, and.operands().get(1));
            Expression.Var haystack = assertInstanceOf(Expression.Var.class, in.haystack());
            assertInstanceOf(PathExpression.Segment.Wildcard.class, haystack.path().segments().get(2));
        }

        @Test
        void varAcceptsBareStringOrSingletonArray() throws Exception {
            assertEquals(parse("{\"var\": \"a.b\"}"), parse("{\"var\": [\"a.b\"]}"));
        }

        @Test
        void arrayIsListLiteral() throws Exception {
            Expression expression = parse("{\"in\": [{\"var\": \"c\"}, [\"EU\", \"GB\", 3, true, null]]}");
            Expression.In in = assertInstanceOf(Expression.In.class, expression);
            Expression.Literal literal = assertInstanceOf(Expression.Literal.class, in.haystack());
            assertEquals(java.util.Arrays.asList("EU", "GB", 3, true, null), literal.value());
        }

        @Test
        void writerProducesParsableDocument() throws Exception {
            JsonNode original = mapper.readTree("""
                {"or": [{"==": [{"var": "static.reco_system"}, true]},
                        {"in": ["NCMEC", {"var": "static.reporting_clients"}]}]}
                """);
            Expression parsed = parser.parse(original);
            assertEquals(original, writer.write(parsed));
        }
    }

    @Nested
    @DisplayName("Rejected documents")
    class Rejected {

        @Test
        void unknownOperator() {
            ExpressionParseException ex = assertThrows(ExpressionParseException.class,
                () -> parse("{\"xor\": [true, false]}"));
            assertTrue(ex.getMessage().contains("xor"));
        }

        @Test
        void operatorObjectWithTwoKeys() {
            assertThrows(ExpressionParseException.class,
                () -> parse("{\"and\": [true], \"or\": [false]}"));
        }

        @Test
        void wrongArity() {
            assertThrows(ExpressionParseException.class, () -> parse("{\"==\": [1]}"));
            assertThrows(ExpressionParseException.class, () -> parse("{\"in\": [1, 2, 3]}"));
            assertThrows(ExpressionParseException.class, () -> parse("{\"and\": []}"));
        }

        @Test
        void nonStringVarPath() {
            assertThrows(ExpressionParseException.class, () -> parse("{\"var\": 3}"));
        }

        @Test
        void emptyPathSegment() {
            assertThrows(ExpressionParseException.class, () -> parse("{\"var\": \"static..tags\"}"));
        }

        @Test
        void nestedListLiteral() {
            assertThrows(ExpressionParseException.class, () -> parse("{\"in\": [1, [[1], 2]]}"));
        }
    }

    @Test
    void emptyPathAddressesWholeContext() {
        PathExpression path = PathExpression.parse("");
        assertEquals(List.of(), path.segments());
    }
}
