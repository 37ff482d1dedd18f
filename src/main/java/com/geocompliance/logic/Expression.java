package com.geocompliance.logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Typed logic tree evaluated against a normalized evidence context.
 *
 * Trees are built once by {@link ExpressionParser} when a rule catalog is
 * loaded and are immutable afterwards. The document form is the JSON-logic
 * style used in catalog files, e.g.
 * <pre>
 * {"and": [{"&lt;": [{"var": "runtime.persona.age"}, 18]},
 *          {"in": ["UT", {"var": "static.geo_branching.*.countries"}]}]}
 * </pre>
 */
public sealed interface Expression {

    /** True iff every operand is truthy. Short-circuits left to right. */
    record And(List<Expression> operands) implements Expression {
        public And {
            operands = List.copyOf(operands);
        }
    }

    /** True iff any operand is truthy. Short-circuits left to right. */
    record Or(List<Expression> operands) implements Expression {
        public Or {
            operands = List.copyOf(operands);
        }
    }

    /** Structural equality of both evaluated operands. */
    record Eq(Expression left, Expression right) implements Expression {
        public Eq {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    /** Numeric less-than; false whenever either side is null. */
    record Lt(Expression left, Expression right) implements Expression {
        public Lt {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    /** Membership of the needle in the haystack collection (substring for strings). */
    record In(Expression needle, Expression haystack) implements Expression {
        public In {
            Objects.requireNonNull(needle, "needle");
            Objects.requireNonNull(haystack, "haystack");
        }
    }

    /** Path lookup into the evaluation context. */
    record Var(PathExpression path) implements Expression {
        public Var {
            Objects.requireNonNull(path, "path");
        }
    }

    /**
     * Constant value: string, number, boolean, null, or a list of those.
     * List literals may contain nulls, so they are wrapped rather than copied with List.copyOf.
     */
    record Literal(Object value) implements Expression {
        public Literal {
            if (value instanceof List<?> list) {
                value = Collections.unmodifiableList(new ArrayList<>(list));
            }
        }
    }
}
