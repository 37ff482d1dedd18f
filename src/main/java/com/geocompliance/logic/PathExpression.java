package com.geocompliance.logic;

import java.util.ArrayList;
import java.util.List;

/**
 * Pre-parsed dot path such as {@code static.geo_branching.*.countries}.
 *
 * An empty source string addresses the whole context. The {@code *} segment
 * projects the remainder of the path across every element of the list it
 * follows.
 */
public record PathExpression(String source, List<Segment> segments) {

    public static final String WILDCARD_TOKEN = "*";

    public PathExpression {
        segments = List.copyOf(segments);
    }

    public sealed interface Segment {
        record Field(String name) implements Segment {}
        record Wildcard() implements Segment {}
    }

    /**
     * @throws ExpressionParseException if the path contains an empty segment
     */
    public static PathExpression parse(String path) {
        if (path == null) {
            throw new ExpressionParseException("var path must be a string");
        }
        if (path.isEmpty()) {
            return new PathExpression(path, List.of());
        }

        String[] parts = path.split("\\.", -1);
        List<Segment> segments = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new ExpressionParseException("var path has an empty segment: '" + path + "'");
            }
            segments.add(WILDCARD_TOKEN.equals(part) ? new Segment.Wildcard() : new Segment.Field(part));
        }
        return new PathExpression(path, segments);
    }

    @Override
    public String toString() {
        return source;
    }
}
