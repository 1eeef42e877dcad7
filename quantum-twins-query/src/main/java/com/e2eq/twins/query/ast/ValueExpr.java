package com.e2eq.twins.query.ast;

import java.util.List;

public interface ValueExpr {

    /**
     * A literal kept in its source spelling, e.g. {@code 'abc'}, {@code 42}, {@code true}.
     */
    record Literal(String text) implements ValueExpr {
        public boolean isString() {
            return text.startsWith("'") || text.startsWith("\"");
        }
    }

    /**
     * The {@code *} argument of {@code COUNT(*)}.
     */
    record Star() implements ValueExpr {}

    /**
     * A segment of a property path. {@code bracketed} segments render as {@code ['name']}.
     */
    record Segment(String name, boolean bracketed) {}

    record PropertyRef(String root, List<Segment> segments) implements ValueExpr {
        public PropertyRef {
            segments = segments == null ? List.of() : List.copyOf(segments);
        }

        public boolean isBareIdentifier() {
            return segments.isEmpty() && !root.startsWith("$");
        }

        public PropertyRef prefixedWith(String alias) {
            List<Segment> all = new java.util.ArrayList<>(segments.size() + 1);
            all.add(new Segment(root, root.startsWith("$")));
            all.addAll(segments);
            return new PropertyRef(alias, all);
        }
    }

    record FunctionCall(String name, List<ValueExpr> args) implements ValueExpr {
        public FunctionCall {
            args = args == null ? List.of() : List.copyOf(args);
        }
    }
}
