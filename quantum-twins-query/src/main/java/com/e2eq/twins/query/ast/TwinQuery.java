package com.e2eq.twins.query.ast;

import java.util.List;

/**
 * Parsed form of a twin query. Exactly one of {@code match} or {@code joins} may be
 * non-empty; both empty means the source is the collection named in {@code from}.
 */
public record TwinQuery(Integer top,
                        Projection projection,
                        From from,
                        List<PathPattern> match,
                        List<Join> joins,
                        Predicate where) {

    public TwinQuery {
        match = match == null ? List.of() : List.copyOf(match);
        joins = joins == null ? List.of() : List.copyOf(joins);
    }

    public enum Collection { DIGITALTWINS, RELATIONSHIPS }

    public enum Direction { OUTGOING, INCOMING, UNDIRECTED }

    public record From(Collection collection, String alias) {}

    public record Projection(boolean wildcard, List<ProjectionItem> items) {
        public Projection {
            items = items == null ? List.of() : List.copyOf(items);
        }

        public static Projection all() {
            return new Projection(true, List.of());
        }
    }

    public record ProjectionItem(ValueExpr value, String alias) {}

    public record NodePattern(String alias) {}

    /**
     * @param hops the variable-length suffix without the leading star, {@code ""} for a bare
     *             star and {@code null} for a single hop
     */
    public record EdgePattern(String alias, List<String> labels, Direction direction, String hops) {
        public EdgePattern {
            labels = labels == null ? List.of() : List.copyOf(labels);
        }

        public boolean isVariableLength() {
            return hops != null;
        }

        public boolean isMultiLabel() {
            return labels.size() > 1;
        }
    }

    public record PathPattern(List<NodePattern> nodes, List<EdgePattern> edges) {
        public PathPattern {
            nodes = List.copyOf(nodes);
            edges = List.copyOf(edges);
            if (nodes.size() != edges.size() + 1) {
                throw new IllegalArgumentException("A path needs exactly one more node than edges");
            }
        }
    }

    public record Join(String targetAlias, String sourceAlias, String relationshipName, String edgeAlias) {}
}
