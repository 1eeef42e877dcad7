package com.e2eq.twins.core.store;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One typed cell of a query row. For vertices and edges {@link #value()} is the property map;
 * every other kind carries the value itself.
 */
public record GraphValue(Kind kind, String label, JsonNode value) {

    public enum Kind {
        VERTEX,
        EDGE,
        SCALAR,
        MAP,
        LIST,
        NULL
    }

    public boolean isEntity() {
        return kind == Kind.VERTEX || kind == Kind.EDGE;
    }

    /**
     * Number of properties carried, used for query charging.
     */
    public int propertyCount() {
        if (isEntity() || kind == Kind.MAP) {
            return value.size();
        }
        return 0;
    }

    public static GraphValue vertex(String label, JsonNode properties) {
        return new GraphValue(Kind.VERTEX, label, properties);
    }

    public static GraphValue edge(String label, JsonNode properties) {
        return new GraphValue(Kind.EDGE, label, properties);
    }

    public static GraphValue of(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return new GraphValue(Kind.NULL, null, value);
        }
        if (value.isObject()) {
            return new GraphValue(Kind.MAP, null, value);
        }
        if (value.isArray()) {
            return new GraphValue(Kind.LIST, null, value);
        }
        return new GraphValue(Kind.SCALAR, null, value);
    }
}
