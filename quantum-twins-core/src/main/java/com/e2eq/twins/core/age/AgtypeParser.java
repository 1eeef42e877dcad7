package com.e2eq.twins.core.age;

import com.e2eq.twins.core.store.GraphValue;
import com.e2eq.twins.exceptions.GraphStoreException;
import com.e2eq.twins.util.JSONUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.regex.Pattern;

/**
 * Reads the text output of AGE's {@code agtype}: JSON with {@code ::vertex}, {@code ::edge},
 * {@code ::path} and {@code ::numeric} annotations.
 */
public final class AgtypeParser {
    private static final String VERTEX_SUFFIX = "::vertex";
    private static final String EDGE_SUFFIX = "::edge";
    private static final Pattern ANNOTATION = Pattern.compile("::(vertex|edge|path|numeric)(?=\\s*[,\\]}]|\\s*$)");

    private static final ObjectReader READER = JSONUtils.instance().getMapper().reader()
            .with(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS);

    private AgtypeParser() {
    }

    public static GraphValue parse(String agtype) {
        if (agtype == null) {
            return GraphValue.of(NullNode.getInstance());
        }
        String text = agtype.trim();
        if (text.endsWith(VERTEX_SUFFIX)) {
            JsonNode vertex = read(stripAnnotations(text));
            return GraphValue.vertex(vertex.path("label").asText(null), vertex.path("properties"));
        }
        if (text.endsWith(EDGE_SUFFIX)) {
            JsonNode edge = read(stripAnnotations(text));
            return GraphValue.edge(edge.path("label").asText(null), edge.path("properties"));
        }
        return GraphValue.of(read(stripAnnotations(text)));
    }

    static String stripAnnotations(String text) {
        return ANNOTATION.matcher(text).replaceAll("");
    }

    private static JsonNode read(String json) {
        try {
            return READER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new GraphStoreException("Unreadable agtype value: " + json, e);
        }
    }
}
