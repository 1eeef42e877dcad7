package com.e2eq.twins.core.query;

import com.e2eq.twins.exceptions.TwinQueryCompileException;
import com.e2eq.twins.util.JSONUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Opaque paging state: base64 of {@code {"rowNumber": n, "query": "..."}}, where the query is
 * the graph query text of the first page.
 */
public record ContinuationToken(int rowNumber, String query) {

    public String encode() {
        ObjectNode node = JSONUtils.instance().createObjectNode();
        node.put("rowNumber", rowNumber);
        node.put("query", query);
        return Base64.getEncoder().encodeToString(JSONUtils.instance().writeValueAsString(node).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws TwinQueryCompileException when the token was not produced by {@link #encode()}
     */
    public static ContinuationToken decode(String token) {
        try {
            String json = new String(Base64.getDecoder().decode(token), StandardCharsets.UTF_8);
            JsonNode node = JSONUtils.instance().readTree(json);
            if (node == null || !node.path("rowNumber").isInt() || !node.path("query").isTextual()) {
                throw new TwinQueryCompileException("Invalid continuation token", token);
            }
            return new ContinuationToken(node.get("rowNumber").asInt(), node.get("query").asText());
        } catch (IllegalArgumentException e) {
            throw new TwinQueryCompileException("Invalid continuation token", token, -1, e);
        }
    }
}
