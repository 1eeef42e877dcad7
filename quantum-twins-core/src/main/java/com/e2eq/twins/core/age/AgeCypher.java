package com.e2eq.twins.core.age;

import com.e2eq.twins.core.TwinKeys;
import com.e2eq.twins.core.store.WriteCondition;
import com.e2eq.twins.exceptions.InvalidArgumentException;
import com.e2eq.twins.util.JSONUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the Cypher statements run against the twin graph. Values are always embedded as
 * escaped literals; labels are validated identifiers.
 */
public final class AgeCypher {

    static final String TWIN = "t";
    static final String RELATIONSHIP = "r";

    private AgeCypher() {
    }

    /**
     * Escapes text for use inside a single-quoted Cypher string.
     */
    public static String escape(String value) {
        StringBuilder out = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\'' -> out.append("\\'");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    public static String literal(String value) {
        return "'" + escape(value) + "'";
    }

    /** A JSON document cast to agtype. */
    public static String agtype(JsonNode json) {
        return literal(JSONUtils.instance().writeValueAsString(json)) + "::agtype";
    }

    public static String list(Collection<String> values) {
        return values.stream().map(AgeCypher::literal).collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * @throws InvalidArgumentException when the name cannot be used as a graph label
     */
    public static String label(String name) {
        if (!TwinKeys.isValidRelationshipName(name)) {
            throw new InvalidArgumentException("'" + name + "' is not a valid relationship name");
        }
        return name;
    }

    static String twinMatch(String twinId) {
        return "MATCH (t:Twin) WHERE t['$dtId'] = " + literal(twinId);
    }

    static String findTwin(String twinId) {
        return twinMatch(twinId) + " RETURN t";
    }

    static String findTwinIds(Collection<String> twinIds) {
        return "MATCH (t:Twin) WHERE t['$dtId'] IN " + list(twinIds) + " RETURN t['$dtId'] AS id";
    }

    static String replaceTwin(String twinId, JsonNode twin, WriteCondition condition) {
        String json = agtype(twin);
        String id = literal(twinId);
        return switch (condition.type()) {
            case NONE -> "WITH " + json + " AS twin MERGE (t:Twin {`$dtId`: " + id + "}) SET t = twin RETURN t";
            case IF_ABSENT -> "OPTIONAL MATCH (e:Twin) WHERE e['$dtId'] = " + id
                    + " WITH e WHERE e IS NULL CREATE (t:Twin {`$dtId`: " + id + "}) SET t = " + json + " RETURN t";
            case IF_MATCH -> twinMatch(twinId) + " AND t['$etag'] = " + literal(condition.etag())
                    + " SET t = " + json + " RETURN t";
        };
    }

    static String upsertTwins(List<? extends JsonNode> twins) {
        String rows = twins.stream().map(AgeCypher::agtype).collect(Collectors.joining(", ", "[", "]"));
        return "UNWIND " + rows + " AS twin MERGE (t:Twin {`$dtId`: twin['$dtId']}) SET t = twin RETURN t";
    }

    /**
     * Sets the given root keys of the stored twin to their values in {@code twin}, removing the
     * keys {@code twin} lacks, through the graph's {@code agtype_set} and {@code agtype_delete_key}
     * functions. Other properties are left as stored.
     */
    static String patchTwin(String graphName, String twinId, JsonNode twin, Collection<String> keys, String etag) {
        String properties = "properties(t)";
        for (String key : keys) {
            String path = "[" + literal(key) + "]";
            JsonNode value = twin.get(key);
            properties = value == null
                    ? graphName + ".agtype_delete_key(" + properties + ", " + path + ")"
                    : graphName + ".agtype_set(" + properties + ", " + path + ", " + agtype(value) + ")";
        }
        return twinMatch(twinId) + etagClause(TWIN, etag) + " SET t = " + properties + " RETURN t";
    }

    static String deleteTwin(String twinId, String etag) {
        return twinMatch(twinId) + etagClause(TWIN, etag) + " DETACH DELETE t RETURN t";
    }

    private static String relationshipMatch(String sourceId, String relationshipId) {
        return "MATCH (s:Twin)-[r]->(:Twin) WHERE s['$dtId'] = " + literal(sourceId)
                + " AND r['$relationshipId'] = " + literal(relationshipId);
    }

    static String findRelationship(String sourceId, String relationshipId) {
        return relationshipMatch(sourceId, relationshipId) + " RETURN r";
    }

    static String listRelationships(String sourceId, String relationshipName) {
        String edge = relationshipName == null ? "[r]" : "[r:" + label(relationshipName) + "]";
        return "MATCH (s:Twin)-" + edge + "->(:Twin) WHERE s['$dtId'] = " + literal(sourceId) + " RETURN r";
    }

    static String listIncomingRelationships(String targetId) {
        return "MATCH (:Twin)-[r]->(t:Twin) WHERE t['$dtId'] = " + literal(targetId) + " RETURN r";
    }

    /**
     * Removes an edge with the same id that differs in name or target, so the following upsert
     * does not leave it behind.
     */
    static String deleteStaleRelationship(String sourceId, String relationshipId, String name, String targetId) {
        return "MATCH (s:Twin)-[r]->(t:Twin) WHERE s['$dtId'] = " + literal(sourceId)
                + " AND r['$relationshipId'] = " + literal(relationshipId)
                + " AND (label(r) <> " + literal(name) + " OR t['$dtId'] <> " + literal(targetId) + ")"
                + " DELETE r RETURN r";
    }

    static String replaceRelationship(JsonNode relationship, WriteCondition condition) {
        String sourceId = relationship.path(TwinKeys.SOURCE_ID).asText();
        String targetId = relationship.path(TwinKeys.TARGET_ID).asText();
        String relationshipId = relationship.path(TwinKeys.RELATIONSHIP_ID).asText();
        String name = label(relationship.path(TwinKeys.RELATIONSHIP_NAME).asText());
        String json = agtype(relationship);
        String endpoints = "MATCH (s:Twin), (t:Twin) WHERE s['$dtId'] = " + literal(sourceId)
                + " AND t['$dtId'] = " + literal(targetId);
        return switch (condition.type()) {
            case NONE -> endpoints + " MERGE (s)-[r:" + name + " {`$relationshipId`: " + literal(relationshipId)
                    + "}]->(t) SET r = " + json + " RETURN r";
            case IF_ABSENT -> endpoints + " OPTIONAL MATCH (s)-[e]->(:Twin) WHERE e['$relationshipId'] = "
                    + literal(relationshipId) + " WITH s, t, e WHERE e IS NULL CREATE (s)-[r:" + name
                    + "]->(t) SET r = " + json + " RETURN r";
            case IF_MATCH -> "MATCH (s:Twin)-[r:" + name + "]->(t:Twin) WHERE s['$dtId'] = " + literal(sourceId)
                    + " AND t['$dtId'] = " + literal(targetId)
                    + " AND r['$relationshipId'] = " + literal(relationshipId)
                    + etagClause(RELATIONSHIP, condition.etag()) + " SET r = " + json + " RETURN r";
        };
    }

    static String upsertRelationships(String relationshipName, List<? extends JsonNode> relationships) {
        String rows = relationships.stream().map(AgeCypher::agtype).collect(Collectors.joining(", ", "[", "]"));
        return "UNWIND " + rows + " AS rel"
                + " MATCH (s:Twin), (t:Twin) WHERE s['$dtId'] = rel['$sourceId'] AND t['$dtId'] = rel['$targetId']"
                + " MERGE (s)-[r:" + label(relationshipName) + " {`$relationshipId`: rel['$relationshipId']}]->(t)"
                + " SET r = rel RETURN r";
    }

    static String deleteRelationship(String sourceId, String relationshipId, String etag) {
        return relationshipMatch(sourceId, relationshipId) + etagClause(RELATIONSHIP, etag) + " DELETE r RETURN r";
    }

    static String createModels(List<? extends JsonNode> models) {
        String rows = models.stream().map(AgeCypher::agtype).collect(Collectors.joining(", ", "[", "]"));
        return "UNWIND " + rows + " AS model CREATE (m:Model {id: model['id']}) SET m = model RETURN m";
    }

    static String findModel(String modelId) {
        return "MATCH (m:Model) WHERE m.id = " + literal(modelId) + " RETURN m";
    }

    static String findModels(Collection<String> modelIds) {
        return "MATCH (m:Model) WHERE m.id IN " + list(modelIds) + " RETURN m";
    }

    static String listModels() {
        return "MATCH (m:Model) RETURN m";
    }

    static String createDependencyEdge(String fromModelId, String toModelId, String edgeType) {
        return "MATCH (a:Model), (b:Model) WHERE a.id = " + literal(fromModelId) + " AND b.id = " + literal(toModelId)
                + " CREATE (a)-[e:" + label(edgeType) + "]->(b) RETURN e";
    }

    static String deleteModelEdges(String modelId) {
        return "MATCH (m:Model)-[e]->(:Model) WHERE m.id = " + literal(modelId) + " DELETE e RETURN e";
    }

    static String deleteModel(String modelId) {
        return "MATCH (m:Model) WHERE m.id = " + literal(modelId) + " DELETE m RETURN m";
    }

    static String deleteAllModels() {
        return "MATCH (m:Model) DETACH DELETE m RETURN m";
    }

    private static String etagClause(String variable, String etag) {
        return etag == null ? "" : " AND " + variable + "['$etag'] = " + literal(etag);
    }
}
