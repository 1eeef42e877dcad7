package com.e2eq.twins.core.age;

import com.e2eq.twins.core.TwinKeys;
import com.e2eq.twins.core.store.GraphRow;
import com.e2eq.twins.core.store.GraphStore;
import com.e2eq.twins.core.store.GraphValue;
import com.e2eq.twins.core.store.WriteCondition;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link GraphStore} backed by an Apache AGE graph. Twins are {@code Twin} vertices and
 * relationships are edges labelled with the relationship name.
 */
public class AgeGraphStore implements GraphStore {
    private static final Logger LOG = Logger.getLogger(AgeGraphStore.class);

    private final AgeConnector connector;

    public AgeGraphStore(AgeConnector connector) {
        this.connector = connector;
    }

    @Override
    public Optional<ObjectNode> findTwin(String twinId) {
        return first(connector.query(AgeCypher.findTwin(twinId), false));
    }

    @Override
    public Set<String> findExistingTwinIds(Collection<String> twinIds) {
        Set<String> found = new LinkedHashSet<>();
        if (twinIds.isEmpty()) {
            return found;
        }
        for (GraphRow row : connector.query(AgeCypher.findTwinIds(twinIds), false)) {
            GraphValue id = row.columns().get("id");
            if (id != null && id.kind() == GraphValue.Kind.SCALAR) {
                found.add(id.value().asText());
            }
        }
        return found;
    }

    @Override
    public Optional<ObjectNode> replaceTwin(String twinId, ObjectNode twin, WriteCondition condition) {
        return first(connector.query(AgeCypher.replaceTwin(twinId, twin, condition), true));
    }

    @Override
    public Optional<ObjectNode> patchTwin(String twinId, ObjectNode twin, Set<String> keys, WriteCondition condition) {
        return first(connector.query(
                AgeCypher.patchTwin(connector.getGraphName(), twinId, twin, keys, condition.etag()), true));
    }

    @Override
    public int upsertTwins(List<ObjectNode> twins) {
        if (twins.isEmpty()) {
            return 0;
        }
        return connector.query(AgeCypher.upsertTwins(twins), true).size();
    }

    @Override
    public boolean deleteTwin(String twinId, String etag) {
        return !connector.query(AgeCypher.deleteTwin(twinId, etag), true).isEmpty();
    }

    @Override
    public Optional<ObjectNode> findRelationship(String sourceId, String relationshipId) {
        return first(connector.query(AgeCypher.findRelationship(sourceId, relationshipId), false));
    }

    @Override
    public List<ObjectNode> listRelationships(String sourceId, String relationshipName) {
        return entities(connector.query(AgeCypher.listRelationships(sourceId, relationshipName), false));
    }

    @Override
    public List<ObjectNode> listIncomingRelationships(String targetId) {
        return entities(connector.query(AgeCypher.listIncomingRelationships(targetId), false));
    }

    @Override
    public Optional<ObjectNode> replaceRelationship(ObjectNode relationship, WriteCondition condition) {
        if (condition.type() != WriteCondition.Type.NONE) {
            return first(connector.query(AgeCypher.replaceRelationship(relationship, condition), true));
        }
        String sourceId = relationship.path(TwinKeys.SOURCE_ID).asText();
        String relationshipId = relationship.path(TwinKeys.RELATIONSHIP_ID).asText();
        String name = relationship.path(TwinKeys.RELATIONSHIP_NAME).asText();
        String targetId = relationship.path(TwinKeys.TARGET_ID).asText();
        return connector.inTransaction(connection -> {
            List<GraphRow> stale = connector.cypher(connection,
                    AgeCypher.deleteStaleRelationship(sourceId, relationshipId, name, targetId));
            if (!stale.isEmpty()) {
                LOG.debugf("Replaced relationship %s of %s with a new name or target", relationshipId, sourceId);
            }
            return first(connector.cypher(connection, AgeCypher.replaceRelationship(relationship, condition)));
        });
    }

    @Override
    public int upsertRelationships(String relationshipName, List<ObjectNode> relationships) {
        if (relationships.isEmpty()) {
            return 0;
        }
        return connector.inTransaction(connection -> {
            ensureEdgeLabel(connection, relationshipName);
            return connector.cypher(connection, AgeCypher.upsertRelationships(relationshipName, relationships)).size();
        });
    }

    @Override
    public boolean deleteRelationship(String sourceId, String relationshipId, String etag) {
        return !connector.query(AgeCypher.deleteRelationship(sourceId, relationshipId, etag), true).isEmpty();
    }

    @Override
    public List<GraphRow> executeQuery(String cypher, boolean readWrite) {
        return connector.query(cypher, readWrite);
    }

    @Override
    public void notify(String channel, String payload) {
        connector.withConnection(true, connection -> {
            try (PreparedStatement ps = connection.prepareStatement("SELECT pg_notify(?, ?)")) {
                ps.setString(1, channel);
                ps.setString(2, payload);
                ps.execute();
            }
            return null;
        });
    }

    private void ensureEdgeLabel(Connection connection, String name) throws SQLException {
        if (!connector.labelExists(connection, AgeCypher.label(name))) {
            LOG.infof("Creating edge label %s in graph %s", name, connector.getGraphName());
            connector.execute(connection, "SELECT create_elabel('" + connector.getGraphName() + "', '" + name + "')");
        }
    }

    private static Optional<ObjectNode> first(List<GraphRow> rows) {
        List<ObjectNode> found = entities(rows);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    private static List<ObjectNode> entities(List<GraphRow> rows) {
        List<ObjectNode> result = new ArrayList<>(rows.size());
        for (GraphRow row : rows) {
            for (GraphValue value : row.columns().values()) {
                if (value.isEntity() && value.value().isObject()) {
                    result.add((ObjectNode) value.value());
                    break;
                }
            }
        }
        return result;
    }
}
