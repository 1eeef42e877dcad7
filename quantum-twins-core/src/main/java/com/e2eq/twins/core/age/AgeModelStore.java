package com.e2eq.twins.core.age;

import com.e2eq.twins.core.store.GraphRow;
import com.e2eq.twins.core.store.GraphValue;
import com.e2eq.twins.exceptions.GraphStoreException;
import com.e2eq.twins.exceptions.ModelAlreadyExistsException;
import com.e2eq.twins.exceptions.ModelReferencesNotDeletedException;
import com.e2eq.twins.models.DigitalTwinsModelData;
import com.e2eq.twins.models.ModelStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * {@link ModelStore} keeping models as {@code Model} vertices of the twin graph.
 */
public class AgeModelStore implements ModelStore {
    private static final Logger LOG = Logger.getLogger(AgeModelStore.class);
    private static final String UNIQUE_VIOLATION = "23505";
    private static final String CONNECTED_EDGES_ROUTINE = "check_for_connected_edges";

    private final AgeConnector connector;

    public AgeModelStore(AgeConnector connector) {
        this.connector = connector;
    }

    @Override
    public List<DigitalTwinsModelData> createModels(List<DigitalTwinsModelData> models) {
        if (models.isEmpty()) {
            return List.of();
        }
        List<JsonNode> rows = new ArrayList<>(models.size());
        models.forEach(m -> rows.add(m.toProperties()));
        try {
            return toModels(connector.query(AgeCypher.createModels(rows), true));
        } catch (GraphStoreException e) {
            if (isUniqueViolation(e)) {
                throw new ModelAlreadyExistsException(models.get(0).getId());
            }
            throw e;
        }
    }

    @Override
    public Optional<DigitalTwinsModelData> findModel(String modelId) {
        List<DigitalTwinsModelData> found = toModels(connector.query(AgeCypher.findModel(modelId), false));
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<DigitalTwinsModelData> findModels(Collection<String> modelIds) {
        if (modelIds.isEmpty()) {
            return List.of();
        }
        return toModels(connector.query(AgeCypher.findModels(modelIds), false));
    }

    @Override
    public List<DigitalTwinsModelData> listModels() {
        return toModels(connector.query(AgeCypher.listModels(), false));
    }

    @Override
    public void createDependencyEdge(String fromModelId, String toModelId, String edgeType) {
        connector.query(AgeCypher.createDependencyEdge(fromModelId, toModelId, edgeType), true);
    }

    @Override
    public boolean edgeTypeExists(String name) {
        return connector.withConnection(false, connection -> connector.labelExists(connection, name));
    }

    @Override
    public void createEdgeType(String name) {
        String graph = connector.getGraphName();
        String label = AgeCypher.label(name);
        connector.inTransaction(connection -> {
            connector.execute(connection, "SELECT create_elabel('" + graph + "', '" + label + "')");
            connector.execute(connection, "ALTER TABLE " + graph + ".\"" + label + "\" REPLICA IDENTITY FULL");
            return null;
        });
        LOG.infof("Created edge label %s in graph %s", label, graph);
    }

    @Override
    public boolean deleteModel(String modelId) {
        try {
            return connector.inTransaction(connection -> {
                connector.cypher(connection, AgeCypher.deleteModelEdges(modelId));
                return !connector.cypher(connection, AgeCypher.deleteModel(modelId)).isEmpty();
            });
        } catch (GraphStoreException e) {
            if (isConnectedEdgesError(e)) {
                throw new ModelReferencesNotDeletedException(modelId, e);
            }
            throw e;
        }
    }

    @Override
    public void deleteAllModels() {
        List<GraphRow> deleted = connector.query(AgeCypher.deleteAllModels(), true);
        LOG.infof("Deleted %d models from graph %s", deleted.size(), connector.getGraphName());
    }

    /**
     * AGE refuses to delete a vertex that still has edges. The server names the routine that
     * raised it; the message text is the fallback when no server detail is available.
     */
    static boolean isConnectedEdgesError(GraphStoreException e) {
        Throwable cause = e.getCause();
        if (cause instanceof PSQLException) {
            ServerErrorMessage detail = ((PSQLException) cause).getServerErrorMessage();
            if (detail != null && detail.getRoutine() != null) {
                return CONNECTED_EDGES_ROUTINE.equals(detail.getRoutine());
            }
        }
        return cause instanceof SQLException && cause.getMessage() != null && cause.getMessage().contains("has edge(s)");
    }

    private static boolean isUniqueViolation(GraphStoreException e) {
        return e.getCause() instanceof SQLException
                && UNIQUE_VIOLATION.equals(((SQLException) e.getCause()).getSQLState());
    }

    private static List<DigitalTwinsModelData> toModels(List<GraphRow> rows) {
        List<DigitalTwinsModelData> models = new ArrayList<>(rows.size());
        for (GraphRow row : rows) {
            for (GraphValue value : row.columns().values()) {
                if (value.isEntity()) {
                    models.add(DigitalTwinsModelData.fromProperties(value.value()));
                    break;
                }
            }
        }
        return models;
    }
}
