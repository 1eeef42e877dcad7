package com.e2eq.twins.core.age;

import com.e2eq.twins.exceptions.GraphStoreException;
import com.google.common.io.Resources;
import org.apache.commons.text.StringSubstitutor;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Creates the twin graph with its labels and indexes when it does not exist yet, and installs
 * the SQL functions the compiled queries call. Safe to run on every start.
 */
public class GraphInitializer {
    private static final Logger LOG = Logger.getLogger(GraphInitializer.class);

    static final String CREATE_GRAPH_SCRIPT = "/age/create-graph.sql";
    static final String FUNCTIONS_SCRIPT = "/age/graph-functions.sql";

    private final AgeConnector connector;

    public GraphInitializer(AgeConnector connector) {
        this.connector = connector;
    }

    public void initialize() {
        String graphName = connector.getGraphName();
        if (!connector.graphExists()) {
            LOG.infof("Creating graph %s", graphName);
            String script = script(CREATE_GRAPH_SCRIPT, graphName);
            connector.inTransaction(connection -> {
                connector.execute(connection, script);
                return null;
            });
        } else {
            LOG.debugf("Graph %s already exists", graphName);
        }
        String functions = script(FUNCTIONS_SCRIPT, graphName);
        connector.inTransaction(connection -> {
            connector.execute(connection, functions);
            return null;
        });
        LOG.infof("Graph %s is ready", graphName);
    }

    /**
     * Loads a bundled script and substitutes {@code ${graphName}}.
     */
    static String script(String resource, String graphName) {
        try {
            String text = Resources.toString(Resources.getResource(GraphInitializer.class, resource), StandardCharsets.UTF_8);
            return new StringSubstitutor(Map.of("graphName", graphName)).replace(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + resource, e);
        } catch (IllegalArgumentException e) {
            throw new GraphStoreException("Missing initialization script " + resource, e);
        }
    }
}
