package com.e2eq.twins.core.age;

import com.e2eq.twins.core.store.GraphRow;
import com.e2eq.twins.core.store.GraphValue;
import com.e2eq.twins.exceptions.GraphStoreException;
import com.e2eq.twins.exceptions.InvalidArgumentException;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * JDBC access to a PostgreSQL database with the Apache AGE extension. Every connection handed
 * out has AGE loaded and {@code ag_catalog} on its search path. Reads go to the read data source
 * when one is configured.
 */
public class AgeConnector {
    private static final Logger LOG = Logger.getLogger(AgeConnector.class);
    private static final Pattern GRAPH_NAME = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    private final DataSource writeDataSource;
    private final DataSource readDataSource;
    private final String graphName;

    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    public AgeConnector(DataSource dataSource, String graphName) {
        this(dataSource, null, graphName);
    }

    /**
     * @param readDataSource optional replica-preferring data source used for read-only work
     */
    public AgeConnector(DataSource writeDataSource, DataSource readDataSource, String graphName) {
        this.writeDataSource = Objects.requireNonNull(writeDataSource, "writeDataSource");
        this.readDataSource = readDataSource != null ? readDataSource : writeDataSource;
        this.graphName = validateGraphName(graphName);
    }

    public String getGraphName() {
        return graphName;
    }

    static String validateGraphName(String graphName) {
        if (graphName == null || !GRAPH_NAME.matcher(graphName).matches()) {
            throw new InvalidArgumentException("'" + graphName + "' is not a valid graph name");
        }
        return graphName;
    }

    public <T> T withConnection(boolean readWrite, SqlWork<T> work) {
        try (Connection connection = open(readWrite ? writeDataSource : readDataSource)) {
            return work.apply(connection);
        } catch (SQLException e) {
            throw new GraphStoreException("Graph operation failed: " + e.getMessage(), e);
        }
    }

    /**
     * Runs the work in one transaction on the write data source, rolling back on any failure.
     */
    public <T> T inTransaction(SqlWork<T> work) {
        return withConnection(true, connection -> {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                T result = work.apply(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        });
    }

    public List<GraphRow> query(String cypher, boolean readWrite) {
        return withConnection(readWrite, connection -> cypher(connection, cypher));
    }

    /**
     * Runs a Cypher statement against this connector's graph on the given connection.
     */
    public List<GraphRow> cypher(Connection connection, String cypher) throws SQLException {
        List<String> columns = ReturnColumns.of(cypher);
        String sql = wrap(graphName, cypher, columns);
        if (columns.isEmpty()) {
            columns = List.of("result");
        }
        LOG.debugf("Executing cypher on graph %s: %s", graphName, cypher);
        List<GraphRow> rows = new ArrayList<>();
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(sql)) {
            while (rs.next()) {
                Map<String, GraphValue> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    row.put(columns.get(i), AgtypeParser.parse(rs.getString(i + 1)));
                }
                rows.add(new GraphRow(row));
            }
        }
        return rows;
    }

    /**
     * Wraps Cypher text into the SQL call AGE executes, picking a dollar-quote tag that does not
     * occur in the text.
     */
    static String wrap(String graphName, String cypher, List<String> columns) {
        String tag = "$$";
        int n = 0;
        while (cypher.contains(tag)) {
            tag = "$twins" + (n == 0 ? "" : String.valueOf(n)) + "$";
            n++;
        }
        String projection = columns.isEmpty()
                ? "\"result\" agtype"
                : columns.stream().map(c -> "\"" + c + "\" agtype").collect(Collectors.joining(", "));
        return "SELECT * FROM ag_catalog.cypher('" + graphName + "', " + tag + " " + cypher + " " + tag
                + ") AS (" + projection + ")";
    }

    public boolean graphExists() {
        return withConnection(true, connection -> {
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT EXISTS(SELECT 1 FROM ag_catalog.ag_graph WHERE name = ?)")) {
                ps.setString(1, graphName);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() && rs.getBoolean(1);
                }
            }
        });
    }

    public boolean labelExists(Connection connection, String label) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT EXISTS(SELECT 1 FROM ag_catalog.ag_label WHERE name = ? AND graph = "
                        + "(SELECT graphid FROM ag_catalog.ag_graph WHERE name = ?))")) {
            ps.setString(1, label);
            ps.setString(2, graphName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    /** Executes SQL text, possibly several statements, on the given connection. */
    public void execute(Connection connection, String sql) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    private static Connection open(DataSource dataSource) throws SQLException {
        Connection connection = dataSource.getConnection();
        try (Statement statement = connection.createStatement()) {
            statement.execute("LOAD 'age'");
            statement.execute("SET search_path = ag_catalog, \"$user\", public");
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        return connection;
    }
}
