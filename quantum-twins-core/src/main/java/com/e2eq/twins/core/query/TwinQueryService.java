package com.e2eq.twins.core.query;

import com.e2eq.twins.core.store.GraphRow;
import com.e2eq.twins.core.store.GraphStore;
import com.e2eq.twins.core.store.GraphValue;
import com.e2eq.twins.exceptions.InvalidArgumentException;
import com.e2eq.twins.exceptions.TwinQueryCompileException;
import com.e2eq.twins.query.CompiledQuery;
import com.e2eq.twins.query.TwinQueryCompiler;
import com.e2eq.twins.util.JSONUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs twin queries and native graph queries page by page. Twin queries are recognised by
 * containing {@code SELECT} and no {@code RETURN}; everything else is passed through as
 * graph query text. Only read-only text is accepted.
 */
public class TwinQueryService {
    private static final Logger LOG = Logger.getLogger(TwinQueryService.class);

    private static final String[] FORBIDDEN_KEYWORDS = {"CREATE ", "DELETE ", "SET ", "MERGE ", "REMOVE "};
    private static final String[] CHARGED_FUNCTIONS = {"COUNT", "SUM", "AVG", "MIN", "MAX", "IS_OF_MODEL"};
    private static final String UNNAMED_COLUMN = "_";

    private final GraphStore store;
    private final TwinQueryCompiler compiler;
    private final String graphName;
    private final int defaultPageSize;

    public TwinQueryService(GraphStore store, TwinQueryCompiler compiler, String graphName, int defaultPageSize) {
        this.store = store;
        this.compiler = compiler;
        this.graphName = graphName;
        this.defaultPageSize = defaultPageSize;
    }

    /**
     * @param continuationToken token of the previous page; when present it replaces the query
     * @param maxItemsPerPage   page size, the configured default when null
     * @throws TwinQueryCompileException for empty, malformed or mutating queries and bad tokens
     */
    public QueryPage query(String query, String continuationToken, Integer maxItemsPerPage) {
        int pageSize = maxItemsPerPage != null ? maxItemsPerPage : defaultPageSize;
        if (pageSize <= 0) {
            throw new InvalidArgumentException("maxItemsPerPage must be positive");
        }

        String cypher;
        int rowNumber = 0;
        boolean compiledReadWrite = false;
        if (continuationToken != null) {
            ContinuationToken token = ContinuationToken.decode(continuationToken);
            cypher = token.query();
            rowNumber = token.rowNumber();
        } else if (StringUtils.isBlank(query)) {
            throw new TwinQueryCompileException("Query cannot be null or empty", query);
        } else if (isTwinQuery(query)) {
            CompiledQuery compiled = compiler.compile(query, graphName);
            cypher = compiled.getText();
            compiledReadWrite = compiled.requiresReadWrite();
            LOG.debugf("Compiled twin query [%s] to [%s]", query, cypher);
        } else {
            cypher = query;
        }
        rejectForbiddenKeywords(query);
        rejectForbiddenKeywords(cypher);

        QueryPaging.Paged paged = QueryPaging.page(cypher, rowNumber, pageSize);
        boolean variableLength = compiledReadWrite || QueryPaging.isVariableLength(paged.text());
        List<GraphRow> rows = store.executeQuery(paged.text(), variableLength);

        List<JsonNode> items = new ArrayList<>(rows.size());
        int totalProperties = 0;
        for (GraphRow row : rows) {
            ObjectNode item = JSONUtils.instance().createObjectNode();
            for (Map.Entry<String, GraphValue> column : row.columns().entrySet()) {
                GraphValue value = column.getValue();
                if (value == null || value.kind() == GraphValue.Kind.NULL) {
                    continue;
                }
                item.set(column.getKey(), value.value());
                totalProperties += value.propertyCount();
            }
            items.add(item.size() == 1 && item.has(UNNAMED_COLUMN) ? item.get(UNNAMED_COLUMN) : item);
        }

        int nextRow = rowNumber + items.size();
        String next = items.size() < pageSize || nextRow >= paged.existingLimit()
                ? null
                : new ContinuationToken(nextRow, cypher).encode();
        return new QueryPage(items, next, charge(paged.text(), items.size(), totalProperties, variableLength));
    }

    static boolean isTwinQuery(String query) {
        String upper = query.toUpperCase(Locale.ROOT);
        return upper.contains("SELECT") && !upper.contains("RETURN");
    }

    static double charge(String cypher, int rows, int totalProperties, boolean variableLength) {
        int charge = rows + totalProperties;
        if (variableLength) {
            charge += 10;
        }
        String upper = cypher.toUpperCase(Locale.ROOT);
        for (String function : CHARGED_FUNCTIONS) {
            if (upper.contains(function)) {
                charge += 5;
                break;
            }
        }
        return charge;
    }

    private static void rejectForbiddenKeywords(String text) {
        if (text == null) {
            return;
        }
        String upper = text.toUpperCase(Locale.ROOT);
        for (String keyword : FORBIDDEN_KEYWORDS) {
            if (upper.contains(keyword)) {
                throw new TwinQueryCompileException("Query contains forbidden keyword: " + keyword.trim()
                        + ". Only read-only queries are allowed.", keyword.trim());
            }
        }
    }
}
