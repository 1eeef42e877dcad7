package com.e2eq.twins.core.query;

import com.e2eq.twins.core.InMemoryGraphStoreTestDouble;
import com.e2eq.twins.core.store.GraphRow;
import com.e2eq.twins.core.store.GraphValue;
import com.e2eq.twins.exceptions.TwinQueryCompileException;
import com.e2eq.twins.query.TwinQueryCompiler;
import com.e2eq.twins.util.JSONUtils;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TwinQueryServiceTest {

    private InMemoryGraphStoreTestDouble store;
    private TwinQueryService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStoreTestDouble();
        service = new TwinQueryService(store, new TwinQueryCompiler(), "digitaltwins", 1000);
    }

    private static GraphRow twinRow(String id) {
        return GraphRow.of("T", GraphValue.vertex("Twin",
                JSONUtils.instance().readTree("{\"$dtId\":\"" + id + "\",\"name\":\"n\"}")));
    }

    @Test
    void testTwinQueryIsCompiledAndPaged() {
        String query = "SELECT * FROM DIGITALTWINS";
        store.stubQueryRows(List.of(twinRow("a"), twinRow("b")));

        QueryPage page = service.query(query, null, null);

        String compiled = new TwinQueryCompiler().compile(query, "digitaltwins").getText();
        assertEquals(compiled + " LIMIT 1000", store.getExecutedQueries().get(0));
        assertFalse(store.getExecutedReadWrite().get(0));
        assertEquals(2, page.getItems().size());
        assertEquals("a", page.getItems().get(0).at("/T/$dtId").asText());
        assertNull(page.getContinuationToken());
        assertEquals(6.0, page.getQueryCharge());
    }

    @Test
    void testFullPageIssuesContinuationToken() {
        store.stubQueryRows(List.of(twinRow("a"), twinRow("b")));

        QueryPage first = service.query("MATCH (T:Twin) RETURN T", null, 2);
        assertNotNull(first.getContinuationToken());
        ContinuationToken token = ContinuationToken.decode(first.getContinuationToken());
        assertEquals(2, token.rowNumber());
        assertEquals("MATCH (T:Twin) RETURN T", token.query());

        store.stubQueryRows(List.of(twinRow("c")));
        QueryPage second = service.query(null, first.getContinuationToken(), 2);
        assertEquals("MATCH (T:Twin) RETURN T SKIP 2 LIMIT 2", store.getExecutedQueries().get(1));
        assertNull(second.getContinuationToken());
    }

    @Test
    void testTopIsHonouredAcrossPages() {
        String compiled = new TwinQueryCompiler().compile("SELECT TOP(5) * FROM DIGITALTWINS", "digitaltwins").getText();
        store.stubQueryRows(List.of(twinRow("a"), twinRow("b")));
        QueryPage first = service.query("SELECT TOP(5) * FROM DIGITALTWINS", null, 2);
        QueryPage second = service.query(null, first.getContinuationToken(), 2);
        store.stubQueryRows(List.of(twinRow("e")));
        QueryPage third = service.query(null, second.getContinuationToken(), 2);

        String base = compiled.replace(" LIMIT 5", "");
        assertEquals(List.of(base + " LIMIT 2", base + " SKIP 2 LIMIT 2", base + " SKIP 4 LIMIT 1"), store.getExecutedQueries());
        assertEquals(1, third.getItems().size());
        assertNull(third.getContinuationToken());
    }

    @Test
    void testOwnLimitEndsPaging() {
        store.stubQueryRows(List.of(twinRow("a"), twinRow("b")));

        assertNull(service.query("MATCH (T:Twin) RETURN T LIMIT 2", null, 2).getContinuationToken());
    }

    @Test
    void testSingleUnnamedColumnIsUnwrappedAndNullsAreSkipped() {
        Map<String, GraphValue> withNull = new LinkedHashMap<>();
        withNull.put("_", GraphValue.of(IntNode.valueOf(7)));
        withNull.put("x", GraphValue.of(NullNode.getInstance()));
        store.stubQueryRows(List.of(new GraphRow(withNull)));

        QueryPage page = service.query("MATCH (T:Twin) RETURN count(T), T.x", null, null);

        assertEquals(IntNode.valueOf(7), page.getItems().get(0));
        assertEquals(6.0, page.getQueryCharge());
    }

    @Test
    void testVariableLengthQueryUsesReadWriteConnection() {
        QueryPage page = service.query("MATCH (a:Twin)-[*1..2]->(b:Twin) RETURN b", null, null);

        assertTrue(store.getExecutedReadWrite().get(0));
        assertEquals(10.0, page.getQueryCharge());
    }

    @Test
    void testMutatingQueriesAreRejected() {
        TwinQueryCompileException e = assertThrows(TwinQueryCompileException.class,
                () -> service.query("MATCH (n:Twin) SET n.x = 1 RETURN n", null, null));
        assertTrue(e.getMessage().startsWith("Query contains forbidden keyword: SET"));
        assertThrows(TwinQueryCompileException.class, () -> service.query("MATCH (n) DETACH DELETE n", null, null));
        assertTrue(store.getExecutedQueries().isEmpty());
    }

    @Test
    void testEmptyQueryAndBadToken() {
        assertThrows(TwinQueryCompileException.class, () -> service.query("  ", null, null));
        assertThrows(TwinQueryCompileException.class, () -> service.query(null, "garbage!", null));
    }

    @Test
    void testCharge() {
        assertEquals(3.0, TwinQueryService.charge("MATCH (n) RETURN n", 1, 2, false));
        assertEquals(18.0, TwinQueryService.charge("MATCH (n) WHERE digitaltwins.is_of_model(n, 'x') RETURN n", 1, 2, true));
    }
}
