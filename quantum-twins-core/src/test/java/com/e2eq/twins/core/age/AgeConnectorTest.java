package com.e2eq.twins.core.age;

import com.e2eq.twins.exceptions.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgeConnectorTest {

    @Test
    void testWrapUsesDeclaredColumns() {
        assertEquals("SELECT * FROM ag_catalog.cypher('digitaltwins', $$ MATCH (T:Twin) RETURN T.name, T $$) AS (\"name\" agtype, \"T\" agtype)",
                AgeConnector.wrap("digitaltwins", "MATCH (T:Twin) RETURN T.name, T", List.of("name", "T")));
    }

    @Test
    void testWrapWithoutReturn() {
        assertTrue(AgeConnector.wrap("g", "MATCH (n) DETACH DELETE n", List.of()).endsWith("AS (\"result\" agtype)"));
    }

    @Test
    void testWrapPicksAnUnusedDollarQuote() {
        String sql = AgeConnector.wrap("g", "MATCH (t) WHERE t.name = 'a$$b' RETURN t", List.of("t"));

        assertTrue(sql.contains("'g', $twins$ MATCH"));
        assertTrue(sql.contains("RETURN t $twins$)"));
    }

    @Test
    void testGraphNameValidation() {
        assertEquals("digitaltwins", AgeConnector.validateGraphName("digitaltwins"));
        assertThrows(InvalidArgumentException.class, () -> AgeConnector.validateGraphName("Twins"));
        assertThrows(InvalidArgumentException.class, () -> AgeConnector.validateGraphName("g'); DROP TABLE x; --"));
        assertThrows(InvalidArgumentException.class, () -> AgeConnector.validateGraphName(null));
    }
}
