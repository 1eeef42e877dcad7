package com.e2eq.twins.models.dtdl;

import com.e2eq.twins.util.JSONUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DtdlSchemaTest {

    private static JsonNode json(String text) {
        return JSONUtils.instance().readTree(text);
    }

    @Test
    void testPrimitives() {
        DtdlSchema integer = new DtdlSchema.Primitive(DtdlSchema.PrimitiveType.INTEGER);
        assertTrue(integer.validate(json("42")).isEmpty());
        assertEquals(List.of("\"hot\" is not a valid integer"), integer.validate(json("\"hot\"")));
        assertFalse(integer.validate(json("1.5")).isEmpty());

        DtdlSchema dateTime = new DtdlSchema.Primitive(DtdlSchema.PrimitiveType.DATE_TIME);
        assertTrue(dateTime.validate(json("\"2024-01-01T10:00:00Z\"")).isEmpty());
        assertFalse(dateTime.validate(json("\"yesterday\"")).isEmpty());

        DtdlSchema duration = new DtdlSchema.Primitive(DtdlSchema.PrimitiveType.DURATION);
        assertTrue(duration.validate(json("\"PT5M\"")).isEmpty());
        assertTrue(duration.validate(json("\"P3D\"")).isEmpty());
    }

    @Test
    void testEnum() {
        DtdlSchema schema = new DtdlSchema.EnumSchema(DtdlSchema.PrimitiveType.STRING, List.of(
                new DtdlSchema.EnumValue("on", json("\"on\"")),
                new DtdlSchema.EnumValue("off", json("\"off\""))));

        assertTrue(schema.validate(json("\"on\"")).isEmpty());
        assertEquals(1, schema.validate(json("\"dim\"")).size());
    }

    @Test
    void testObjectCollectsEveryFieldViolation() {
        DtdlSchema schema = new DtdlSchema.ObjectSchema(Map.of(
                "lat", new DtdlSchema.Field("lat", new DtdlSchema.Primitive(DtdlSchema.PrimitiveType.DOUBLE)),
                "lon", new DtdlSchema.Field("lon", new DtdlSchema.Primitive(DtdlSchema.PrimitiveType.DOUBLE))));

        assertTrue(schema.validate(json("{\"lat\":1.0,\"lon\":2}")).isEmpty());
        List<String> violations = schema.validate(json("{\"lat\":\"x\",\"alt\":3}"));
        assertEquals(2, violations.size());
        assertTrue(violations.contains("field 'lat': \"x\" is not a valid double"));
        assertTrue(violations.contains("field 'alt' is not defined in the Object schema"));
    }

    @Test
    void testMapAndArray() {
        DtdlSchema map = new DtdlSchema.MapSchema("sensor", new DtdlSchema.Primitive(DtdlSchema.PrimitiveType.BOOLEAN));
        assertTrue(map.validate(json("{\"a\":true}")).isEmpty());
        assertEquals(List.of("sensor 'b': 1 is not a valid boolean"), map.validate(json("{\"a\":true,\"b\":1}")));

        DtdlSchema array = new DtdlSchema.ArraySchema(new DtdlSchema.Primitive(DtdlSchema.PrimitiveType.STRING));
        assertTrue(array.validate(json("[\"a\",\"b\"]")).isEmpty());
        assertEquals(List.of("element 1: 2 is not a valid string"), array.validate(json("[\"a\",2]")));
        assertEquals(1, array.validate(json("\"a\"")).size());
    }
}
