package com.e2eq.twins.models.dtdl;

import java.util.Map;

/**
 * One element of an interface's contents.
 *
 * @param schema                 value schema for properties and telemetry, null otherwise
 * @param target                 target interface of a relationship, null when any twin is allowed
 * @param componentInterface     resolved schema of a component
 * @param relationshipProperties properties declared on a relationship
 */
public record DtdlContent(String name,
                          DtdlContentKind kind,
                          DtdlSchema schema,
                          String target,
                          DtdlInterface componentInterface,
                          Map<String, DtdlContent> relationshipProperties,
                          boolean writable) {

    public DtdlContent {
        relationshipProperties = relationshipProperties == null ? Map.of() : Map.copyOf(relationshipProperties);
    }

    public static DtdlContent property(String name, DtdlSchema schema, boolean writable) {
        return new DtdlContent(name, DtdlContentKind.PROPERTY, schema, null, null, null, writable);
    }
}
