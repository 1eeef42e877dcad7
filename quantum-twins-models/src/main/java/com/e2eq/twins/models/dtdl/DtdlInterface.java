package com.e2eq.twins.models.dtdl;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A resolved DTDL interface.
 *
 * @param extendsIds direct bases only, in declaration order
 * @param contents   declared and inherited contents by name
 * @param source     the interface's definition as submitted
 */
public record DtdlInterface(String id,
                            List<String> extendsIds,
                            Map<String, DtdlContent> contents,
                            JsonNode displayName,
                            JsonNode description,
                            JsonNode source) {

    public DtdlInterface {
        extendsIds = List.copyOf(extendsIds);
        contents = new LinkedHashMap<>(contents);
    }

    public Optional<DtdlContent> content(String name) {
        return Optional.ofNullable(contents.get(name));
    }

    public List<DtdlContent> contentsOfKind(DtdlContentKind kind) {
        return contents.values().stream().filter(c -> c.kind() == kind).toList();
    }
}
