package com.e2eq.twins.core.patch;

import com.e2eq.twins.exceptions.InvalidArgumentException;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One JSON Patch operation. {@code from} is only meaningful for move and copy.
 */
public record PatchOperation(String op, String path, JsonNode value, String from) {

    public static PatchOperation add(String path, JsonNode value) {
        return new PatchOperation("add", path, value, null);
    }

    public static PatchOperation replace(String path, JsonNode value) {
        return new PatchOperation("replace", path, value, null);
    }

    public static PatchOperation remove(String path) {
        return new PatchOperation("remove", path, null, null);
    }

    /**
     * First segment of the path, unescaped; empty for the document root.
     */
    public String rootKey() {
        JsonPointer pointer;
        try {
            pointer = JsonPointer.compile(path);
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Invalid patch path '" + path + "'");
        }
        return pointer.matches() ? "" : pointer.getMatchingProperty();
    }
}
