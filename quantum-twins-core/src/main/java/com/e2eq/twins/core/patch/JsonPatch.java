package com.e2eq.twins.core.patch;

import com.e2eq.twins.exceptions.InvalidArgumentException;
import com.e2eq.twins.exceptions.UnsupportedOperationKindException;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An ordered list of JSON Patch (RFC 6902) operations. Only {@code add}, {@code replace} and
 * {@code remove} are applied; {@code move}, {@code copy} and {@code test} are rejected.
 */
public class JsonPatch {
    private final List<PatchOperation> operations;

    public JsonPatch(List<PatchOperation> operations) {
        this.operations = List.copyOf(operations);
    }

    public static JsonPatch of(PatchOperation... operations) {
        return new JsonPatch(List.of(operations));
    }

    /**
     * Reads the RFC 6902 array form.
     *
     * @throws InvalidArgumentException when the document is not an array of operations
     */
    public static JsonPatch fromJson(JsonNode document) {
        if (document == null || !document.isArray()) {
            throw new InvalidArgumentException("A JSON patch document must be an array of operations");
        }
        List<PatchOperation> ops = new ArrayList<>();
        for (JsonNode node : document) {
            String op = node.path("op").asText(null);
            String path = node.path("path").asText(null);
            if (op == null || path == null) {
                throw new InvalidArgumentException("Every patch operation requires 'op' and 'path'");
            }
            ops.add(new PatchOperation(op, path, node.get("value"), node.path("from").asText(null)));
        }
        return new JsonPatch(ops);
    }

    public List<PatchOperation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    /** Distinct first path segments touched by the patch. */
    public Set<String> rootKeys() {
        Set<String> keys = new LinkedHashSet<>();
        operations.forEach(o -> keys.add(o.rootKey()));
        return keys;
    }

    /**
     * Applies every operation in order to the target, which is modified in place.
     *
     * @throws UnsupportedOperationKindException for move, copy and test
     * @throws InvalidArgumentException          for unknown operations and unresolvable paths
     */
    public ObjectNode applyTo(ObjectNode target) {
        for (PatchOperation operation : operations) {
            apply(target, operation);
        }
        return target;
    }

    private static void apply(ObjectNode target, PatchOperation operation) {
        String op = operation.op();
        switch (op) {
            case "add":
            case "replace":
            case "remove":
                break;
            case "move":
            case "copy":
            case "test":
                throw new UnsupportedOperationKindException("Patch operation '" + op + "' is not supported");
            default:
                throw new InvalidArgumentException("Unknown patch operation '" + op + "'");
        }

        JsonPointer pointer;
        try {
            pointer = JsonPointer.compile(operation.path());
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Invalid patch path '" + operation.path() + "'");
        }
        if (pointer.matches()) {
            throw new InvalidArgumentException("Patch operations cannot target the document root");
        }
        if (!"remove".equals(op) && operation.value() == null) {
            throw new InvalidArgumentException("Patch operation '" + op + "' on '" + operation.path() + "' requires a value");
        }

        JsonNode parent = target.at(pointer.head());
        String last = pointer.last().getMatchingProperty();
        if (parent.isObject()) {
            ObjectNode object = (ObjectNode) parent;
            if (!"add".equals(op) && !object.has(last)) {
                throw new InvalidArgumentException("Patch path '" + operation.path() + "' does not exist");
            }
            if ("remove".equals(op)) {
                object.remove(last);
            } else {
                object.set(last, operation.value().deepCopy());
            }
        } else if (parent.isArray()) {
            applyToArray((ArrayNode) parent, last, operation);
        } else {
            throw new InvalidArgumentException("Patch path '" + operation.path() + "' does not exist");
        }
    }

    private static void applyToArray(ArrayNode array, String token, PatchOperation operation) {
        String op = operation.op();
        if ("add".equals(op) && "-".equals(token)) {
            array.add(operation.value().deepCopy());
            return;
        }
        int index;
        try {
            index = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Patch path '" + operation.path() + "' does not address an array element");
        }
        int bound = "add".equals(op) ? array.size() : array.size() - 1;
        if (index < 0 || index > bound) {
            throw new InvalidArgumentException("Patch path '" + operation.path() + "' is out of bounds");
        }
        switch (op) {
            case "add" -> array.insert(index, operation.value().deepCopy());
            case "replace" -> array.set(index, operation.value().deepCopy());
            default -> array.remove(index);
        }
    }
}
