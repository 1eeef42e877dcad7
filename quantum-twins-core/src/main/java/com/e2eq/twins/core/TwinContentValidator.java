package com.e2eq.twins.core;

import com.e2eq.twins.models.dtdl.DtdlContent;
import com.e2eq.twins.models.dtdl.DtdlContentKind;
import com.e2eq.twins.models.dtdl.DtdlInterface;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Validates twin, component and relationship property bags against their interface and stamps
 * per-property {@code lastUpdateTime} metadata for the properties it accepts. Every method
 * returns all violations found; an empty list means the content was accepted.
 * <p>
 * A non-null scope restricts the pass to those top-level keys, so untouched properties keep
 * their metadata. A scoped key that is no longer present has its metadata entry removed.
 */
public class TwinContentValidator {

    public List<String> validateTwin(DtdlInterface model, ObjectNode twin, Collection<String> scope, String timestamp) {
        ObjectNode metadata = metadataOf(twin);
        List<String> violations = new ArrayList<>();
        for (String key : keysInScope(twin, scope, TwinKeys.TWIN_RESERVED)) {
            JsonNode value = twin.get(key);
            if (value == null) {
                metadata.remove(key);
                continue;
            }
            DtdlContent content = model.content(key).orElse(null);
            if (content == null) {
                violations.add("Property '" + key + "' is not defined in the model");
                continue;
            }
            // components are only written through the component path
            if (content.kind() != DtdlContentKind.PROPERTY) {
                violations.add("Property '" + key + "' is a " + content.kind().getDtdlType() + " and is not supported");
                continue;
            }
            List<String> problems = content.schema().validate(value);
            if (problems.isEmpty()) {
                stamp(metadata, key, timestamp);
            } else {
                problems.forEach(p -> violations.add("Property '" + key + "': " + p));
            }
        }
        return violations;
    }

    /**
     * Validates a component object against its interface, stamping the component's own
     * {@code $metadata} for accepted properties and its {@code $lastUpdateTime}.
     */
    public List<String> validateComponent(String componentName, DtdlInterface componentModel, ObjectNode component,
                                          Collection<String> scope, String timestamp) {
        ObjectNode metadata = metadataOf(component);
        List<String> violations = new ArrayList<>();
        for (String key : keysInScope(component, scope, Set.of(TwinKeys.METADATA))) {
            JsonNode value = component.get(key);
            if (value == null) {
                metadata.remove(key);
                continue;
            }
            DtdlContent content = componentModel.content(key).orElse(null);
            if (content == null || content.kind() != DtdlContentKind.PROPERTY) {
                violations.add("Property '" + key + "' is not defined in component '" + componentName + "' schema");
                continue;
            }
            List<String> problems = content.schema().validate(value);
            if (problems.isEmpty()) {
                stamp(metadata, key, timestamp);
            } else {
                problems.forEach(p -> violations.add("Component '" + componentName + "' property '" + key + "': " + p));
            }
        }
        if (violations.isEmpty()) {
            metadata.put(TwinKeys.LAST_UPDATE_TIME, timestamp);
        }
        return violations;
    }

    /**
     * Validates the user properties of a relationship against the relationship declaration.
     */
    public List<String> validateRelationship(DtdlContent declaration, ObjectNode relationship, Collection<String> scope) {
        List<String> violations = new ArrayList<>();
        for (String key : keysInScope(relationship, scope, TwinKeys.RELATIONSHIP_RESERVED)) {
            JsonNode value = relationship.get(key);
            if (value == null) {
                continue;
            }
            DtdlContent property = declaration.relationshipProperties().get(key);
            if (property == null) {
                violations.add("Property '" + key + "' is not defined in relationship '" + declaration.name() + "'");
                continue;
            }
            property.schema().validate(value).forEach(p -> violations.add("Property '" + key + "': " + p));
        }
        return violations;
    }

    static ObjectNode metadataOf(ObjectNode entity) {
        JsonNode metadata = entity.get(TwinKeys.METADATA);
        if (metadata instanceof ObjectNode) {
            return (ObjectNode) metadata;
        }
        return entity.putObject(TwinKeys.METADATA);
    }

    static void stamp(ObjectNode metadata, String key, String timestamp) {
        JsonNode entry = metadata.get(key);
        ObjectNode target = entry instanceof ObjectNode ? (ObjectNode) entry : metadata.putObject(key);
        target.put(TwinKeys.PROPERTY_LAST_UPDATE_TIME, timestamp);
    }

    private static List<String> keysInScope(ObjectNode entity, Collection<String> scope, Set<String> reserved) {
        List<String> keys = new ArrayList<>();
        if (scope == null) {
            Iterator<String> names = entity.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                if (!reserved.contains(name)) keys.add(name);
            }
        } else {
            for (String name : scope) {
                if (!reserved.contains(name)) keys.add(name);
            }
        }
        return keys;
    }
}
