package com.e2eq.twins.core;

import com.e2eq.twins.core.patch.JsonPatch;
import com.e2eq.twins.core.store.GraphStore;
import com.e2eq.twins.core.store.WriteCondition;
import com.e2eq.twins.exceptions.ComponentNotFoundException;
import com.e2eq.twins.exceptions.DigitalTwinNotFoundException;
import com.e2eq.twins.exceptions.InvalidArgumentException;
import com.e2eq.twins.exceptions.PreconditionFailedException;
import com.e2eq.twins.exceptions.TwinsValidationException;
import com.e2eq.twins.models.ModelRegistry;
import com.e2eq.twins.models.dtdl.DtdlContent;
import com.e2eq.twins.models.dtdl.DtdlContentKind;
import com.e2eq.twins.models.dtdl.DtdlInterface;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Reads and patches the components embedded in a twin.
 */
public class ComponentService {
    private static final Logger LOG = Logger.getLogger(ComponentService.class);

    private final GraphStore store;
    private final ModelRegistry registry;
    private final TwinContentValidator validator;
    private final Clock clock;

    public ComponentService(GraphStore store, ModelRegistry registry, TwinContentValidator validator, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * @throws ComponentNotFoundException when the twin's model does not declare the component or
     *                                    the twin does not carry it
     */
    public ObjectNode getComponent(String twinId, String componentName) {
        ObjectNode twin = findTwin(twinId);
        DtdlInterface model = registry.getInterface(DigitalTwinService.modelIdOf(twin));
        declaration(model, componentName);
        return component(twin, twinId, componentName).deepCopy();
    }

    public void updateComponent(String twinId, String componentName, JsonPatch patch, String ifMatch) {
        ObjectNode current = findTwin(twinId);
        DigitalTwinService.checkIfMatch(current, ifMatch, "digital twin '" + twinId + "'");
        if (patch == null || patch.isEmpty()) {
            throw new InvalidArgumentException("A patch with at least one operation is required");
        }
        DtdlInterface model = DigitalTwinService.resolveModelForWrite(registry, DigitalTwinService.modelIdOf(current));
        DtdlContent declaration = declaration(model, componentName);

        ObjectNode updated = current.deepCopy();
        ObjectNode component = component(updated, twinId, componentName);
        patch.applyTo(component);

        Instant now = clock.instant();
        String timestamp = now.toString();
        List<String> violations = validator.validateComponent(componentName, declaration.componentInterface(), component,
                patch.rootKeys(), timestamp);
        if (!violations.isEmpty()) {
            throw new TwinsValidationException(violations);
        }
        TwinContentValidator.stamp(TwinContentValidator.metadataOf(updated), componentName, timestamp);
        TwinContentValidator.metadataOf(updated).put(TwinKeys.LAST_UPDATE_TIME, timestamp);
        updated.put(TwinKeys.ETAG, ETagGenerator.generate(twinId, now));

        WriteCondition condition = WriteCondition.fromIfMatch(ifMatch);
        if (store.patchTwin(twinId, updated, Set.of(componentName, TwinKeys.METADATA, TwinKeys.ETAG), condition).isEmpty()) {
            if (condition.type() == WriteCondition.Type.IF_MATCH) {
                throw new PreconditionFailedException("The etag does not match the current etag of digital twin '" + twinId + "'");
            }
            throw new DigitalTwinNotFoundException("Digital twin with id '" + twinId + "' not found");
        }
        LOG.debugf("Patched component %s of digital twin %s", componentName, twinId);
    }

    private ObjectNode findTwin(String twinId) {
        DigitalTwinService.requireId(twinId, "Digital twin id");
        return store.findTwin(twinId)
                .orElseThrow(() -> new DigitalTwinNotFoundException("Digital twin with id '" + twinId + "' not found"));
    }

    private static DtdlContent declaration(DtdlInterface model, String componentName) {
        return model.content(componentName)
                .filter(c -> c.kind() == DtdlContentKind.COMPONENT)
                .orElseThrow(() -> new ComponentNotFoundException("Component '" + componentName + "' is not defined in model '" + model.id() + "'"));
    }

    private static ObjectNode component(ObjectNode twin, String twinId, String componentName) {
        JsonNode component = twin.get(componentName);
        if (component == null || !component.isObject()) {
            throw new ComponentNotFoundException("Component '" + componentName + "' not found on digital twin '" + twinId + "'");
        }
        return (ObjectNode) component;
    }
}
