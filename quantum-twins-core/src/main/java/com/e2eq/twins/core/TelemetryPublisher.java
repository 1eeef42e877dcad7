package com.e2eq.twins.core;

import com.e2eq.twins.core.store.GraphStore;
import com.e2eq.twins.exceptions.DigitalTwinNotFoundException;
import com.e2eq.twins.models.ModelRegistry;
import com.e2eq.twins.util.JSONUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.UUID;

/**
 * Publishes twin and component telemetry events on the storage notification channel.
 */
public class TelemetryPublisher {
    private static final Logger LOG = Logger.getLogger(TelemetryPublisher.class);

    public static final String CHANNEL = "digitaltwins_telemetry";

    private final GraphStore store;
    private final ModelRegistry registry;
    private final Clock clock;

    public TelemetryPublisher(GraphStore store, ModelRegistry registry, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * @param messageId optional; a random UUID is used when blank
     * @return the published event
     */
    public ObjectNode publishTelemetry(String twinId, JsonNode telemetry, String messageId) {
        return publish(twinId, null, telemetry, messageId);
    }

    public ObjectNode publishComponentTelemetry(String twinId, String componentName, JsonNode telemetry, String messageId) {
        DigitalTwinService.requireId(componentName, "Component name");
        return publish(twinId, componentName, telemetry, messageId);
    }

    private ObjectNode publish(String twinId, String componentName, JsonNode telemetry, String messageId) {
        DigitalTwinService.requireId(twinId, "Digital twin id");
        String modelId = registry.getModelIdForTwin(twinId, id -> store.findTwin(id)
                        .map(t -> t.path(TwinKeys.METADATA).path(TwinKeys.MODEL).asText(null)))
                .orElseThrow(() -> new DigitalTwinNotFoundException("Digital twin with id '" + twinId + "' not found"));

        ObjectNode event = JSONUtils.instance().createObjectNode();
        event.put("digitalTwinId", twinId);
        if (componentName != null) {
            event.put("componentName", componentName);
        }
        event.put("messageId", StringUtils.isBlank(messageId) ? UUID.randomUUID().toString() : messageId);
        event.put("timestamp", clock.instant().toString());
        event.put("eventType", componentName == null ? "Telemetry" : "ComponentTelemetry");
        event.put("modelId", modelId);
        event.set("telemetry", telemetry);

        store.notify(CHANNEL, JSONUtils.instance().writeValueAsString(event));
        LOG.debugf("Published %s for digital twin %s", event.get("eventType").asText(), twinId);
        return event;
    }
}
