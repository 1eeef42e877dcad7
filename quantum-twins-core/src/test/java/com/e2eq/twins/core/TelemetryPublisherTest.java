package com.e2eq.twins.core;

import com.e2eq.twins.exceptions.DigitalTwinNotFoundException;
import com.e2eq.twins.models.InMemoryModelStore;
import com.e2eq.twins.models.ModelRegistry;
import com.e2eq.twins.models.dtdl.DtdlModelParser;
import com.e2eq.twins.util.JSONUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryPublisherTest {

    private InMemoryGraphStoreTestDouble store;
    private TelemetryPublisher publisher;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = new InMemoryGraphStoreTestDouble();
        ModelRegistry registry = new ModelRegistry(new InMemoryModelStore(), new DtdlModelParser(), Duration.ofSeconds(10), clock);
        registry.createModels(TestModels.ALL);
        new DigitalTwinService(store, registry, new TwinContentValidator(), clock)
                .createOrReplaceDigitalTwin("room1", TestModels.room("Lobby", 20), null);
        publisher = new TelemetryPublisher(store, registry, clock);
    }

    @Test
    void testPublishTelemetry() {
        ObjectNode event = publisher.publishTelemetry("room1", TestModels.json("{\"reading\": 21.7}"), "m-1");

        assertEquals("room1", event.get("digitalTwinId").asText());
        assertEquals("m-1", event.get("messageId").asText());
        assertEquals("Telemetry", event.get("eventType").asText());
        assertEquals(TestModels.ROOM_ID, event.get("modelId").asText());
        assertEquals("2024-05-01T10:00:00Z", event.get("timestamp").asText());
        assertFalse(event.has("componentName"));

        assertEquals(1, store.getNotifications().size());
        assertEquals(TelemetryPublisher.CHANNEL, store.getNotifications().get(0)[0]);
        JsonNode sent = JSONUtils.instance().readTree(store.getNotifications().get(0)[1]);
        assertEquals(21.7, sent.at("/telemetry/reading").asDouble());
    }

    @Test
    void testPublishComponentTelemetryGeneratesMessageId() {
        ObjectNode event = publisher.publishComponentTelemetry("room1", "thermostat", TestModels.json("{\"temp\": 20}"), null);

        assertEquals("ComponentTelemetry", event.get("eventType").asText());
        assertEquals("thermostat", event.get("componentName").asText());
        assertFalse(event.get("messageId").asText().isBlank());
    }

    @Test
    void testUnknownTwin() {
        assertThrows(DigitalTwinNotFoundException.class,
                () -> publisher.publishTelemetry("ghost", TestModels.json("{}"), null));
        assertTrue(store.getNotifications().isEmpty());
    }
}
