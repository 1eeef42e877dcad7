package com.e2eq.twins.core;

import com.e2eq.twins.core.patch.JsonPatch;
import com.e2eq.twins.core.patch.PatchOperation;
import com.e2eq.twins.exceptions.DigitalTwinNotFoundException;
import com.e2eq.twins.exceptions.InvalidArgumentException;
import com.e2eq.twins.exceptions.PreconditionFailedException;
import com.e2eq.twins.exceptions.RelationshipNotFoundException;
import com.e2eq.twins.exceptions.TwinsValidationException;
import com.e2eq.twins.models.InMemoryModelStore;
import com.e2eq.twins.models.ModelRegistry;
import com.e2eq.twins.models.dtdl.DtdlModelParser;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipServiceTest {

    static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryGraphStoreTestDouble store;
    private ModelRegistry registry;
    private RelationshipService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryGraphStoreTestDouble();
        registry = new ModelRegistry(new InMemoryModelStore(), new DtdlModelParser(), Duration.ofSeconds(10), clock);
        registry.createModels(TestModels.ALL);
        DigitalTwinService twins = new DigitalTwinService(store, registry, new TwinContentValidator(), clock);
        twins.createOrReplaceDigitalTwin("room1", TestModels.room("Lobby", 20), null);
        twins.createOrReplaceDigitalTwin("room2", TestModels.room("Hall", 18), null);
        twins.createOrReplaceDigitalTwin("dev1", TestModels.twinOf(TestModels.DEVICE_ID), null);
        twins.createOrReplaceDigitalTwin("sensor1", TestModels.twinOf(TestModels.SENSOR_ID), null);
        service = new RelationshipService(store, registry, new TwinContentValidator(), clock, 100);
    }

    static ObjectNode rel(String name, String targetId) {
        return TestModels.json("{\"$relationshipName\":\"" + name + "\",\"$targetId\":\"" + targetId + "\"}");
    }

    static ObjectNode batchItem(String sourceId, String relationshipId, String name, String targetId) {
        ObjectNode item = rel(name, targetId);
        item.put("$sourceId", sourceId);
        item.put("$relationshipId", relationshipId);
        return item;
    }

    @Test
    void testCreateAndRead() {
        ObjectNode stored = service.createOrReplaceRelationship("room1", "r1", rel("contains", "dev1"), null);

        assertEquals("room1", stored.get("$sourceId").asText());
        assertEquals("r1", stored.get("$relationshipId").asText());
        assertEquals(ETagGenerator.generate("room1-r1", START), stored.get("$etag").asText());
        assertEquals("dev1", service.getRelationship("room1", "r1").get("$targetId").asText());
        assertEquals(1, service.listRelationships("room1", null).size());
        assertEquals(1, service.listRelationships("room1", "contains").size());
        assertTrue(service.listRelationships("room1", "feeds").isEmpty());
        assertEquals(1, service.listIncomingRelationships("dev1").size());
    }

    @Test
    void testTargetMustExist() {
        assertThrows(DigitalTwinNotFoundException.class,
                () -> service.createOrReplaceRelationship("room1", "r1", rel("contains", "ghost"), null));
        assertThrows(DigitalTwinNotFoundException.class,
                () -> service.createOrReplaceRelationship("ghost", "r1", rel("contains", "dev1"), null));
    }

    @Test
    void testTargetModelIsCheckedThroughBases() {
        service.createOrReplaceRelationship("room1", "r1", rel("contains", "sensor1"), null);

        assertThrows(TwinsValidationException.class,
                () -> service.createOrReplaceRelationship("room1", "r2", rel("contains", "room2"), null));
    }

    @Test
    void testDeclaredPropertiesAreValidated() {
        ObjectNode payload = rel("contains", "dev1");
        payload.put("since", "2024-01-01T00:00:00Z");
        payload.put("color", "red");

        TwinsValidationException e = assertThrows(TwinsValidationException.class,
                () -> service.createOrReplaceRelationship("room1", "r1", payload, null));

        assertEquals(List.of("Property 'color' is not defined in relationship 'contains'"), e.getViolations());
    }

    @Test
    void testUndeclaredRelationshipIsNotValidated() {
        ObjectNode payload = rel("near", "room2");
        payload.put("distance", 4);

        assertEquals(4, service.createOrReplaceRelationship("room1", "n1", payload, null).get("distance").asInt());
    }

    @Test
    void testPayloadMustAgreeWithPath() {
        ObjectNode payload = rel("contains", "dev1");
        payload.put("$sourceId", "room2");

        assertThrows(InvalidArgumentException.class, () -> service.createOrReplaceRelationship("room1", "r1", payload, null));
        assertThrows(InvalidArgumentException.class,
                () -> service.createOrReplaceRelationship("room1", "r1", TestModels.json("{\"$targetId\":\"dev1\"}"), null));
    }

    @Test
    void testIfNoneMatch() {
        service.createOrReplaceRelationship("room1", "r1", rel("contains", "dev1"), "*");

        assertThrows(PreconditionFailedException.class,
                () -> service.createOrReplaceRelationship("room1", "r1", rel("contains", "dev1"), "*"));
    }

    @Test
    void testUpdate() {
        String etag = service.createOrReplaceRelationship("room1", "r1", rel("contains", "dev1"), null).get("$etag").asText();
        clock.advance(Duration.ofSeconds(30));

        service.updateRelationship("room1", "r1",
                JsonPatch.of(PatchOperation.add("/since", TextNode.valueOf("2024-02-01T00:00:00Z"))), etag);

        ObjectNode updated = service.getRelationship("room1", "r1");
        assertEquals("2024-02-01T00:00:00Z", updated.get("since").asText());
        assertEquals(ETagGenerator.generate("room1-r1", clock.instant()), updated.get("$etag").asText());

        assertThrows(PreconditionFailedException.class, () -> service.updateRelationship("room1", "r1",
                JsonPatch.of(PatchOperation.remove("/since")), etag));
        TwinsValidationException e = assertThrows(TwinsValidationException.class, () -> service.updateRelationship("room1", "r1",
                JsonPatch.of(PatchOperation.replace("/$targetId", TextNode.valueOf("sensor1"))), null));
        assertEquals(List.of("Cannot update the $targetId property"), e.getViolations());
    }

    @Test
    void testDelete() {
        String etag = service.createOrReplaceRelationship("room1", "r1", rel("contains", "dev1"), null).get("$etag").asText();

        assertThrows(PreconditionFailedException.class, () -> service.deleteRelationship("room1", "r1", "W/\"stale\""));
        service.deleteRelationship("room1", "r1", etag);

        assertThrows(RelationshipNotFoundException.class, () -> service.getRelationship("room1", "r1"));
        assertThrows(RelationshipNotFoundException.class, () -> service.deleteRelationship("room1", "r1", null));
    }

    @Test
    void testBatchReportsEachItem() {
        int lookupsBefore = store.getExistenceLookups();

        BatchRelationshipResult result = service.createOrReplaceRelationships(List.of(
                batchItem("room1", "r1", "contains", "dev1"),
                batchItem("room1", "r2", "contains", "sensor1"),
                batchItem("room1", "r3", "contains", "ghost")));

        assertEquals(2, result.getSuccessCount());
        assertEquals(1, result.getFailureCount());
        assertTrue(result.hasFailures());
        RelationshipOperationResult failed = result.getResults().get(2);
        assertFalse(failed.isSuccess());
        assertEquals("r3", failed.getRelationshipId());
        assertEquals("Target twin 'ghost' does not exist", failed.getErrorMessage());
        assertEquals(1, store.getExistenceLookups() - lookupsBefore);
        assertEquals(2, store.relationships().size());
        store.relationships().forEach(r -> assertTrue(r.get("$etag").asText().startsWith("W/\"")));
    }

    @Test
    void testBatchFieldChecks() {
        ObjectNode noSource = batchItem("room1", "r1", "contains", "dev1");
        noSource.remove("$sourceId");
        ObjectNode noName = batchItem("room1", "r2", "contains", "dev1");
        noName.remove("$relationshipName");
        ObjectNode noTarget = batchItem("room1", "r3", "contains", "dev1");
        noTarget.remove("$targetId");
        ObjectNode missingSource = batchItem("ghost", "r4", "contains", "dev1");

        BatchRelationshipResult result = service.createOrReplaceRelationships(List.of(noSource, noName, noTarget, missingSource));

        assertEquals(4, result.getFailureCount());
        assertEquals("Source ID ($sourceId) is required", result.getResults().get(0).getErrorMessage());
        assertEquals("Relationship name ($relationshipName) is required", result.getResults().get(1).getErrorMessage());
        assertEquals("Target ID ($targetId) is required", result.getResults().get(2).getErrorMessage());
        assertEquals("Source twin 'ghost' does not exist", result.getResults().get(3).getErrorMessage());
    }

    @Test
    void testFailingGroupDoesNotAffectOthers() {
        store.failUpsertsOf("near");

        BatchRelationshipResult result = service.createOrReplaceRelationships(List.of(
                batchItem("room1", "r1", "contains", "dev1"),
                batchItem("room1", "n1", "near", "room2"),
                batchItem("room2", "n2", "near", "room1")));

        assertEquals(1, result.getSuccessCount());
        assertTrue(result.getResults().get(0).isSuccess());
        assertEquals("Database operation failed: label near is locked", result.getResults().get(1).getErrorMessage());
        assertEquals("Database operation failed: label near is locked", result.getResults().get(2).getErrorMessage());
    }

    @Test
    void testBatchRejectsInvalidRelationshipNamePerItem() {
        BatchRelationshipResult result = service.createOrReplaceRelationships(List.of(
                batchItem("room1", "r1", "contains", "dev1"),
                batchItem("room1", "r2", "has-part", "dev1")));

        assertEquals(1, result.getSuccessCount());
        assertTrue(result.getResults().get(0).isSuccess());
        assertFalse(result.getResults().get(1).isSuccess());
        assertEquals("'has-part' is not a valid relationship name", result.getResults().get(1).getErrorMessage());
        assertEquals(1, store.relationships().size());
    }

    @Test
    void testGroupRejectedByStoreIsReportedPerItem() {
        store.rejectUpsertsOf("near");

        BatchRelationshipResult result = service.createOrReplaceRelationships(List.of(
                batchItem("room1", "n1", "near", "room2"),
                batchItem("room1", "r1", "contains", "dev1")));

        assertEquals(2, result.getResults().size());
        assertEquals("'near' cannot be used as an edge label", result.getResults().get(0).getErrorMessage());
        assertTrue(result.getResults().get(1).isSuccess());
        assertTrue(result.hasFailures());
    }

    @Test
    void testSingleWriteRejectsInvalidRelationshipName() {
        assertThrows(InvalidArgumentException.class,
                () -> service.createOrReplaceRelationship("room1", "r1", rel("has part", "dev1"), null));
    }

    @Test
    void testBatchSizeLimits() {
        RelationshipService small = new RelationshipService(store, registry, new TwinContentValidator(), clock, 2);

        assertThrows(InvalidArgumentException.class, () -> small.createOrReplaceRelationships(List.of()));
        assertThrows(InvalidArgumentException.class, () -> small.createOrReplaceRelationships(List.of(
                batchItem("room1", "r1", "contains", "dev1"),
                batchItem("room1", "r2", "contains", "dev1"),
                batchItem("room1", "r3", "contains", "dev1"))));
    }
}
