package com.e2eq.twins.models;

import com.e2eq.twins.exceptions.ModelAlreadyExistsException;
import com.e2eq.twins.exceptions.ModelNotFoundException;
import com.e2eq.twins.exceptions.ModelParsingException;
import com.e2eq.twins.exceptions.ModelReferencesNotDeletedException;
import com.e2eq.twins.models.dtdl.DtdlContentKind;
import com.e2eq.twins.models.dtdl.DtdlInterface;
import com.e2eq.twins.models.dtdl.DtdlModelParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class ModelRegistryTest {

    static final String C = """
            {"@id":"dtmi:test:C;1","@type":"Interface","@context":"dtmi:dtdl:context;3",
             "displayName":"Thing",
             "contents":[{"@type":"Property","name":"serial","schema":"string"}]}""";
    static final String B = """
            {"@id":"dtmi:test:B;1","@type":"Interface","@context":"dtmi:dtdl:context;3","extends":"dtmi:test:C;1",
             "contents":[{"@type":"Relationship","name":"feeds","target":"dtmi:test:C;1"}]}""";
    static final String A = """
            {"@id":"dtmi:test:A;1","@type":"Interface","@context":"dtmi:dtdl:context;3","extends":"dtmi:test:B;1",
             "description":{"en":"Pump","de":"Pumpe"},
             "contents":[{"@type":"Property","name":"speed","schema":"double"}]}""";

    private MutableClock clock;
    private InMemoryModelStore store;
    private ModelRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = new InMemoryModelStore();
        registry = new ModelRegistry(store, new DtdlModelParser(), Duration.ofSeconds(10), clock);
    }

    @Test
    void testInheritanceClosureIsStoredAsBases() {
        registry.createModels(List.of(C, B, A));

        assertEquals(List.of("dtmi:test:B;1", "dtmi:test:C;1"), registry.getModel("dtmi:test:A;1").getBases());
        assertEquals(List.of("dtmi:test:C;1"), registry.getModel("dtmi:test:B;1").getBases());
        assertTrue(registry.getModel("dtmi:test:C;1").getBases().isEmpty());
    }

    @Test
    void testBasesAreDepthFirstWithoutDuplicates() {
        DtdlInterface d = iface("D");
        DtdlInterface b = iface("B", "D");
        DtdlInterface c = iface("C", "D");
        DtdlInterface a = iface("A", "B", "C");
        Map<String, DtdlInterface> all = Map.of("A", a, "B", b, "C", c, "D", d);

        assertEquals(List.of("B", "D", "C"), ModelRegistry.flattenBases(a, all));
    }

    @Test
    void testCreateModelsRecordsMetadata() {
        List<DigitalTwinsModelData> created = registry.createModels(List.of(C, B, A));

        assertEquals(3, created.size());
        DigitalTwinsModelData c = registry.getModel("dtmi:test:C;1");
        assertEquals(Map.of("en", "Thing"), c.getDisplayName());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), c.getUploadTime());
        assertFalse(c.isDecommissioned());
        assertEquals(Map.of("en", "Pump", "de", "Pumpe"), registry.getModel("dtmi:test:A;1").getDescription());
    }

    @Test
    void testDependencyEdgesAndEdgeTypes() {
        registry.createModels(List.of(C, B, A));

        Set<InMemoryModelStore.Edge> edges = store.edges();
        assertTrue(edges.contains(new InMemoryModelStore.Edge("dtmi:test:A;1", "dtmi:test:B;1", ModelRegistry.EXTENDS_EDGE)));
        assertTrue(edges.contains(new InMemoryModelStore.Edge("dtmi:test:B;1", "dtmi:test:C;1", ModelRegistry.EXTENDS_EDGE)));
        assertTrue(store.edgeTypeExists("feeds"));
    }

    @Test
    void testComponentEdge() {
        String room = """
                {"@id":"dtmi:test:Room;1","@type":"Interface","@context":"dtmi:dtdl:context;3",
                 "contents":[{"@type":"Component","name":"thermostat","schema":"dtmi:test:C;1"}]}""";
        registry.createModels(List.of(C));
        registry.createModels(List.of(room));

        assertTrue(store.edges().contains(new InMemoryModelStore.Edge("dtmi:test:Room;1", "dtmi:test:C;1", ModelRegistry.HAS_COMPONENT_EDGE)));
    }

    @Test
    void testLaterBatchResolvesAgainstStoredModels() {
        registry.createModels(List.of(C));
        registry.createModels(List.of(B));

        assertEquals(List.of("dtmi:test:C;1"), registry.getModel("dtmi:test:B;1").getBases());
        DtdlInterface b = registry.getInterface("dtmi:test:B;1");
        assertTrue(b.content("serial").isPresent());
        assertEquals(DtdlContentKind.RELATIONSHIP, b.content("feeds").get().kind());
    }

    @Test
    void testDuplicateModelRejected() {
        registry.createModels(List.of(C));
        ModelAlreadyExistsException ex = assertThrows(ModelAlreadyExistsException.class, () -> registry.createModels(List.of(C)));
        assertEquals("dtmi:test:C;1", ex.getModelId());
    }

    @Test
    void testUnresolvedReferenceIsParsingFailure() {
        assertThrows(ModelParsingException.class, () -> registry.createModels(List.of(A)));
        assertTrue(store.listModels().isEmpty());
    }

    @Test
    void testIsOfModel() {
        registry.createModels(List.of(C, B, A));

        assertTrue(registry.isOfModel("dtmi:test:A;1", "dtmi:test:A;1", true));
        assertTrue(registry.isOfModel("dtmi:test:A;1", "dtmi:test:C;1", false));
        assertFalse(registry.isOfModel("dtmi:test:A;1", "dtmi:test:C;1", true));
        assertFalse(registry.isOfModel("dtmi:test:C;1", "dtmi:test:A;1", false));
    }

    @Test
    void testGetModelsWithDependencies() {
        registry.createModels(List.of(C, B, A));
        String other = """
                {"@id":"dtmi:test:Other;1","@type":"Interface","@context":"dtmi:dtdl:context;3"}""";
        registry.createModels(List.of(other));

        List<DigitalTwinsModelData> models = registry.getModels(GetModelsOptions.builder().dependencyFor("dtmi:test:B;1").build());
        assertEquals(List.of("dtmi:test:B;1", "dtmi:test:C;1"), models.stream().map(DigitalTwinsModelData::getId).toList());
        assertNull(models.get(0).getModel());

        List<DigitalTwinsModelData> all = registry.getModels(GetModelsOptions.builder().includeModelDefinition(true).build());
        assertEquals(4, all.size());
        assertNotNull(all.get(0).getModel());
    }

    @Test
    void testDeleteReferencedModelFails() {
        registry.createModels(List.of(C, B));

        assertThrows(ModelReferencesNotDeletedException.class, () -> registry.deleteModel("dtmi:test:C;1"));
        registry.deleteModel("dtmi:test:B;1");
        registry.deleteModel("dtmi:test:C;1");
        assertThrows(ModelNotFoundException.class, () -> registry.getModel("dtmi:test:C;1"));
        assertThrows(ModelNotFoundException.class, () -> registry.deleteModel("dtmi:test:C;1"));
    }

    @Test
    void testModelLookupsAreCachedUntilExpiry() {
        AtomicInteger lookups = new AtomicInteger();
        ModelStore store = new CountingModelStore(new InMemoryModelStore(), lookups);
        ModelRegistry cached = new ModelRegistry(store, new DtdlModelParser(), Duration.ofSeconds(10), clock);
        cached.createModels(List.of(C));
        lookups.set(0);

        cached.getModel("dtmi:test:C;1");
        cached.getModel("dtmi:test:C;1");
        assertEquals(1, lookups.get());

        clock.advance(Duration.ofSeconds(11));
        cached.getModel("dtmi:test:C;1");
        assertEquals(2, lookups.get());
    }

    @Test
    void testZeroExpirationDisablesCaching() {
        AtomicInteger lookups = new AtomicInteger();
        ModelRegistry uncached = new ModelRegistry(new CountingModelStore(new InMemoryModelStore(), lookups),
                new DtdlModelParser(), Duration.ZERO, clock);
        uncached.createModels(List.of(C));
        lookups.set(0);

        uncached.getModel("dtmi:test:C;1");
        uncached.getModel("dtmi:test:C;1");
        assertEquals(2, lookups.get());
    }

    @Test
    void testTwinModelCacheEviction() {
        AtomicInteger lookups = new AtomicInteger();
        Function<String, Optional<String>> lookup = id -> {
            lookups.incrementAndGet();
            return Optional.of("dtmi:test:C;1");
        };

        assertEquals("dtmi:test:C;1", registry.getModelIdForTwin("t1", lookup).orElseThrow());
        registry.getModelIdForTwin("t1", lookup);
        assertEquals(1, lookups.get());

        registry.evictTwin("t1");
        registry.getModelIdForTwin("t1", lookup);
        assertEquals(2, lookups.get());
    }

    private static DtdlInterface iface(String id, String... bases) {
        return new DtdlInterface(id, List.of(bases), Map.of(), null, null, null);
    }

    static final class CountingModelStore implements ModelStore {
        private final ModelStore delegate;
        private final AtomicInteger lookups;

        CountingModelStore(ModelStore delegate, AtomicInteger lookups) {
            this.delegate = delegate;
            this.lookups = lookups;
        }

        public List<DigitalTwinsModelData> createModels(List<DigitalTwinsModelData> models) { return delegate.createModels(models); }
        public Optional<DigitalTwinsModelData> findModel(String modelId) {
            lookups.incrementAndGet();
            return delegate.findModel(modelId);
        }
        public List<DigitalTwinsModelData> findModels(Collection<String> modelIds) { return delegate.findModels(modelIds); }
        public List<DigitalTwinsModelData> listModels() { return delegate.listModels(); }
        public void createDependencyEdge(String from, String to, String edgeType) { delegate.createDependencyEdge(from, to, edgeType); }
        public boolean edgeTypeExists(String name) { return delegate.edgeTypeExists(name); }
        public void createEdgeType(String name) { delegate.createEdgeType(name); }
        public boolean deleteModel(String modelId) { return delegate.deleteModel(modelId); }
        public void deleteAllModels() { delegate.deleteAllModels(); }
    }
}
