package com.e2eq.twins.models;

import com.e2eq.twins.exceptions.ModelAlreadyExistsException;
import com.e2eq.twins.exceptions.ModelReferencesNotDeletedException;

import java.util.*;

/**
 * Model store kept in process memory, for embedding and tests. Models are copied on the way in
 * and out so callers never share instances with the store.
 */
public final class InMemoryModelStore implements ModelStore {
    private final Map<String, DigitalTwinsModelData> models = new LinkedHashMap<>();
    private final Set<Edge> edges = new LinkedHashSet<>();
    private final Set<String> edgeTypes = new HashSet<>();

    record Edge(String from, String to, String type) {}

    @Override
    public synchronized List<DigitalTwinsModelData> createModels(List<DigitalTwinsModelData> toCreate) {
        Set<String> ids = new HashSet<>();
        for (DigitalTwinsModelData m : toCreate) {
            if (models.containsKey(m.getId()) || !ids.add(m.getId())) {
                throw new ModelAlreadyExistsException(m.getId());
            }
        }
        List<DigitalTwinsModelData> created = new ArrayList<>();
        for (DigitalTwinsModelData m : toCreate) {
            models.put(m.getId(), copy(m));
            created.add(copy(m));
        }
        return created;
    }

    @Override
    public synchronized Optional<DigitalTwinsModelData> findModel(String modelId) {
        return Optional.ofNullable(models.get(modelId)).map(InMemoryModelStore::copy);
    }

    @Override
    public synchronized List<DigitalTwinsModelData> findModels(Collection<String> modelIds) {
        List<DigitalTwinsModelData> found = new ArrayList<>();
        for (DigitalTwinsModelData m : models.values()) {
            if (modelIds.contains(m.getId())) found.add(copy(m));
        }
        return found;
    }

    @Override
    public synchronized List<DigitalTwinsModelData> listModels() {
        return models.values().stream().map(InMemoryModelStore::copy).toList();
    }

    @Override
    public synchronized void createDependencyEdge(String fromModelId, String toModelId, String edgeType) {
        if (models.containsKey(fromModelId) && models.containsKey(toModelId)) {
            edges.add(new Edge(fromModelId, toModelId, edgeType));
        }
    }

    @Override
    public synchronized boolean edgeTypeExists(String name) {
        return edgeTypes.contains(name);
    }

    @Override
    public synchronized void createEdgeType(String name) {
        edgeTypes.add(name);
    }

    @Override
    public synchronized boolean deleteModel(String modelId) {
        if (!models.containsKey(modelId)) {
            return false;
        }
        for (Edge e : edges) {
            if (e.to().equals(modelId)) {
                throw new ModelReferencesNotDeletedException(modelId, null);
            }
        }
        edges.removeIf(e -> e.from().equals(modelId));
        models.remove(modelId);
        return true;
    }

    @Override
    public synchronized void deleteAllModels() {
        edges.clear();
        models.clear();
    }

    synchronized Set<Edge> edges() {
        return Set.copyOf(edges);
    }

    private static DigitalTwinsModelData copy(DigitalTwinsModelData m) {
        return DigitalTwinsModelData.fromProperties(m.toProperties());
    }
}
