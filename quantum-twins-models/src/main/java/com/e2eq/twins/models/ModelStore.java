package com.e2eq.twins.models;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Abstraction over the persistence of model vertices and the dependency edges between them.
 */
public interface ModelStore {

    /**
     * Stores the models atomically.
     *
     * @throws com.e2eq.twins.exceptions.ModelAlreadyExistsException when any id is already stored
     */
    List<DigitalTwinsModelData> createModels(List<DigitalTwinsModelData> models);

    Optional<DigitalTwinsModelData> findModel(String modelId);

    /** Models with the given ids in storage order; missing ids are skipped. */
    List<DigitalTwinsModelData> findModels(Collection<String> modelIds);

    List<DigitalTwinsModelData> listModels();

    /** Edge from the dependent model to the model it depends on; a no-op when either is missing. */
    void createDependencyEdge(String fromModelId, String toModelId, String edgeType);

    boolean edgeTypeExists(String name);

    void createEdgeType(String name);

    /**
     * @return false when no such model is stored
     * @throws com.e2eq.twins.exceptions.ModelReferencesNotDeletedException when another model
     *         still points at it
     */
    boolean deleteModel(String modelId);

    void deleteAllModels();
}
