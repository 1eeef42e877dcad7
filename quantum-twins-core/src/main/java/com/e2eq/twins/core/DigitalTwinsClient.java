package com.e2eq.twins.core;

import com.e2eq.twins.core.age.AgeConnector;
import com.e2eq.twins.core.age.AgeGraphStore;
import com.e2eq.twins.core.age.AgeModelStore;
import com.e2eq.twins.core.config.TwinsClientOptions;
import com.e2eq.twins.core.patch.JsonPatch;
import com.e2eq.twins.core.query.QueryPage;
import com.e2eq.twins.core.query.TwinQueryService;
import com.e2eq.twins.core.store.GraphStore;
import com.e2eq.twins.models.DigitalTwinsModelData;
import com.e2eq.twins.models.GetModelsOptions;
import com.e2eq.twins.models.ModelRegistry;
import com.e2eq.twins.models.ModelStore;
import com.e2eq.twins.models.dtdl.DtdlModelParser;
import com.e2eq.twins.query.TwinQueryCompiler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.util.List;

/**
 * Entry point for twins, relationships, components, models, queries and telemetry on one graph.
 */
public class DigitalTwinsClient {
    private final TwinsClientOptions options;
    private final ModelRegistry models;
    private final DigitalTwinService twins;
    private final RelationshipService relationships;
    private final ComponentService components;
    private final TwinQueryService queries;
    private final TelemetryPublisher telemetry;

    public DigitalTwinsClient(GraphStore graphStore, ModelStore modelStore, TwinsClientOptions options) {
        this(graphStore, modelStore, options, Clock.systemUTC());
    }

    public DigitalTwinsClient(GraphStore graphStore, ModelStore modelStore, TwinsClientOptions options, Clock clock) {
        this.options = options;
        this.models = new ModelRegistry(modelStore, new DtdlModelParser(), options.getModelCacheExpiration(), clock);
        TwinContentValidator validator = new TwinContentValidator();
        this.twins = new DigitalTwinService(graphStore, models, validator, clock, options.getMaxBatchSize());
        this.relationships = new RelationshipService(graphStore, models, validator, clock, options.getMaxBatchSize());
        this.components = new ComponentService(graphStore, models, validator, clock);
        this.queries = new TwinQueryService(graphStore, new TwinQueryCompiler(), options.getGraphName(),
                options.getDefaultPageSize());
        this.telemetry = new TelemetryPublisher(graphStore, models, clock);
    }

    public static DigitalTwinsClient forAge(AgeConnector connector, TwinsClientOptions options) {
        return new DigitalTwinsClient(new AgeGraphStore(connector), new AgeModelStore(connector), options);
    }

    public TwinsClientOptions getOptions() {
        return options;
    }

    // twins

    public ObjectNode getDigitalTwin(String twinId) {
        return twins.getDigitalTwin(twinId);
    }

    public boolean digitalTwinExists(String twinId) {
        return twins.digitalTwinExists(twinId);
    }

    public ObjectNode createOrReplaceDigitalTwin(String twinId, JsonNode twin, String ifNoneMatch) {
        return twins.createOrReplaceDigitalTwin(twinId, twin, ifNoneMatch);
    }

    public ObjectNode createOrReplaceDigitalTwin(String twinId, JsonNode twin) {
        return twins.createOrReplaceDigitalTwin(twinId, twin, null);
    }

    public BatchDigitalTwinResult createOrReplaceDigitalTwins(List<? extends JsonNode> twins) {
        return this.twins.createOrReplaceDigitalTwins(twins);
    }

    public void updateDigitalTwin(String twinId, JsonPatch patch, String ifMatch) {
        twins.updateDigitalTwin(twinId, patch, ifMatch);
    }

    public void deleteDigitalTwin(String twinId, String ifMatch) {
        twins.deleteDigitalTwin(twinId, ifMatch);
    }

    // components

    public ObjectNode getComponent(String twinId, String componentName) {
        return components.getComponent(twinId, componentName);
    }

    public void updateComponent(String twinId, String componentName, JsonPatch patch, String ifMatch) {
        components.updateComponent(twinId, componentName, patch, ifMatch);
    }

    // relationships

    public ObjectNode getRelationship(String twinId, String relationshipId) {
        return relationships.getRelationship(twinId, relationshipId);
    }

    public List<ObjectNode> listRelationships(String twinId, String relationshipName) {
        return relationships.listRelationships(twinId, relationshipName);
    }

    public List<ObjectNode> listIncomingRelationships(String twinId) {
        return relationships.listIncomingRelationships(twinId);
    }

    public ObjectNode createOrReplaceRelationship(String twinId, String relationshipId, JsonNode relationship, String ifNoneMatch) {
        return relationships.createOrReplaceRelationship(twinId, relationshipId, relationship, ifNoneMatch);
    }

    public void updateRelationship(String twinId, String relationshipId, JsonPatch patch, String ifMatch) {
        relationships.updateRelationship(twinId, relationshipId, patch, ifMatch);
    }

    public void deleteRelationship(String twinId, String relationshipId, String ifMatch) {
        relationships.deleteRelationship(twinId, relationshipId, ifMatch);
    }

    public BatchRelationshipResult createOrReplaceRelationships(List<? extends JsonNode> batch) {
        return relationships.createOrReplaceRelationships(batch);
    }

    // models

    public List<DigitalTwinsModelData> createModels(List<String> definitions) {
        return models.createModels(definitions);
    }

    public DigitalTwinsModelData getModel(String modelId) {
        return models.getModel(modelId);
    }

    public List<DigitalTwinsModelData> getModels(GetModelsOptions getModelsOptions) {
        return models.getModels(getModelsOptions);
    }

    public void deleteModel(String modelId) {
        models.deleteModel(modelId);
    }

    public void deleteAllModels() {
        models.deleteAllModels();
    }

    // query

    public QueryPage query(String query, String continuationToken, Integer maxItemsPerPage) {
        return queries.query(query, continuationToken, maxItemsPerPage);
    }

    public QueryPage query(String query) {
        return queries.query(query, null, null);
    }

    // telemetry

    public ObjectNode publishTelemetry(String twinId, JsonNode payload, String messageId) {
        return telemetry.publishTelemetry(twinId, payload, messageId);
    }

    public ObjectNode publishComponentTelemetry(String twinId, String componentName, JsonNode payload, String messageId) {
        return telemetry.publishComponentTelemetry(twinId, componentName, payload, messageId);
    }
}
