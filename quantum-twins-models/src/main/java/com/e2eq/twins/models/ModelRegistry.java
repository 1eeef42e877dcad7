package com.e2eq.twins.models;

import com.e2eq.twins.exceptions.ModelAlreadyExistsException;
import com.e2eq.twins.exceptions.ModelNotFoundException;
import com.e2eq.twins.exceptions.ModelParsingException;
import com.e2eq.twins.models.cache.ModelCache;
import com.e2eq.twins.models.dtdl.DtdlContent;
import com.e2eq.twins.models.dtdl.DtdlContentKind;
import com.e2eq.twins.models.dtdl.DtdlInterface;
import com.e2eq.twins.models.dtdl.ModelParser;
import com.e2eq.twins.models.dtdl.ModelResolver;
import com.e2eq.twins.util.JSONUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;

/**
 * Model lifecycle on top of a {@link ModelStore}: parse and store batches, look models up
 * through the cache, answer inheritance questions and delete with referential checks.
 */
public class ModelRegistry {
    private static final Logger LOG = Logger.getLogger(ModelRegistry.class);

    public static final String EXTENDS_EDGE = "_extends";
    public static final String HAS_COMPONENT_EDGE = "_hasComponent";

    private final ModelStore store;
    private final ModelParser parser;
    private final ModelCache cache;
    private final Clock clock;

    public ModelRegistry(ModelStore store, ModelParser parser, Duration cacheExpiration, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.cache = new ModelCache(cacheExpiration, this.clock);
    }

    /**
     * Parses the definitions as one batch, resolving references to stored models, and stores
     * every submitted interface with its flattened bases and its dependency edges.
     *
     * @throws ModelParsingException       when the batch is malformed or references are missing
     * @throws ModelAlreadyExistsException when a submitted id is already stored
     */
    public List<DigitalTwinsModelData> createModels(List<String> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new ModelParsingException("No model definitions supplied");
        }
        List<String> submittedIds = topLevelIds(definitions);
        List<DigitalTwinsModelData> existing = store.findModels(submittedIds);
        if (!existing.isEmpty()) {
            throw new ModelAlreadyExistsException(existing.get(0).getId());
        }

        Map<String, DtdlInterface> parsed = parser.parse(definitions, storeResolver());
        Instant now = clock.instant();
        List<DigitalTwinsModelData> toCreate = new ArrayList<>();
        for (String id : submittedIds) {
            DtdlInterface definition = parsed.get(id);
            toCreate.add(DigitalTwinsModelData.fromDefinition(definition, flattenBases(definition, parsed), now));
        }
        List<DigitalTwinsModelData> created = store.createModels(toCreate);
        LOG.infof("Created %d model(s): %s", created.size(), submittedIds);

        Set<String> stored = new HashSet<>(submittedIds);
        for (String id : submittedIds) {
            DtdlInterface definition = parsed.get(id);
            for (String base : definition.extendsIds()) {
                store.createDependencyEdge(id, base, EXTENDS_EDGE);
            }
            for (DtdlContent component : definition.contentsOfKind(DtdlContentKind.COMPONENT)) {
                String componentId = component.componentInterface().id();
                // inline component schemas live inside their parent and have no vertex
                if (stored.contains(componentId) || isStored(componentId)) {
                    store.createDependencyEdge(id, componentId, HAS_COMPONENT_EDGE);
                }
            }
        }

        Set<String> relationshipNames = new TreeSet<>();
        for (DtdlInterface definition : parsed.values()) {
            definition.contentsOfKind(DtdlContentKind.RELATIONSHIP).forEach(r -> relationshipNames.add(r.name()));
        }
        for (String name : relationshipNames) {
            if (!store.edgeTypeExists(name)) {
                store.createEdgeType(name);
                LOG.debugf("Registered relationship edge type %s", name);
            }
        }
        return created;
    }

    /**
     * @throws ModelNotFoundException when no model has the id
     */
    public DigitalTwinsModelData getModel(String modelId) {
        if (StringUtils.isBlank(modelId)) {
            throw new ModelNotFoundException("Model id is required");
        }
        Optional<DigitalTwinsModelData> cached = cache.models().get(modelId);
        if (cached.isPresent()) {
            LOG.debugf("Model cache hit for %s", modelId);
            return cached.get();
        }
        LOG.debugf("Model cache miss for %s", modelId);
        DigitalTwinsModelData model = store.findModel(modelId)
                .orElseThrow(() -> new ModelNotFoundException("Model with id '" + modelId + "' not found"));
        cache.models().put(modelId, model);
        return model;
    }

    public List<DigitalTwinsModelData> getModels(GetModelsOptions options) {
        GetModelsOptions opts = options != null ? options : GetModelsOptions.all();
        List<DigitalTwinsModelData> models;
        if (opts.getDependenciesFor() == null || opts.getDependenciesFor().isEmpty()) {
            models = store.listModels();
        } else {
            Map<String, DigitalTwinsModelData> byId = new LinkedHashMap<>();
            for (DigitalTwinsModelData m : store.findModels(opts.getDependenciesFor())) {
                byId.put(m.getId(), m);
            }
            Set<String> bases = new LinkedHashSet<>();
            byId.values().forEach(m -> bases.addAll(m.getBases()));
            bases.removeAll(byId.keySet());
            if (!bases.isEmpty()) {
                for (DigitalTwinsModelData m : store.findModels(bases)) {
                    byId.putIfAbsent(m.getId(), m);
                }
            }
            models = new ArrayList<>(byId.values());
        }
        if (opts.isIncludeModelDefinition()) {
            return models;
        }
        return models.stream().map(DigitalTwinsModelData::withoutDefinition).toList();
    }

    /**
     * Parsed interface of a stored model with its references resolved against the store.
     *
     * @throws ModelNotFoundException when no model has the id
     * @throws ModelParsingException  when the model or one of its dependencies cannot be resolved
     */
    public DtdlInterface getInterface(String modelId) {
        return cache.interfaces().get(modelId, id -> {
            DigitalTwinsModelData model = getModel(id);
            String definition = JSONUtils.instance().writeValueAsString(model.getModel());
            DtdlInterface resolved = parser.parse(List.of(definition), storeResolver()).get(id);
            if (resolved == null) {
                throw new ModelParsingException(id + " or one of its dependencies does not exist.");
            }
            return resolved;
        });
    }

    /**
     * Whether a twin of the candidate model satisfies the target model: the ids are equal or,
     * unless exact, the target is among the candidate's bases.
     */
    public boolean isOfModel(String candidateModelId, String targetModelId, boolean exact) {
        if (Objects.equals(candidateModelId, targetModelId)) {
            return true;
        }
        if (exact || candidateModelId == null) {
            return false;
        }
        return getModel(candidateModelId).getBases().contains(targetModelId);
    }

    /**
     * @throws ModelNotFoundException when no model has the id
     * @throws com.e2eq.twins.exceptions.ModelReferencesNotDeletedException when other models
     *         extend it or use it as a component
     */
    public void deleteModel(String modelId) {
        if (!store.deleteModel(modelId)) {
            throw new ModelNotFoundException("Model with id '" + modelId + "' not found");
        }
        cache.invalidateModels();
        LOG.infof("Deleted model %s", modelId);
    }

    public void deleteAllModels() {
        store.deleteAllModels();
        cache.invalidateAll();
        LOG.info("Deleted all models");
    }

    /**
     * Model id of a twin, cached per twin id. The lookup yields empty for an unknown twin,
     * which is not cached.
     */
    public Optional<String> getModelIdForTwin(String twinId, Function<String, Optional<String>> lookup) {
        Optional<String> cached = cache.twinModels().get(twinId);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<String> modelId = lookup.apply(twinId);
        modelId.ifPresent(id -> cache.twinModels().put(twinId, id));
        return modelId;
    }

    public void evictTwin(String twinId) {
        cache.twinModels().invalidate(twinId);
    }

    /**
     * Every interface the root transitively extends, depth first in declaration order and
     * without duplicates.
     */
    public static List<String> flattenBases(DtdlInterface root, Map<String, DtdlInterface> interfaces) {
        List<String> bases = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        pushReversed(stack, root.extendsIds());
        while (!stack.isEmpty()) {
            String id = stack.pop();
            if (!visited.add(id)) {
                continue;
            }
            bases.add(id);
            DtdlInterface base = interfaces.get(id);
            if (base != null) {
                pushReversed(stack, base.extendsIds());
            }
        }
        return bases;
    }

    private static void pushReversed(Deque<String> stack, List<String> ids) {
        ListIterator<String> it = ids.listIterator(ids.size());
        while (it.hasPrevious()) {
            stack.push(it.previous());
        }
    }

    private boolean isStored(String modelId) {
        return store.findModel(modelId).isPresent();
    }

    private ModelResolver storeResolver() {
        return id -> store.findModel(id)
                .filter(m -> m.getModel() != null)
                .map(m -> JSONUtils.instance().writeValueAsString(m.getModel()));
    }

    private static List<String> topLevelIds(List<String> definitions) {
        List<String> ids = new ArrayList<>();
        for (String definition : definitions) {
            JsonNode root;
            try {
                root = JSONUtils.instance().readTree(definition);
            } catch (IllegalArgumentException e) {
                throw new ModelParsingException("Model definition is not valid JSON: " + e.getMessage(), e);
            }
            if (root != null && root.isArray()) {
                root.forEach(n -> ids.add(n.path("@id").asText(null)));
            } else if (root != null) {
                ids.add(root.path("@id").asText(null));
            }
        }
        if (ids.contains(null)) {
            throw new ModelParsingException("Every model definition requires an @id");
        }
        return ids;
    }
}
