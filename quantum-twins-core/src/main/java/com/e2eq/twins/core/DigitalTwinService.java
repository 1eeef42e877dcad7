package com.e2eq.twins.core;

import com.e2eq.twins.core.config.TwinsClientOptions;
import com.e2eq.twins.core.patch.JsonPatch;
import com.e2eq.twins.core.patch.PatchOperation;
import com.e2eq.twins.core.store.GraphStore;
import com.e2eq.twins.core.store.WriteCondition;
import com.e2eq.twins.exceptions.DigitalTwinNotFoundException;
import com.e2eq.twins.exceptions.GraphStoreException;
import com.e2eq.twins.exceptions.InvalidArgumentException;
import com.e2eq.twins.exceptions.ModelNotFoundException;
import com.e2eq.twins.exceptions.PreconditionFailedException;
import com.e2eq.twins.exceptions.TwinsException;
import com.e2eq.twins.exceptions.TwinsValidationException;
import com.e2eq.twins.models.ModelRegistry;
import com.e2eq.twins.models.dtdl.DtdlInterface;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read, create-or-replace, patch and delete of twins with model validation and etag
 * preconditions.
 */
public class DigitalTwinService {
    private static final Logger LOG = Logger.getLogger(DigitalTwinService.class);

    private final GraphStore store;
    private final ModelRegistry registry;
    private final TwinContentValidator validator;
    private final Clock clock;
    private final int maxBatchSize;

    public DigitalTwinService(GraphStore store, ModelRegistry registry, TwinContentValidator validator, Clock clock) {
        this(store, registry, validator, clock, TwinsClientOptions.DEFAULT_MAX_BATCH_SIZE);
    }

    public DigitalTwinService(GraphStore store, ModelRegistry registry, TwinContentValidator validator, Clock clock, int maxBatchSize) {
        this.store = store;
        this.registry = registry;
        this.validator = validator;
        this.clock = clock;
        this.maxBatchSize = maxBatchSize;
    }

    /**
     * @throws DigitalTwinNotFoundException when no twin has the id
     */
    public ObjectNode getDigitalTwin(String twinId) {
        requireId(twinId, "Digital twin id");
        return store.findTwin(twinId).orElseThrow(() -> notFound(twinId));
    }

    public boolean digitalTwinExists(String twinId) {
        requireId(twinId, "Digital twin id");
        return store.findExistingTwinIds(List.of(twinId)).contains(twinId);
    }

    /**
     * Validates the payload against its model and upserts it.
     *
     * @param ifNoneMatch {@code null} or {@code *}; the latter fails when the twin already exists
     * @return the stored twin with its new etag and metadata
     */
    public ObjectNode createOrReplaceDigitalTwin(String twinId, JsonNode payload, String ifNoneMatch) {
        requireId(twinId, "Digital twin id");
        WriteCondition condition = conditionFromIfNoneMatch(ifNoneMatch);
        ObjectNode twin = requireObject(payload, "Digital twin").deepCopy();
        String modelId = modelIdOf(twin);
        JsonNode dtId = twin.get(TwinKeys.DT_ID);
        if (dtId != null && !(dtId.isTextual() && twinId.equals(dtId.asText()))) {
            throw new InvalidArgumentException("The $dtId '" + dtId.asText() + "' does not match the digital twin id '" + twinId + "'");
        }
        if (condition.type() == WriteCondition.Type.IF_ABSENT && digitalTwinExists(twinId)) {
            throw alreadyExists(twinId);
        }

        DtdlInterface model = resolveModelForWrite(registry, modelId);
        Instant now = clock.instant();
        twin.put(TwinKeys.DT_ID, twinId);
        List<String> violations = validator.validateTwin(model, twin, null, now.toString());
        if (!violations.isEmpty()) {
            throw new TwinsValidationException(violations);
        }
        stampTwin(twin, twinId, now);

        ObjectNode stored = store.replaceTwin(twinId, twin, condition).orElseThrow(() -> alreadyExists(twinId));
        registry.evictTwin(twinId);
        LOG.debugf("Stored digital twin %s of model %s", twinId, modelId);
        return stored;
    }

    /**
     * Validates every twin of the batch on its own and upserts the valid ones with a single
     * store write. Invalid twins are reported in the result and do not stop the others; a
     * failed write fails every twin it carried.
     *
     * @param twins twin payloads, each carrying its own {@code $dtId}
     * @throws InvalidArgumentException when the batch is larger than the maximum batch size
     */
    public BatchDigitalTwinResult createOrReplaceDigitalTwins(List<? extends JsonNode> twins) {
        if (twins == null || twins.isEmpty()) {
            return new BatchDigitalTwinResult(List.of());
        }
        if (twins.size() > maxBatchSize) {
            throw new InvalidArgumentException("Batch size " + twins.size() + " exceeds the maximum of " + maxBatchSize);
        }
        int n = twins.size();
        DigitalTwinOperationResult[] results = new DigitalTwinOperationResult[n];
        List<Integer> accepted = new ArrayList<>();
        List<ObjectNode> batch = new ArrayList<>();
        Instant now = clock.instant();

        for (int i = 0; i < n; i++) {
            JsonNode item = twins.get(i);
            JsonNode dtId = item == null ? null : item.get(TwinKeys.DT_ID);
            String twinId = dtId != null && dtId.isTextual() ? dtId.asText() : null;
            try {
                requireId(twinId, "Digital twin $dtId");
                ObjectNode twin = requireObject(item, "Digital twin").deepCopy();
                DtdlInterface model = resolveModelForWrite(registry, modelIdOf(twin));
                List<String> violations = validator.validateTwin(model, twin, null, now.toString());
                if (!violations.isEmpty()) {
                    throw new TwinsValidationException(violations);
                }
                stampTwin(twin, twinId, now);
                accepted.add(i);
                batch.add(twin);
            } catch (TwinsException | TwinsValidationException e) {
                results[i] = DigitalTwinOperationResult.failed(twinId, e.getMessage());
            }
        }

        if (!batch.isEmpty()) {
            String failure = null;
            try {
                store.upsertTwins(batch);
            } catch (GraphStoreException e) {
                LOG.warnf(e, "Batch upsert of %d digital twin(s) failed", batch.size());
                failure = "Database operation failed: " + e.getMessage();
            } catch (RuntimeException e) {
                LOG.warnf(e, "Batch upsert of %d digital twin(s) was rejected", batch.size());
                failure = e.getMessage();
            }
            for (int j = 0; j < accepted.size(); j++) {
                String twinId = batch.get(j).get(TwinKeys.DT_ID).asText();
                if (failure == null) {
                    registry.evictTwin(twinId);
                    results[accepted.get(j)] = DigitalTwinOperationResult.succeeded(twinId);
                } else {
                    results[accepted.get(j)] = DigitalTwinOperationResult.failed(twinId, failure);
                }
            }
        }

        BatchDigitalTwinResult result = new BatchDigitalTwinResult(Arrays.asList(results));
        LOG.debugf("Digital twin batch: %d succeeded, %d failed", result.getSuccessCount(), result.getFailureCount());
        return result;
    }

    /**
     * Applies the patch to the stored twin and re-validates only the properties it touches.
     *
     * @param ifMatch {@code null}, {@code *} or the etag the stored twin must carry
     */
    public void updateDigitalTwin(String twinId, JsonPatch patch, String ifMatch) {
        ObjectNode current = getDigitalTwin(twinId);
        checkIfMatch(current, ifMatch, "digital twin '" + twinId + "'");
        if (patch == null || patch.isEmpty()) {
            throw new InvalidArgumentException("A patch with at least one operation is required");
        }

        List<String> violations = new ArrayList<>();
        List<PatchOperation> allowed = new ArrayList<>();
        for (PatchOperation operation : patch.getOperations()) {
            if (TwinKeys.TWIN_IMMUTABLE.contains(operation.rootKey())) {
                violations.add("Cannot update the " + operation.rootKey() + " property");
            } else {
                allowed.add(operation);
            }
        }
        JsonPatch effective = new JsonPatch(allowed);
        ObjectNode updated = effective.applyTo(current.deepCopy());

        String modelId = modelIdOf(updated);
        DtdlInterface model = resolveModelForWrite(registry, modelId);
        // a model change invalidates every property, not just the patched ones
        Set<String> scope = modelId.equals(modelIdOf(current)) ? effective.rootKeys() : null;
        Instant now = clock.instant();
        violations.addAll(validator.validateTwin(model, updated, scope, now.toString()));
        if (!violations.isEmpty()) {
            throw new TwinsValidationException(violations);
        }
        stampTwin(updated, twinId, now);

        WriteCondition condition = WriteCondition.fromIfMatch(ifMatch);
        Optional<ObjectNode> stored;
        if (scope == null) {
            stored = store.replaceTwin(twinId, updated, condition);
        } else {
            Set<String> keys = new LinkedHashSet<>(scope);
            keys.add(TwinKeys.METADATA);
            keys.add(TwinKeys.ETAG);
            stored = store.patchTwin(twinId, updated, keys, condition);
        }
        if (stored.isEmpty()) {
            throw condition.type() == WriteCondition.Type.IF_MATCH ? etagMismatch(twinId) : notFound(twinId);
        }
        registry.evictTwin(twinId);
        LOG.debugf("Patched digital twin %s (%d operation(s))", twinId, patch.getOperations().size());
    }

    /**
     * Deletes the twin and its relationships.
     */
    public void deleteDigitalTwin(String twinId, String ifMatch) {
        requireId(twinId, "Digital twin id");
        WriteCondition condition = WriteCondition.fromIfMatch(ifMatch);
        if (!store.deleteTwin(twinId, condition.etag())) {
            if (condition.etag() != null && digitalTwinExists(twinId)) {
                throw etagMismatch(twinId);
            }
            throw notFound(twinId);
        }
        registry.evictTwin(twinId);
        LOG.debugf("Deleted digital twin %s", twinId);
    }

    void stampTwin(ObjectNode twin, String twinId, Instant now) {
        TwinContentValidator.metadataOf(twin).put(TwinKeys.LAST_UPDATE_TIME, now.toString());
        twin.put(TwinKeys.ETAG, ETagGenerator.generate(twinId, now));
    }

    /**
     * Resolves a twin's model for a write; an unknown model is a problem of the payload.
     */
    static DtdlInterface resolveModelForWrite(ModelRegistry registry, String modelId) {
        try {
            return registry.getInterface(modelId);
        } catch (ModelNotFoundException e) {
            throw new TwinsValidationException(e.getMessage(), e);
        }
    }

    static String modelIdOf(ObjectNode twin) {
        JsonNode model = twin.path(TwinKeys.METADATA).get(TwinKeys.MODEL);
        if (model == null || !model.isTextual() || StringUtils.isBlank(model.asText())) {
            throw new InvalidArgumentException("A digital twin requires a $metadata object with a string $model");
        }
        return model.asText();
    }

    static void checkIfMatch(ObjectNode entity, String ifMatch, String entityDescription) {
        if (ifMatch != null && !"*".equals(ifMatch) && !ifMatch.equals(entity.path(TwinKeys.ETAG).asText(null))) {
            throw new PreconditionFailedException("The etag " + ifMatch + " does not match the current etag of " + entityDescription);
        }
    }

    static WriteCondition conditionFromIfNoneMatch(String ifNoneMatch) {
        if (ifNoneMatch == null) {
            return WriteCondition.none();
        }
        if (!"*".equals(ifNoneMatch)) {
            throw new InvalidArgumentException("If-None-Match only supports '*'");
        }
        return WriteCondition.ifAbsent();
    }

    static ObjectNode requireObject(JsonNode payload, String what) {
        if (payload == null || !payload.isObject()) {
            throw new InvalidArgumentException(what + " payload must be a JSON object");
        }
        return (ObjectNode) payload;
    }

    static void requireId(String id, String what) {
        if (StringUtils.isBlank(id)) {
            throw new InvalidArgumentException(what + " is required");
        }
    }

    private static DigitalTwinNotFoundException notFound(String twinId) {
        return new DigitalTwinNotFoundException("Digital twin with id '" + twinId + "' not found");
    }

    private static PreconditionFailedException alreadyExists(String twinId) {
        return new PreconditionFailedException("Digital twin with id '" + twinId + "' already exists");
    }

    private static PreconditionFailedException etagMismatch(String twinId) {
        return new PreconditionFailedException("The etag does not match the current etag of digital twin '" + twinId + "'");
    }
}
