package com.e2eq.twins.core;

import com.e2eq.twins.core.patch.JsonPatch;
import com.e2eq.twins.core.patch.PatchOperation;
import com.e2eq.twins.core.store.GraphStore;
import com.e2eq.twins.core.store.WriteCondition;
import com.e2eq.twins.exceptions.DigitalTwinNotFoundException;
import com.e2eq.twins.exceptions.GraphStoreException;
import com.e2eq.twins.exceptions.InvalidArgumentException;
import com.e2eq.twins.exceptions.ModelNotFoundException;
import com.e2eq.twins.exceptions.PreconditionFailedException;
import com.e2eq.twins.exceptions.RelationshipNotFoundException;
import com.e2eq.twins.exceptions.TwinsValidationException;
import com.e2eq.twins.models.ModelRegistry;
import com.e2eq.twins.models.dtdl.DtdlContent;
import com.e2eq.twins.models.dtdl.DtdlContentKind;
import com.e2eq.twins.models.dtdl.DtdlInterface;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Relationships between twins: single reads and writes with preconditions, and the batch
 * upsert that reports one outcome per item.
 */
public class RelationshipService {
    private static final Logger LOG = Logger.getLogger(RelationshipService.class);

    private final GraphStore store;
    private final ModelRegistry registry;
    private final TwinContentValidator validator;
    private final Clock clock;
    private final int maxBatchSize;

    public RelationshipService(GraphStore store, ModelRegistry registry, TwinContentValidator validator, Clock clock, int maxBatchSize) {
        this.store = store;
        this.registry = registry;
        this.validator = validator;
        this.clock = clock;
        this.maxBatchSize = maxBatchSize;
    }

    public ObjectNode getRelationship(String twinId, String relationshipId) {
        DigitalTwinService.requireId(twinId, "Digital twin id");
        DigitalTwinService.requireId(relationshipId, "Relationship id");
        return store.findRelationship(twinId, relationshipId).orElseThrow(() -> notFound(twinId, relationshipId));
    }

    /**
     * Outgoing relationships of the twin, all of them when the name is null.
     */
    public List<ObjectNode> listRelationships(String twinId, String relationshipName) {
        DigitalTwinService.requireId(twinId, "Digital twin id");
        return store.listRelationships(twinId, StringUtils.isBlank(relationshipName) ? null : relationshipName);
    }

    public List<ObjectNode> listIncomingRelationships(String twinId) {
        DigitalTwinService.requireId(twinId, "Digital twin id");
        return store.listIncomingRelationships(twinId);
    }

    /**
     * Creates or replaces the relationship {@code relationshipId} whose source is {@code twinId}.
     * The payload needs {@code $relationshipName} and {@code $targetId}; both twins must exist.
     */
    public ObjectNode createOrReplaceRelationship(String twinId, String relationshipId, JsonNode payload, String ifNoneMatch) {
        DigitalTwinService.requireId(twinId, "Digital twin id");
        DigitalTwinService.requireId(relationshipId, "Relationship id");
        WriteCondition condition = DigitalTwinService.conditionFromIfNoneMatch(ifNoneMatch);
        ObjectNode relationship = DigitalTwinService.requireObject(payload, "Relationship").deepCopy();
        requireMatching(relationship, TwinKeys.RELATIONSHIP_ID, relationshipId);
        requireMatching(relationship, TwinKeys.SOURCE_ID, twinId);
        String targetId = requireText(relationship, TwinKeys.TARGET_ID);
        String name = requireText(relationship, TwinKeys.RELATIONSHIP_NAME);
        if (!TwinKeys.isValidRelationshipName(name)) {
            throw new InvalidArgumentException(invalidName(name));
        }

        if (condition.type() == WriteCondition.Type.IF_ABSENT && store.findRelationship(twinId, relationshipId).isPresent()) {
            throw alreadyExists(twinId, relationshipId);
        }
        ObjectNode source = store.findTwin(twinId).orElseThrow(() -> twinNotFound(twinId));
        ObjectNode target = store.findTwin(targetId).orElseThrow(() -> twinNotFound(targetId));

        List<String> violations = validateAgainstSourceModel(source, target, name, relationship, null);
        if (!violations.isEmpty()) {
            throw new TwinsValidationException(violations);
        }

        relationship.put(TwinKeys.RELATIONSHIP_ID, relationshipId);
        relationship.put(TwinKeys.SOURCE_ID, twinId);
        relationship.put(TwinKeys.ETAG, ETagGenerator.generate(twinId + "-" + relationshipId, clock.instant()));
        ObjectNode stored = store.replaceRelationship(relationship, condition)
                .orElseThrow(() -> alreadyExists(twinId, relationshipId));
        LOG.debugf("Stored relationship %s (%s) %s -> %s", relationshipId, name, twinId, targetId);
        return stored;
    }

    public void updateRelationship(String twinId, String relationshipId, JsonPatch patch, String ifMatch) {
        ObjectNode current = getRelationship(twinId, relationshipId);
        DigitalTwinService.checkIfMatch(current, ifMatch, "relationship '" + relationshipId + "'");
        if (patch == null || patch.isEmpty()) {
            throw new InvalidArgumentException("A patch with at least one operation is required");
        }

        List<String> violations = new ArrayList<>();
        List<PatchOperation> allowed = new ArrayList<>();
        for (PatchOperation operation : patch.getOperations()) {
            if (TwinKeys.RELATIONSHIP_RESERVED.contains(operation.rootKey())) {
                violations.add("Cannot update the " + operation.rootKey() + " property");
            } else {
                allowed.add(operation);
            }
        }
        JsonPatch effective = new JsonPatch(allowed);
        ObjectNode updated = effective.applyTo(current.deepCopy());
        ObjectNode source = store.findTwin(twinId).orElseThrow(() -> twinNotFound(twinId));
        violations.addAll(validateAgainstSourceModel(source, null, current.path(TwinKeys.RELATIONSHIP_NAME).asText(),
                updated, effective.rootKeys()));
        if (!violations.isEmpty()) {
            throw new TwinsValidationException(violations);
        }

        updated.put(TwinKeys.ETAG, ETagGenerator.generate(twinId + "-" + relationshipId, clock.instant()));
        WriteCondition condition = WriteCondition.fromIfMatch(ifMatch);
        if (store.replaceRelationship(updated, condition).isEmpty()) {
            throw condition.type() == WriteCondition.Type.IF_MATCH ? etagMismatch(relationshipId) : notFound(twinId, relationshipId);
        }
        LOG.debugf("Patched relationship %s of digital twin %s", relationshipId, twinId);
    }

    public void deleteRelationship(String twinId, String relationshipId, String ifMatch) {
        DigitalTwinService.requireId(twinId, "Digital twin id");
        DigitalTwinService.requireId(relationshipId, "Relationship id");
        WriteCondition condition = WriteCondition.fromIfMatch(ifMatch);
        if (!store.deleteRelationship(twinId, relationshipId, condition.etag())) {
            if (condition.etag() != null && store.findRelationship(twinId, relationshipId).isPresent()) {
                throw etagMismatch(relationshipId);
            }
            throw notFound(twinId, relationshipId);
        }
        LOG.debugf("Deleted relationship %s of digital twin %s", relationshipId, twinId);
    }

    /**
     * Upserts a batch in three phases: field checks per item, one existence check for every
     * endpoint, then one upsert per relationship name. A failing group does not affect the
     * others.
     *
     * @throws InvalidArgumentException when the batch is empty or larger than the maximum batch size
     */
    public BatchRelationshipResult createOrReplaceRelationships(List<? extends JsonNode> relationships) {
        if (relationships == null || relationships.isEmpty()) {
            throw new InvalidArgumentException("At least one relationship is required");
        }
        if (relationships.size() > maxBatchSize) {
            throw new InvalidArgumentException("Batch size " + relationships.size() + " exceeds the maximum of " + maxBatchSize);
        }
        int n = relationships.size();
        RelationshipOperationResult[] results = new RelationshipOperationResult[n];
        ObjectNode[] items = new ObjectNode[n];

        for (int i = 0; i < n; i++) {
            JsonNode item = relationships.get(i);
            String sourceId = textOrNull(item, TwinKeys.SOURCE_ID);
            String relationshipId = textOrNull(item, TwinKeys.RELATIONSHIP_ID);
            String problem = fieldProblem(item);
            if (problem != null) {
                results[i] = RelationshipOperationResult.failed(sourceId, relationshipId, problem);
            } else {
                items[i] = ((ObjectNode) item).deepCopy();
            }
        }

        Set<String> endpoints = new LinkedHashSet<>();
        for (ObjectNode item : items) {
            if (item != null) {
                endpoints.add(item.get(TwinKeys.SOURCE_ID).asText());
                endpoints.add(item.get(TwinKeys.TARGET_ID).asText());
            }
        }
        Set<String> existing = endpoints.isEmpty() ? Set.of() : store.findExistingTwinIds(endpoints);

        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        Instant now = clock.instant();
        for (int i = 0; i < n; i++) {
            ObjectNode item = items[i];
            if (item == null) continue;
            String sourceId = item.get(TwinKeys.SOURCE_ID).asText();
            String targetId = item.get(TwinKeys.TARGET_ID).asText();
            String relationshipId = item.get(TwinKeys.RELATIONSHIP_ID).asText();
            if (!existing.contains(sourceId)) {
                results[i] = RelationshipOperationResult.failed(sourceId, relationshipId, "Source twin '" + sourceId + "' does not exist");
            } else if (!existing.contains(targetId)) {
                results[i] = RelationshipOperationResult.failed(sourceId, relationshipId, "Target twin '" + targetId + "' does not exist");
            } else {
                item.put(TwinKeys.ETAG, ETagGenerator.generate(sourceId + "-" + relationshipId, now));
                groups.computeIfAbsent(item.get(TwinKeys.RELATIONSHIP_NAME).asText(), k -> new ArrayList<>()).add(i);
            }
        }

        for (Map.Entry<String, List<Integer>> group : groups.entrySet()) {
            List<ObjectNode> batch = new ArrayList<>();
            group.getValue().forEach(i -> batch.add(items[i]));
            String failure = null;
            try {
                store.upsertRelationships(group.getKey(), batch);
            } catch (GraphStoreException e) {
                LOG.warnf(e, "Batch upsert of %d '%s' relationship(s) failed", batch.size(), group.getKey());
                failure = "Database operation failed: " + e.getMessage();
            } catch (RuntimeException e) {
                LOG.warnf(e, "Batch upsert of %d '%s' relationship(s) was rejected", batch.size(), group.getKey());
                failure = e.getMessage();
            }
            for (int i : group.getValue()) {
                String sourceId = items[i].get(TwinKeys.SOURCE_ID).asText();
                String relationshipId = items[i].get(TwinKeys.RELATIONSHIP_ID).asText();
                results[i] = failure == null
                        ? RelationshipOperationResult.succeeded(sourceId, relationshipId)
                        : RelationshipOperationResult.failed(sourceId, relationshipId, failure);
            }
        }

        BatchRelationshipResult result = new BatchRelationshipResult(Arrays.asList(results));
        LOG.debugf("Relationship batch: %d succeeded, %d failed", result.getSuccessCount(), result.getFailureCount());
        return result;
    }

    /**
     * Best-effort check against the source twin's model: only relationships the model declares
     * are checked, for their target model and their declared properties. Target is skipped when
     * null.
     */
    private List<String> validateAgainstSourceModel(ObjectNode source, ObjectNode target, String name,
                                                    ObjectNode relationship, Collection<String> scope) {
        String sourceModel = source.path(TwinKeys.METADATA).path(TwinKeys.MODEL).asText(null);
        if (sourceModel == null) {
            return List.of();
        }
        try {
            DtdlInterface model = registry.getInterface(sourceModel);
            Optional<DtdlContent> declaration = model.content(name).filter(c -> c.kind() == DtdlContentKind.RELATIONSHIP);
            if (declaration.isEmpty()) {
                return List.of();
            }
            List<String> violations = new ArrayList<>();
            String requiredTarget = declaration.get().target();
            if (target != null && requiredTarget != null) {
                String targetModel = target.path(TwinKeys.METADATA).path(TwinKeys.MODEL).asText(null);
                if (!registry.isOfModel(targetModel, requiredTarget, false)) {
                    violations.add("Target twin '" + target.path(TwinKeys.DT_ID).asText() + "' of model '" + targetModel
                            + "' is not a valid target of relationship '" + name + "', which requires '" + requiredTarget + "'");
                }
            }
            violations.addAll(validator.validateRelationship(declaration.get(), relationship, scope));
            return violations;
        } catch (ModelNotFoundException e) {
            throw new TwinsValidationException(e.getMessage(), e);
        }
    }

    private static String fieldProblem(JsonNode item) {
        if (item == null || !item.isObject()) {
            return "Relationship must be a JSON object";
        }
        if (textOrNull(item, TwinKeys.SOURCE_ID) == null) {
            return "Source ID ($sourceId) is required";
        }
        if (textOrNull(item, TwinKeys.TARGET_ID) == null) {
            return "Target ID ($targetId) is required";
        }
        if (textOrNull(item, TwinKeys.RELATIONSHIP_ID) == null) {
            return "Relationship ID ($relationshipId) is required";
        }
        String name = textOrNull(item, TwinKeys.RELATIONSHIP_NAME);
        if (name == null) {
            return "Relationship name ($relationshipName) is required";
        }
        if (!TwinKeys.isValidRelationshipName(name)) {
            return invalidName(name);
        }
        return null;
    }

    private static String invalidName(String name) {
        return "'" + name + "' is not a valid relationship name";
    }

    private static String textOrNull(JsonNode node, String key) {
        if (node == null) return null;
        JsonNode value = node.get(key);
        return value != null && value.isTextual() && !StringUtils.isBlank(value.asText()) ? value.asText() : null;
    }

    private static String requireText(ObjectNode relationship, String key) {
        String value = textOrNull(relationship, key);
        if (value == null) {
            throw new InvalidArgumentException("Relationship payload requires a string " + key);
        }
        return value;
    }

    private static void requireMatching(ObjectNode relationship, String key, String expected) {
        JsonNode value = relationship.get(key);
        if (value != null && !(value.isTextual() && expected.equals(value.asText()))) {
            throw new InvalidArgumentException("The " + key + " '" + value.asText() + "' does not match '" + expected + "'");
        }
    }

    private static RelationshipNotFoundException notFound(String twinId, String relationshipId) {
        return new RelationshipNotFoundException("Relationship with id '" + relationshipId + "' not found on digital twin '" + twinId + "'");
    }

    private static DigitalTwinNotFoundException twinNotFound(String twinId) {
        return new DigitalTwinNotFoundException("Digital twin with id '" + twinId + "' not found");
    }

    private static PreconditionFailedException alreadyExists(String twinId, String relationshipId) {
        return new PreconditionFailedException("Relationship with id '" + relationshipId + "' already exists on digital twin '" + twinId + "'");
    }

    private static PreconditionFailedException etagMismatch(String relationshipId) {
        return new PreconditionFailedException("The etag does not match the current etag of relationship '" + relationshipId + "'");
    }
}
