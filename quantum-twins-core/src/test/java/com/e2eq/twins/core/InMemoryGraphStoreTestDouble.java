package com.e2eq.twins.core;

import com.e2eq.twins.core.store.GraphRow;
import com.e2eq.twins.core.store.GraphStore;
import com.e2eq.twins.core.store.WriteCondition;
import com.e2eq.twins.exceptions.GraphStoreException;
import com.e2eq.twins.exceptions.InvalidArgumentException;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.sql.SQLException;
import java.util.*;

/**
 * A minimal in-memory GraphStore for unit tests. Honours write conditions, records executed
 * query text, notifications and the keys of in-place patches, returns stubbed query rows and can be told to fail or reject
 * the batch upsert of a relationship name.
 */
public class InMemoryGraphStoreTestDouble implements GraphStore {

    private final Map<String, ObjectNode> twins = new LinkedHashMap<>();
    private final Map<String, ObjectNode> relationships = new LinkedHashMap<>();
    private final Set<String> failingRelationshipNames = new HashSet<>();
    private final Set<String> rejectedRelationshipNames = new HashSet<>();
    private final List<String> executedQueries = new ArrayList<>();
    private final List<Boolean> executedReadWrite = new ArrayList<>();
    private final List<String[]> notifications = new ArrayList<>();
    private List<GraphRow> queryRows = new ArrayList<>();
    private int existenceLookups;
    private int twinBatchWrites;
    private boolean failTwinBatches;
    private Set<String> lastPatchedKeys;

    public void failUpsertsOf(String relationshipName) {
        failingRelationshipNames.add(relationshipName);
    }

    /** Makes the batch upsert of this name fail with a caller error instead of a storage error. */
    public void rejectUpsertsOf(String relationshipName) {
        rejectedRelationshipNames.add(relationshipName);
    }

    public void failTwinBatches() {
        failTwinBatches = true;
    }

    public int getTwinBatchWrites() {
        return twinBatchWrites;
    }

    /** Keys written by the most recent in-place twin patch, null before the first one. */
    public Set<String> getLastPatchedKeys() {
        return lastPatchedKeys;
    }

    public void stubQueryRows(List<GraphRow> rows) {
        this.queryRows = new ArrayList<>(rows);
    }

    public List<String> getExecutedQueries() {
        return executedQueries;
    }

    public List<Boolean> getExecutedReadWrite() {
        return executedReadWrite;
    }

    public List<String[]> getNotifications() {
        return notifications;
    }

    public int getExistenceLookups() {
        return existenceLookups;
    }

    public Collection<ObjectNode> relationships() {
        return relationships.values();
    }

    /** Stores a twin as is, bypassing validation. */
    public void putTwin(String twinId, ObjectNode twin) {
        twins.put(twinId, twin.deepCopy());
    }

    private static String key(String sourceId, String relationshipId) {
        return sourceId + "/" + relationshipId;
    }

    @Override
    public synchronized Optional<ObjectNode> findTwin(String twinId) {
        ObjectNode twin = twins.get(twinId);
        return twin == null ? Optional.empty() : Optional.of(twin.deepCopy());
    }

    @Override
    public synchronized Set<String> findExistingTwinIds(Collection<String> twinIds) {
        existenceLookups++;
        Set<String> found = new LinkedHashSet<>();
        for (String id : twinIds) {
            if (twins.containsKey(id)) found.add(id);
        }
        return found;
    }

    @Override
    public synchronized Optional<ObjectNode> replaceTwin(String twinId, ObjectNode twin, WriteCondition condition) {
        ObjectNode current = twins.get(twinId);
        if (!holds(current, condition)) {
            return Optional.empty();
        }
        twins.put(twinId, twin.deepCopy());
        return Optional.of(twin.deepCopy());
    }

    @Override
    public synchronized Optional<ObjectNode> patchTwin(String twinId, ObjectNode twin, Set<String> keys, WriteCondition condition) {
        ObjectNode current = twins.get(twinId);
        if (current == null || !holds(current, condition)) {
            return Optional.empty();
        }
        lastPatchedKeys = new LinkedHashSet<>(keys);
        for (String key : keys) {
            if (twin.has(key)) {
                current.set(key, twin.get(key).deepCopy());
            } else {
                current.remove(key);
            }
        }
        return Optional.of(current.deepCopy());
    }

    @Override
    public synchronized int upsertTwins(List<ObjectNode> batch) {
        twinBatchWrites++;
        if (failTwinBatches) {
            throw new GraphStoreException("relation \"Twin\" is locked", new SQLException("lock timeout"));
        }
        for (ObjectNode twin : batch) {
            twins.put(twin.path(TwinKeys.DT_ID).asText(), twin.deepCopy());
        }
        return batch.size();
    }

    @Override
    public synchronized boolean deleteTwin(String twinId, String etag) {
        ObjectNode current = twins.get(twinId);
        if (current == null || (etag != null && !etag.equals(current.path(TwinKeys.ETAG).asText(null)))) {
            return false;
        }
        twins.remove(twinId);
        relationships.values().removeIf(r -> twinId.equals(r.path(TwinKeys.SOURCE_ID).asText())
                || twinId.equals(r.path(TwinKeys.TARGET_ID).asText()));
        return true;
    }

    @Override
    public synchronized Optional<ObjectNode> findRelationship(String sourceId, String relationshipId) {
        ObjectNode rel = relationships.get(key(sourceId, relationshipId));
        return rel == null ? Optional.empty() : Optional.of(rel.deepCopy());
    }

    @Override
    public synchronized List<ObjectNode> listRelationships(String sourceId, String relationshipName) {
        List<ObjectNode> out = new ArrayList<>();
        for (ObjectNode r : relationships.values()) {
            if (sourceId.equals(r.path(TwinKeys.SOURCE_ID).asText())
                    && (relationshipName == null || relationshipName.equals(r.path(TwinKeys.RELATIONSHIP_NAME).asText()))) {
                out.add(r.deepCopy());
            }
        }
        return out;
    }

    @Override
    public synchronized List<ObjectNode> listIncomingRelationships(String targetId) {
        List<ObjectNode> out = new ArrayList<>();
        for (ObjectNode r : relationships.values()) {
            if (targetId.equals(r.path(TwinKeys.TARGET_ID).asText())) out.add(r.deepCopy());
        }
        return out;
    }

    @Override
    public synchronized Optional<ObjectNode> replaceRelationship(ObjectNode relationship, WriteCondition condition) {
        String sourceId = relationship.path(TwinKeys.SOURCE_ID).asText();
        String targetId = relationship.path(TwinKeys.TARGET_ID).asText();
        if (!twins.containsKey(sourceId) || !twins.containsKey(targetId)) {
            return Optional.empty();
        }
        String k = key(sourceId, relationship.path(TwinKeys.RELATIONSHIP_ID).asText());
        if (!holds(relationships.get(k), condition)) {
            return Optional.empty();
        }
        relationships.put(k, relationship.deepCopy());
        return Optional.of(relationship.deepCopy());
    }

    @Override
    public synchronized int upsertRelationships(String relationshipName, List<ObjectNode> batch) {
        if (failingRelationshipNames.contains(relationshipName)) {
            throw new GraphStoreException("label " + relationshipName + " is locked", new SQLException("lock timeout"));
        }
        if (rejectedRelationshipNames.contains(relationshipName)) {
            throw new InvalidArgumentException("'" + relationshipName + "' cannot be used as an edge label");
        }
        for (ObjectNode r : batch) {
            relationships.put(key(r.path(TwinKeys.SOURCE_ID).asText(), r.path(TwinKeys.RELATIONSHIP_ID).asText()), r.deepCopy());
        }
        return batch.size();
    }

    @Override
    public synchronized boolean deleteRelationship(String sourceId, String relationshipId, String etag) {
        String k = key(sourceId, relationshipId);
        ObjectNode current = relationships.get(k);
        if (current == null || (etag != null && !etag.equals(current.path(TwinKeys.ETAG).asText(null)))) {
            return false;
        }
        relationships.remove(k);
        return true;
    }

    @Override
    public synchronized List<GraphRow> executeQuery(String cypher, boolean readWrite) {
        executedQueries.add(cypher);
        executedReadWrite.add(readWrite);
        return new ArrayList<>(queryRows);
    }

    @Override
    public synchronized void notify(String channel, String payload) {
        notifications.add(new String[]{channel, payload});
    }

    private static boolean holds(ObjectNode current, WriteCondition condition) {
        switch (condition.type()) {
            case IF_ABSENT:
                return current == null;
            case IF_MATCH:
                return current != null && condition.etag().equals(current.path(TwinKeys.ETAG).asText(null));
            default:
                return true;
        }
    }
}
