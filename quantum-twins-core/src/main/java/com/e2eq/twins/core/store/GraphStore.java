package com.e2eq.twins.core.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Abstraction over the graph database holding twins and relationships. Implementations report
 * engine failures as {@link com.e2eq.twins.exceptions.GraphStoreException}.
 */
public interface GraphStore {

    Optional<ObjectNode> findTwin(String twinId);

    /** The subset of the given ids that exist, answered with a single lookup. */
    Set<String> findExistingTwinIds(Collection<String> twinIds);

    /**
     * Upserts the twin by {@code $dtId} and overwrites all of its properties.
     *
     * @return the stored twin, empty when the condition did not hold
     */
    Optional<ObjectNode> replaceTwin(String twinId, ObjectNode twin, WriteCondition condition);

    /**
     * Sets the listed top-level properties of an existing twin to their values in {@code twin}
     * and removes those {@code twin} does not carry. Unlisted properties keep their stored value.
     *
     * @return the stored twin, empty when no twin matched the condition
     */
    Optional<ObjectNode> patchTwin(String twinId, ObjectNode twin, Set<String> keys, WriteCondition condition);

    /**
     * Upserts several twins, each keyed by its {@code $dtId}, in a single statement.
     *
     * @return number of twins written
     */
    int upsertTwins(List<ObjectNode> twins);

    /**
     * Deletes the twin together with all of its relationships.
     *
     * @param etag when non-null the twin is only deleted if it carries this etag
     * @return false when no twin matched
     */
    boolean deleteTwin(String twinId, String etag);

    Optional<ObjectNode> findRelationship(String sourceId, String relationshipId);

    /** Outgoing relationships of the twin, restricted to one name when it is non-null. */
    List<ObjectNode> listRelationships(String sourceId, String relationshipName);

    List<ObjectNode> listIncomingRelationships(String targetId);

    /**
     * Upserts the relationship, keyed by {@code $sourceId} and {@code $relationshipId}, as an
     * edge of type {@code $relationshipName}. Both endpoint twins must exist.
     *
     * @return the stored relationship, empty when the condition did not hold
     */
    Optional<ObjectNode> replaceRelationship(ObjectNode relationship, WriteCondition condition);

    /**
     * Upserts relationships sharing one name in a single statement.
     *
     * @return number of relationships written
     */
    int upsertRelationships(String relationshipName, List<ObjectNode> relationships);

    boolean deleteRelationship(String sourceId, String relationshipId, String etag);

    /**
     * Runs native graph query text.
     *
     * @param readWrite route to a read-write connection instead of a read-preferring one
     */
    List<GraphRow> executeQuery(String cypher, boolean readWrite);

    /** Sends the payload on a notification channel. */
    void notify(String channel, String payload);
}
