package com.e2eq.twins.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one item of a relationship batch.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipOperationResult {
    private String sourceId;
    private String relationshipId;
    private boolean success;
    private String errorMessage;

    public static RelationshipOperationResult succeeded(String sourceId, String relationshipId) {
        return new RelationshipOperationResult(sourceId, relationshipId, true, null);
    }

    public static RelationshipOperationResult failed(String sourceId, String relationshipId, String errorMessage) {
        return new RelationshipOperationResult(sourceId, relationshipId, false, errorMessage);
    }
}
