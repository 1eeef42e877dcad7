package com.e2eq.twins.core;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Per-item outcomes of a relationship batch, in submission order.
 */
@Getter
@ToString
public class BatchRelationshipResult {
    private final List<RelationshipOperationResult> results;
    private final int successCount;
    private final int failureCount;

    public BatchRelationshipResult(List<RelationshipOperationResult> results) {
        this.results = List.copyOf(results);
        this.successCount = (int) results.stream().filter(RelationshipOperationResult::isSuccess).count();
        this.failureCount = this.results.size() - successCount;
    }

    public boolean hasFailures() {
        return failureCount > 0;
    }
}
