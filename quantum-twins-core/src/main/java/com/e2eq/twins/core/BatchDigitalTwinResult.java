package com.e2eq.twins.core;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Per-twin outcomes of a twin batch, in submission order.
 */
@Getter
@ToString
public class BatchDigitalTwinResult {
    private final List<DigitalTwinOperationResult> results;
    private final int successCount;
    private final int failureCount;

    public BatchDigitalTwinResult(List<DigitalTwinOperationResult> results) {
        this.results = List.copyOf(results);
        this.successCount = (int) results.stream().filter(DigitalTwinOperationResult::isSuccess).count();
        this.failureCount = this.results.size() - successCount;
    }

    public boolean hasFailures() {
        return failureCount > 0;
    }
}
