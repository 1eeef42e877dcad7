package com.e2eq.twins.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one twin of a batch.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DigitalTwinOperationResult {
    private String digitalTwinId;
    private boolean success;
    private String errorMessage;

    public static DigitalTwinOperationResult succeeded(String digitalTwinId) {
        return new DigitalTwinOperationResult(digitalTwinId, true, null);
    }

    public static DigitalTwinOperationResult failed(String digitalTwinId, String errorMessage) {
        return new DigitalTwinOperationResult(digitalTwinId, false, errorMessage);
    }
}
