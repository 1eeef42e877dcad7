package com.e2eq.twins.exceptions;

/**
 * A model cannot be deleted while other models extend it or embed it as a component.
 */
public class ModelReferencesNotDeletedException extends ReferentialIntegrityViolationException {
    public ModelReferencesNotDeletedException(String modelId, Throwable cause) {
        super("Model '" + modelId + "' is referenced by other models and cannot be deleted", cause);
        this.referringClass = "Model";
        this.referringId = modelId;
    }
}
