package com.e2eq.twins.exceptions;

public class ModelAlreadyExistsException extends TwinsException {
   private final String modelId;

   public ModelAlreadyExistsException(String modelId) {
      super(ErrorKind.ALREADY_EXISTS, "Model with id '" + modelId + "' already exists");
      this.modelId = modelId;
   }

   public String getModelId() {
      return modelId;
   }
}
