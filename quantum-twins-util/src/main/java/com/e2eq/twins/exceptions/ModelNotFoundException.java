package com.e2eq.twins.exceptions;

public class ModelNotFoundException extends NotFoundException {
   public ModelNotFoundException(String message) {
      super(message);
   }
}
