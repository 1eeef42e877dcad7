package com.e2eq.twins.exceptions;

public class ComponentNotFoundException extends NotFoundException {
   public ComponentNotFoundException(String message) {
      super(message);
   }
}
