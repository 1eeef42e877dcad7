package com.e2eq.twins.exceptions;

public class DigitalTwinNotFoundException extends NotFoundException {
   public DigitalTwinNotFoundException(String message) {
      super(message);
   }
}
