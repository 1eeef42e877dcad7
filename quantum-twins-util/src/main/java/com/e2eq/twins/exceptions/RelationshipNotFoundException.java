package com.e2eq.twins.exceptions;

public class RelationshipNotFoundException extends NotFoundException {
   public RelationshipNotFoundException(String message) {
      super(message);
   }
}
