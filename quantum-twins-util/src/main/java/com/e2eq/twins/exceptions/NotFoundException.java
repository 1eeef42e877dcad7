package com.e2eq.twins.exceptions;

public class NotFoundException extends TwinsException {
   public NotFoundException(String message) {
      super(ErrorKind.NOT_FOUND, message);
   }
}
