package com.e2eq.twins.exceptions;

public class InvalidArgumentException extends TwinsException {
   public InvalidArgumentException(String message) {
      super(ErrorKind.BAD_ARGUMENT, message);
   }
}
