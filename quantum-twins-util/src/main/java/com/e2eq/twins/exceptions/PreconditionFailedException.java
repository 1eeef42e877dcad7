package com.e2eq.twins.exceptions;

public class PreconditionFailedException extends TwinsException {
   public PreconditionFailedException(String message) {
      super(ErrorKind.PRECONDITION_FAILED, message);
   }
}
