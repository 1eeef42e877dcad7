package com.e2eq.twins.exceptions;

public class UnsupportedOperationKindException extends TwinsException {
   public UnsupportedOperationKindException(String message) {
      super(ErrorKind.UNSUPPORTED, message);
   }
}
