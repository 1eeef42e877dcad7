package com.e2eq.twins.exceptions;

public class TwinsException extends RuntimeException implements KindedException {
   private final ErrorKind errorKind;

   public TwinsException(ErrorKind errorKind, String message) {
      super(message);
      this.errorKind = errorKind;
   }

   public TwinsException(ErrorKind errorKind, String message, Throwable cause) {
      super(message, cause);
      this.errorKind = errorKind;
   }

   @Override
   public ErrorKind getErrorKind() {
      return errorKind;
   }
}
