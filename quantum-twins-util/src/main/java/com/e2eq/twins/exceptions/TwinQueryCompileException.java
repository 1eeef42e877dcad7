package com.e2eq.twins.exceptions;

/**
 * Malformed twin query. Carries the offending fragment and, when known, its
 * character position in the normalized query.
 */
public class TwinQueryCompileException extends TwinsException {
   private final String fragment;
   private final int position;

   public TwinQueryCompileException(String message, String fragment) {
      this(message, fragment, -1, null);
   }

   public TwinQueryCompileException(String message, String fragment, int position, Throwable cause) {
      super(ErrorKind.COMPILE_ERROR, message, cause);
      this.fragment = fragment;
      this.position = position;
   }

   public String getFragment() {
      return fragment;
   }

   public int getPosition() {
      return position;
   }
}
