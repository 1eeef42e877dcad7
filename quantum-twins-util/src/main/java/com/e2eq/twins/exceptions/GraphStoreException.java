package com.e2eq.twins.exceptions;

/**
 * Failure reported by the underlying graph storage engine.
 */
public class GraphStoreException extends TwinsException {
   public GraphStoreException(String message, Throwable cause) {
      super(ErrorKind.STORAGE, message, cause);
   }
}
