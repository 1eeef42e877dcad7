package com.e2eq.twins.exceptions;

import java.util.Collection;

/**
 * A model definition batch could not be parsed or resolved.
 */
public class ModelParsingException extends TwinsValidationException {
   private static final long serialVersionUID = 1L;

   public ModelParsingException(String message) {
      super(message);
   }

   public ModelParsingException(Collection<String> problems) {
      super(problems);
   }

   public ModelParsingException(String message, Throwable cause) {
      super(message, cause);
   }
}
