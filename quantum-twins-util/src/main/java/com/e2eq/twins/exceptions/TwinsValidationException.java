package com.e2eq.twins.exceptions;

import jakarta.validation.ValidationException;

import java.util.Collection;
import java.util.List;

/**
 * Aggregated validation failure. Always carries every violation found in the
 * attempt, the message is the violations joined with {@code " AND "}.
 */
public class TwinsValidationException extends ValidationException implements KindedException {
   private static final long serialVersionUID = 1L;
   protected final List<String> violations;

   protected String jsonData;

   public TwinsValidationException(String message) {
      super(message);
      this.violations = List.of(message);
   }

   public TwinsValidationException(Collection<String> violations) {
      super(String.join(" AND ", violations));
      this.violations = List.copyOf(violations);
   }

   public TwinsValidationException(String message, Throwable cause) {
      super(message, cause);
      this.violations = List.of(message);
   }

   public List<String> getViolations() {
      return violations;
   }

   public String getJsonData() {
      return jsonData;
   }

   public void setJsonData(String jsonData) {
      this.jsonData = jsonData;
   }

   @Override
   public ErrorKind getErrorKind() {
      return ErrorKind.VALIDATION_FAILED;
   }

   @Override
   public String toString() {
      return "TwinsValidationException{" +
              "violations=" + violations +
              ", jsonData='" + jsonData + '\'' +
              '}';
   }
}
