package com.e2eq.access.exceptions;

import java.util.List;

/**
 * Malformed policy, matcher or engine configuration, or a missing signing key.
 */
public class ConfigurationException extends RuntimeException {
   protected final List<String> violations;

   public ConfigurationException(String message) {
      super(message);
      this.violations = List.of();
   }

   public ConfigurationException(String message, Throwable cause) {
      super(message, cause);
      this.violations = List.of();
   }

   public ConfigurationException(String message, List<String> violations) {
      super(message);
      this.violations = violations == null ? List.of() : List.copyOf(violations);
   }

   public List<String> getViolations() {
      return violations;
   }

   @Override
   public String getMessage() {
      if (violations.isEmpty()) {
         return super.getMessage();
      }
      StringBuilder sb = new StringBuilder(super.getMessage());
      for (String violation : violations) {
         sb.append("\n - ").append(violation);
      }
      return sb.toString();
   }
}
