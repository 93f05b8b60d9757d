package com.e2eq.access.model.smart;

import java.util.Locale;

/**
 * Context prefix of a SMART resource scope.
 */
public enum ScopeContext {
   PATIENT,
   USER,
   SYSTEM;

   public String code() {
      return name().toLowerCase(Locale.ROOT);
   }

   public static ScopeContext fromCode(String code) throws ScopeParseException {
      switch (code) {
         case "patient":
            return PATIENT;
         case "user":
            return USER;
         case "system":
            return SYSTEM;
         default:
            throw new ScopeParseException(ScopeParseException.Kind.INVALID_CONTEXT, "Invalid context: " + code);
      }
   }
}
