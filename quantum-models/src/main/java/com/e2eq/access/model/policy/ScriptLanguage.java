package com.e2eq.access.model.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScriptLanguage {
   /** Lightweight embedded expression language. */
   EXPRESSION("expression"),
   /** ECMAScript run on the GraalJS pool. */
   JAVASCRIPT("javascript");

   private final String code;

   ScriptLanguage(String code) {
      this.code = code;
   }

   @JsonValue
   public String code() {
      return code;
   }

   @JsonCreator
   public static ScriptLanguage fromCode(String code) {
      if (code == null) {
         return EXPRESSION;
      }
      switch (code.toLowerCase(Locale.ROOT)) {
         case "expression":
         case "rhai":
            return EXPRESSION;
         case "javascript":
         case "js":
         case "quickjs":
            return JAVASCRIPT;
         default:
            throw new IllegalArgumentException("Unknown script language: " + code);
      }
   }
}
