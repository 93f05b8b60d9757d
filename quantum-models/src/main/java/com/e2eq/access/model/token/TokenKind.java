package com.e2eq.access.model.token;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TokenKind {
   ACCESS,
   REFRESH,
   ID;

   @JsonValue
   public String code() {
      return name().toLowerCase(Locale.ROOT);
   }

   public static TokenKind fromCode(String code) {
      return code == null ? null : TokenKind.valueOf(code.toUpperCase(Locale.ROOT));
   }

   /**
    * Access and refresh tokens are persisted so they can be revoked; id tokens are not.
    */
   public boolean isPersisted() {
      return this != ID;
   }
}
