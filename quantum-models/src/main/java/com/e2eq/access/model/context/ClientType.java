package com.e2eq.access.model.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ClientType {
   PUBLIC("public"),
   CONFIDENTIAL_SYMMETRIC("confidentialSymmetric"),
   CONFIDENTIAL_ASYMMETRIC("confidentialAsymmetric");

   private final String code;

   ClientType(String code) {
      this.code = code;
   }

   @JsonValue
   public String code() {
      return code;
   }

   @JsonCreator
   public static ClientType fromCode(String code) {
      for (ClientType t : values()) {
         if (t.code.equals(code) || t.name().equalsIgnoreCase(code)) {
            return t;
         }
      }
      throw new IllegalArgumentException("Unknown client type: " + code);
   }
}
