package com.e2eq.access.model.token;

/**
 * Signature algorithms accepted for issued and federated tokens.
 */
public enum JwtAlgorithm {
   RS256("RSA"),
   RS384("RSA"),
   ES384("EC");

   private final String keyType;

   JwtAlgorithm(String keyType) {
      this.keyType = keyType;
   }

   /** JCA key algorithm name. */
   public String keyType() {
      return keyType;
   }

   public static boolean isSupported(String name) {
      for (JwtAlgorithm alg : values()) {
         if (alg.name().equals(name)) {
            return true;
         }
      }
      return false;
   }
}
