package com.e2eq.access.model.token;

import java.util.Objects;
import java.util.Optional;

/**
 * Either the validated claims or the reason the token was rejected.
 */
public final class TokenValidationResult {

   private final ValidatedClaims claims;
   private final TokenError error;
   private final String detail;

   private TokenValidationResult(ValidatedClaims claims, TokenError error, String detail) {
      this.claims = claims;
      this.error = error;
      this.detail = detail;
   }

   public static TokenValidationResult valid(ValidatedClaims claims) {
      return new TokenValidationResult(Objects.requireNonNull(claims), null, null);
   }

   public static TokenValidationResult invalid(TokenError error, String detail) {
      return new TokenValidationResult(null, Objects.requireNonNull(error), detail);
   }

   public boolean isValid() {
      return claims != null;
   }

   public ValidatedClaims claims() {
      if (claims == null) {
         throw new IllegalStateException("Token is not valid: " + error);
      }
      return claims;
   }

   public Optional<ValidatedClaims> claimsIfValid() {
      return Optional.ofNullable(claims);
   }

   public TokenError error() {
      return error;
   }

   /** Diagnostic text for logs; not meant for clients. */
   public String detail() {
      return detail;
   }

   @Override
   public String toString() {
      return isValid() ? "Valid[" + claims.getJti() + "]" : "Invalid[" + error + (detail == null ? "" : ": " + detail) + "]";
   }
}
