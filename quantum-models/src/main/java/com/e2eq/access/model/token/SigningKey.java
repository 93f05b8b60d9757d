package com.e2eq.access.model.token;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.time.Instant;

/**
 * A key pair used to sign issued tokens. One key is current at a time; retired keys
 * keep verifying until {@link #expiresAt}.
 */
@Value
@Builder(toBuilder = true)
public class SigningKey {
   String kid;
   JwtAlgorithm algorithm;
   PublicKey publicKey;
   @ToString.Exclude
   PrivateKey privateKey;
   Instant activatedAt;
   /** When the key stopped signing; null while current. */
   Instant retiredAt;
   /** When the key stops verifying; null while current. */
   Instant expiresAt;
   /** Latest expiry of a token signed with this key that outlives the retention window. */
   Instant tokenHorizon;

   public boolean isCurrent() {
      return retiredAt == null;
   }

   public boolean canVerifyAt(Instant instant) {
      return expiresAt == null || instant.isBefore(expiresAt);
   }

   /**
    * Stops signing at {@code at}. Verification ends at {@code verifyUntil} or at the
    * token horizon, whichever is later.
    */
   public SigningKey retire(Instant at, Instant verifyUntil) {
      return toBuilder().retiredAt(at).expiresAt(later(verifyUntil, tokenHorizon)).build();
   }

   /**
    * Records that a token signed with this key expires at {@code tokenExpiry}. A retired
    * key's verification window is widened to cover it.
    */
   public SigningKey coverTokenUntil(Instant tokenExpiry) {
      SigningKeyBuilder next = toBuilder().tokenHorizon(later(tokenHorizon, tokenExpiry));
      if (expiresAt != null) {
         next.expiresAt(later(expiresAt, tokenExpiry));
      }
      return next.build();
   }

   private static Instant later(Instant a, Instant b) {
      if (a == null) {
         return b;
      }
      return b == null || a.isAfter(b) ? a : b;
   }
}
