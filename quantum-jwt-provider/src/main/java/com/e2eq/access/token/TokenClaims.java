package com.e2eq.access.token;

import com.e2eq.access.model.token.TokenKind;
import com.e2eq.access.model.token.ValidatedClaims;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.ReservedClaimNames;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Claim names of issued tokens and the mapping from a verified claim set to
 * {@link ValidatedClaims}.
 */
public final class TokenClaims {

   public static final String SCOPE = "scope";
   public static final String CLIENT_ID = "client_id";
   public static final String TOKEN_USE = "token_use";
   public static final String PATIENT = "patient";
   public static final String ENCOUNTER = "encounter";
   public static final String FHIR_USER = "fhirUser";

   private static final Set<String> MAPPED = Set.of(
           ReservedClaimNames.ISSUER, ReservedClaimNames.SUBJECT, ReservedClaimNames.AUDIENCE,
           ReservedClaimNames.EXPIRATION_TIME, ReservedClaimNames.ISSUED_AT, ReservedClaimNames.JWT_ID,
           ReservedClaimNames.NOT_BEFORE, SCOPE, CLIENT_ID, TOKEN_USE, PATIENT, ENCOUNTER, FHIR_USER);

   private TokenClaims() {
   }

   public static ValidatedClaims toValidatedClaims(JwtClaims claims, String keyId) throws MalformedClaimException {
      Map<String, Object> other = new HashMap<>();
      claims.getClaimsMap().forEach((name, value) -> {
         if (!MAPPED.contains(name) && value != null) {
            other.put(name, value);
         }
      });
      List<String> audience = claims.hasAudience() ? claims.getAudience() : List.of();
      return ValidatedClaims.builder()
              .issuer(claims.getIssuer())
              .subject(claims.getSubject())
              .audience(audience)
              .expiresAt(toInstant(claims.getExpirationTime()))
              .issuedAt(toInstant(claims.getIssuedAt()))
              .jti(claims.getJwtId())
              .scope(claims.getStringClaimValue(SCOPE))
              .clientId(claims.getStringClaimValue(CLIENT_ID))
              .kind(tokenKind(claims.getStringClaimValue(TOKEN_USE)))
              .patient(claims.getStringClaimValue(PATIENT))
              .encounter(claims.getStringClaimValue(ENCOUNTER))
              .fhirUser(claims.getStringClaimValue(FHIR_USER))
              .keyId(keyId)
              .otherClaims(Map.copyOf(other))
              .build();
   }

   static Instant toInstant(NumericDate date) {
      return date == null ? null : Instant.ofEpochSecond(date.getValue());
   }

   private static TokenKind tokenKind(String tokenUse) {
      if (tokenUse == null) {
         return null;
      }
      try {
         return TokenKind.fromCode(tokenUse);
      } catch (IllegalArgumentException e) {
         // externally issued tokens may carry their own token_use vocabulary
         return null;
      }
   }
}
