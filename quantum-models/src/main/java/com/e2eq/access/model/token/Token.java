package com.e2eq.access.model.token;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * An issued token. Validity of access and refresh tokens depends on expiry and on
 * absence from the revocation set, never on possession alone.
 */
@RegisterForReflection
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Token {
   String jti;
   String subject;
   String clientId;
   @Builder.Default
   List<String> scopes = List.of();
   Instant issuedAt;
   Instant expiresAt;
   TokenKind kind;
   String patient;
   String encounter;
   String fhirUser;
   /** Compact serialized JWT. Handed to the caller only, never persisted. */
   @JsonIgnore
   @ToString.Exclude
   String encoded;

   @JsonIgnore
   public String scopeString() {
      return String.join(" ", scopes);
   }

   public boolean isExpiredAt(Instant instant) {
      return expiresAt != null && !instant.isBefore(expiresAt);
   }

   /**
    * Copy suitable for storage: the signed value is dropped.
    */
   public Token forStorage() {
      return toBuilder().encoded(null).build();
   }
}
