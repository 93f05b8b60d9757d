package com.e2eq.access.model.token;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Claims of a token whose signature, expiry and revocation state were checked.
 */
@RegisterForReflection
@Value
@Builder
public class ValidatedClaims {
   String issuer;
   String subject;
   @Builder.Default
   List<String> audience = List.of();
   Instant expiresAt;
   Instant issuedAt;
   String jti;
   String scope;
   String clientId;
   TokenKind kind;
   String patient;
   String encounter;
   String fhirUser;
   String keyId;
   @Builder.Default
   Map<String, Object> otherClaims = Map.of();
}
