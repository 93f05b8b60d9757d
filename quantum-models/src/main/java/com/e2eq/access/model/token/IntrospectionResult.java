package com.e2eq.access.model.token;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * RFC 7662 introspection response. Inactive results carry nothing but
 * {@code active=false}, so the reason a token is inactive is never disclosed.
 */
@RegisterForReflection
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IntrospectionResult {
   public static final String TOKEN_TYPE_BEARER = "Bearer";

   private static final IntrospectionResult INACTIVE = IntrospectionResult.builder().active(false).build();

   @JsonProperty("active")
   boolean active;
   @JsonProperty("scope")
   String scope;
   @JsonProperty("client_id")
   String clientId;
   @JsonProperty("sub")
   String sub;
   @JsonProperty("exp")
   Long exp;
   @JsonProperty("iat")
   Long iat;
   @JsonProperty("iss")
   String iss;
   @JsonProperty("jti")
   String jti;
   @JsonProperty("token_type")
   String tokenType;
   @JsonProperty("aud")
   List<String> aud;
   @JsonProperty("patient")
   String patient;
   @JsonProperty("encounter")
   String encounter;
   @JsonProperty("fhir_user")
   String fhirUser;

   public static IntrospectionResult inactive() {
      return INACTIVE;
   }

   public static IntrospectionResult fromClaims(ValidatedClaims claims) {
      return IntrospectionResult.builder()
              .active(true)
              .scope(claims.getScope())
              .clientId(claims.getClientId())
              .sub(claims.getSubject())
              .exp(claims.getExpiresAt() == null ? null : claims.getExpiresAt().getEpochSecond())
              .iat(claims.getIssuedAt() == null ? null : claims.getIssuedAt().getEpochSecond())
              .iss(claims.getIssuer())
              .jti(claims.getJti())
              .tokenType(TOKEN_TYPE_BEARER)
              .aud(claims.getAudience() == null || claims.getAudience().isEmpty() ? null : claims.getAudience())
              .patient(claims.getPatient())
              .encounter(claims.getEncounter())
              .fhirUser(claims.getFhirUser())
              .build();
   }
}
