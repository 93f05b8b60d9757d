package com.e2eq.access.token;

import com.e2eq.access.model.token.TokenKind;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * What to put in a token. A null {@code ttl} means the configured lifetime for the
 * token kind.
 */
@Value
@Builder(toBuilder = true)
public class TokenRequest {
   String subject;
   String clientId;
   @Builder.Default
   List<String> scopes = List.of();
   @Builder.Default
   TokenKind kind = TokenKind.ACCESS;
   Duration ttl;
   String patient;
   String encounter;
   String fhirUser;
}
