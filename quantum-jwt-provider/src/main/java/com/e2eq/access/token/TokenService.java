package com.e2eq.access.token;

import com.e2eq.access.exceptions.ConfigurationException;
import com.e2eq.access.exceptions.StorageUnavailableException;
import com.e2eq.access.model.token.IntrospectionResult;
import com.e2eq.access.model.token.JwtAlgorithm;
import com.e2eq.access.model.token.SigningKey;
import com.e2eq.access.model.token.Token;
import com.e2eq.access.model.token.TokenError;
import com.e2eq.access.model.token.TokenKind;
import com.e2eq.access.model.token.TokenValidationResult;
import com.e2eq.access.model.token.ValidatedClaims;
import com.e2eq.access.util.ExceptionLoggingUtils;
import io.smallrye.jwt.algorithm.SignatureAlgorithm;
import io.smallrye.jwt.build.Jwt;
import io.smallrye.jwt.build.JwtClaimsBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.lang.JoseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues, validates, introspects and revokes the tokens signed by this service.
 * <p>
 * Validation is fail closed: a token is valid only when its signature verifies
 * against a live signing key, it has not expired and the revocation set could be read
 * and does not contain it.
 */
@ApplicationScoped
public class TokenService {

   private static final Logger LOG = Logger.getLogger(TokenService.class);

   public static final String HINT_ACCESS_TOKEN = "access_token";
   public static final String HINT_REFRESH_TOKEN = "refresh_token";

   private static final AlgorithmConstraints SUPPORTED_ALGORITHMS = new AlgorithmConstraints(
           AlgorithmConstraints.ConstraintType.PERMIT,
           AlgorithmIdentifiers.RSA_USING_SHA256,
           AlgorithmIdentifiers.RSA_USING_SHA384,
           AlgorithmIdentifiers.ECDSA_USING_P384_CURVE_AND_SHA384);

   private final TokenConfig config;
   private final SigningKeyManager keys;
   private final TokenStore tokenStore;
   private final Clock clock;

   @Inject
   public TokenService(TokenConfig config, SigningKeyManager keys, TokenStore tokenStore) {
      this(config, keys, tokenStore, Clock.systemUTC());
   }

   public TokenService(TokenConfig config, SigningKeyManager keys, TokenStore tokenStore, Clock clock) {
      this.config = config;
      this.keys = keys;
      this.tokenStore = tokenStore;
      this.clock = clock;
   }

   public Token issue(String subject, String clientId, List<String> scopes, TokenKind kind, Duration ttl)
           throws StorageUnavailableException {
      return issue(TokenRequest.builder()
              .subject(subject)
              .clientId(clientId)
              .scopes(scopes == null ? List.of() : scopes)
              .kind(kind)
              .ttl(ttl)
              .build());
   }

   /**
    * Signs a token with the current key and persists access and refresh tokens.
    *
    * @throws ConfigurationException when no current signing key exists
    * @throws StorageUnavailableException when the key or token store cannot be reached
    */
   public Token issue(TokenRequest request) throws StorageUnavailableException {
      if (StringUtils.isBlank(request.getSubject())) {
         throw new IllegalArgumentException("subject cannot be blank");
      }
      SigningKey key = keys.currentKey()
              .orElseThrow(() -> new ConfigurationException("No active signing key; cannot issue tokens"));

      TokenKind kind = request.getKind() == null ? TokenKind.ACCESS : request.getKind();
      Duration ttl = request.getTtl() != null ? request.getTtl() : defaultTtl(kind);
      long issuedAt = clock.instant().getEpochSecond();
      long expiresAt = issuedAt + ttl.getSeconds();
      String jti = UUID.randomUUID().toString();
      String scope = String.join(" ", request.getScopes());

      JwtClaimsBuilder claims = Jwt.claims();
      claims.issuer(config.issuer());
      claims.subject(request.getSubject());
      claims.audience(new HashSet<>(config.audience()));
      claims.issuedAt(issuedAt);
      claims.expiresAt(expiresAt);
      claims.claim("jti", jti);
      claims.claim(TokenClaims.SCOPE, scope);
      claims.claim(TokenClaims.TOKEN_USE, kind.code());
      if (request.getClientId() != null) {
         claims.claim(TokenClaims.CLIENT_ID, request.getClientId());
      }
      if (request.getPatient() != null) {
         claims.claim(TokenClaims.PATIENT, request.getPatient());
      }
      if (request.getEncounter() != null) {
         claims.claim(TokenClaims.ENCOUNTER, request.getEncounter());
      }
      if (request.getFhirUser() != null) {
         claims.claim(TokenClaims.FHIR_USER, request.getFhirUser());
      }

      String encoded = claims.jws()
              .algorithm(signatureAlgorithm(key.getAlgorithm()))
              .keyId(key.getKid())
              .sign(key.getPrivateKey());

      Token token = Token.builder()
              .jti(jti)
              .subject(request.getSubject())
              .clientId(request.getClientId())
              .scopes(List.copyOf(request.getScopes()))
              .issuedAt(Instant.ofEpochSecond(issuedAt))
              .expiresAt(Instant.ofEpochSecond(expiresAt))
              .kind(kind)
              .patient(request.getPatient())
              .encounter(request.getEncounter())
              .fhirUser(request.getFhirUser())
              .encoded(encoded)
              .build();

      keys.coverToken(key, token.getIssuedAt(), token.getExpiresAt());
      if (kind.isPersisted()) {
         tokenStore.persist(token);
      }
      LOG.debugf("Issued %s token %s for subject %s with key %s", kind.code(), jti, request.getSubject(), key.getKid());
      return token;
   }

   public TokenValidationResult validate(String raw) {
      if (StringUtils.isBlank(raw) || !TokenUtils.isCompactJws(raw)) {
         return TokenValidationResult.invalid(TokenError.MALFORMED, "not a compact JWS");
      }
      String kid;
      String alg;
      try {
         JsonWebSignature header = parse(raw);
         kid = header.getKeyIdHeaderValue();
         alg = header.getAlgorithmHeaderValue();
      } catch (JoseException e) {
         return TokenValidationResult.invalid(TokenError.MALFORMED, ExceptionLoggingUtils.describe(e));
      }

      List<SigningKey> candidates;
      try {
         candidates = keys.verificationKeys(kid);
      } catch (StorageUnavailableException e) {
         ExceptionLoggingUtils.logWarn(LOG, e, "Signing keys unavailable while validating token");
         return TokenValidationResult.invalid(TokenError.STORAGE_UNAVAILABLE, ExceptionLoggingUtils.describe(e));
      }

      Optional<String> payload = Optional.empty();
      String verifiedKid = null;
      for (SigningKey key : candidates) {
         if (!key.getAlgorithm().name().equals(alg)) {
            continue;
         }
         payload = verify(raw, key);
         if (payload.isPresent()) {
            verifiedKid = key.getKid();
            break;
         }
      }
      if (payload.isEmpty()) {
         return TokenValidationResult.invalid(TokenError.SIGNATURE_INVALID, "no signing key verifies the token");
      }

      ValidatedClaims claims;
      try {
         claims = TokenClaims.toValidatedClaims(JwtClaims.parse(payload.get()), verifiedKid);
      } catch (InvalidJwtException | MalformedClaimException e) {
         return TokenValidationResult.invalid(TokenError.MALFORMED, ExceptionLoggingUtils.describe(e));
      }
      if (claims.getExpiresAt() == null || claims.getJti() == null) {
         return TokenValidationResult.invalid(TokenError.MALFORMED, "exp and jti are required");
      }

      Instant now = clock.instant();
      if (!now.isBefore(claims.getExpiresAt().plus(config.clockSkew()))) {
         return TokenValidationResult.invalid(TokenError.TOKEN_EXPIRED, "expired at " + claims.getExpiresAt());
      }

      try {
         if (tokenStore.isRevoked(claims.getJti())) {
            return TokenValidationResult.invalid(TokenError.TOKEN_REVOKED, "jti " + claims.getJti() + " is revoked");
         }
      } catch (StorageUnavailableException e) {
         ExceptionLoggingUtils.logWarn(LOG, e, "Revocation store unavailable; rejecting token %s", claims.getJti());
         return TokenValidationResult.invalid(TokenError.STORAGE_UNAVAILABLE, ExceptionLoggingUtils.describe(e));
      }
      return TokenValidationResult.valid(claims);
   }

   /**
    * Adds a token id to the revocation set until {@code expiresAt}.
    */
   public void revoke(String jti, Instant expiresAt) throws StorageUnavailableException {
      tokenStore.revoke(jti, expiresAt);
      LOG.infof("Revoked token %s", jti);
   }

   /**
    * RFC 7009 revocation. Tokens that do not validate, or that belong to a different
    * client than {@code clientId}, are ignored without error.
    *
    * @param tokenTypeHint {@code access_token} or {@code refresh_token}; only a hint
    * @param clientId the authenticated client, or null to skip the ownership check
    */
   public void revokeToken(String raw, String tokenTypeHint, String clientId) throws StorageUnavailableException {
      if (!TokenUtils.isCompactJws(raw)) {
         LOG.debug("Ignoring revocation request for a value that is not a JWT");
         return;
      }
      TokenValidationResult result = validate(raw);
      if (!result.isValid()) {
         if (result.error() == TokenError.STORAGE_UNAVAILABLE) {
            throw new StorageUnavailableException("Cannot revoke token: " + result.detail());
         }
         LOG.debugf("Ignoring revocation of invalid token: %s", result);
         return;
      }
      ValidatedClaims claims = result.claims();
      if (clientId != null && !clientId.equals(claims.getClientId())) {
         LOG.debugf("Ignoring revocation of token %s requested by client %s", claims.getJti(), clientId);
         return;
      }
      if (tokenTypeHint != null && claims.getKind() != null && !hintMatches(tokenTypeHint, claims.getKind())) {
         LOG.debugf("Token type hint %s does not match %s token %s", tokenTypeHint, claims.getKind().code(), claims.getJti());
      }
      revoke(claims.getJti(), claims.getExpiresAt());
   }

   /**
    * RFC 7662 introspection. Never throws; anything that does not validate is
    * reported as inactive.
    */
   public IntrospectionResult introspect(String raw) {
      try {
         TokenValidationResult result = validate(raw);
         return result.isValid() ? IntrospectionResult.fromClaims(result.claims()) : IntrospectionResult.inactive();
      } catch (RuntimeException e) {
         ExceptionLoggingUtils.logError(LOG, e, "Introspection failed");
         return IntrospectionResult.inactive();
      }
   }

   public SigningKey rotateKeys() throws StorageUnavailableException {
      return keys.rotate();
   }

   public int cleanupExpired() throws StorageUnavailableException {
      int removed = tokenStore.cleanupExpired(clock.instant());
      LOG.debugf("Removed %d expired token records", removed);
      return removed;
   }

   Duration defaultTtl(TokenKind kind) {
      return switch (kind) {
         case ACCESS -> config.accessTokenTtl();
         case REFRESH -> config.refreshTokenTtl();
         case ID -> config.idTokenTtl();
      };
   }

   private static boolean hintMatches(String hint, TokenKind kind) {
      return (HINT_ACCESS_TOKEN.equals(hint) && kind == TokenKind.ACCESS)
              || (HINT_REFRESH_TOKEN.equals(hint) && kind == TokenKind.REFRESH);
   }

   private static Optional<String> verify(String raw, SigningKey key) {
      try {
         JsonWebSignature jws = parse(raw);
         jws.setKey(key.getPublicKey());
         return jws.verifySignature() ? Optional.of(jws.getUnverifiedPayload()) : Optional.empty();
      } catch (JoseException e) {
         ExceptionLoggingUtils.logIgnoredException(LOG, e, "verify with key " + key.getKid());
         return Optional.empty();
      }
   }

   private static JsonWebSignature parse(String raw) throws JoseException {
      JsonWebSignature jws = new JsonWebSignature();
      jws.setAlgorithmConstraints(SUPPORTED_ALGORITHMS);
      jws.setCompactSerialization(raw);
      return jws;
   }

   private static SignatureAlgorithm signatureAlgorithm(JwtAlgorithm algorithm) {
      return switch (algorithm) {
         case RS256 -> SignatureAlgorithm.RS256;
         case RS384 -> SignatureAlgorithm.RS384;
         case ES384 -> SignatureAlgorithm.ES384;
      };
   }
}
