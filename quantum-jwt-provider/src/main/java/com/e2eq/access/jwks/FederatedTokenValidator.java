package com.e2eq.access.jwks;

import com.e2eq.access.model.token.TokenError;
import com.e2eq.access.model.token.TokenValidationResult;
import com.e2eq.access.token.TokenClaims;
import com.e2eq.access.token.TokenConfig;
import com.e2eq.access.util.ExceptionLoggingUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.jwt.consumer.JwtContext;
import org.jose4j.lang.UnresolvableKeyException;

import java.net.URI;

/**
 * Validates tokens issued by an external identity provider, resolving verification
 * keys through the {@link JwksCache}.
 */
@ApplicationScoped
public class FederatedTokenValidator {

   private static final Logger LOG = Logger.getLogger(FederatedTokenValidator.class);

   private static final AlgorithmConstraints FEDERATED_ALGORITHMS = new AlgorithmConstraints(
           AlgorithmConstraints.ConstraintType.PERMIT,
           AlgorithmIdentifiers.RSA_USING_SHA256,
           AlgorithmIdentifiers.RSA_USING_SHA384,
           AlgorithmIdentifiers.ECDSA_USING_P384_CURVE_AND_SHA384);

   private final JwksCache jwksCache;
   private final TokenConfig tokenConfig;

   @Inject
   public FederatedTokenValidator(JwksCache jwksCache, TokenConfig tokenConfig) {
      this.jwksCache = jwksCache;
      this.tokenConfig = tokenConfig;
   }

   /**
    * @param raw      compact JWS
    * @param jwksUri  key set of the issuer
    * @param issuer   expected {@code iss}
    * @param audience expected {@code aud}, or null to accept any audience
    */
   public TokenValidationResult validate(String raw, URI jwksUri, String issuer, String audience) {
      JwtConsumerBuilder builder = new JwtConsumerBuilder()
              .setRequireExpirationTime()
              .setAllowedClockSkewInSeconds((int) tokenConfig.clockSkew().getSeconds())
              .setExpectedIssuer(issuer)
              .setJwsAlgorithmConstraints(FEDERATED_ALGORITHMS)
              .setVerificationKeyResolver((jws, nestingContext) -> {
                 try {
                    return jwksCache.getKey(jwksUri, jws.getKeyIdHeaderValue());
                 } catch (JwksException e) {
                    throw new UnresolvableKeyException(e.getMessage(), e);
                 }
              });
      if (audience != null) {
         builder.setExpectedAudience(audience);
      } else {
         builder.setSkipDefaultAudienceValidation();
      }
      JwtConsumer consumer = builder.build();

      try {
         JwtContext context = consumer.process(raw);
         JwtClaims claims = context.getJwtClaims();
         String kid = context.getJoseObjects().isEmpty() ? null : context.getJoseObjects().get(0).getKeyIdHeaderValue();
         return TokenValidationResult.valid(TokenClaims.toValidatedClaims(claims, kid));
      } catch (InvalidJwtException e) {
         TokenError error = classify(e);
         LOG.debugf("Federated token from %s rejected (%s): %s", issuer, error, e.getMessage());
         return TokenValidationResult.invalid(error, ExceptionLoggingUtils.describe(e));
      } catch (MalformedClaimException e) {
         return TokenValidationResult.invalid(TokenError.MALFORMED, ExceptionLoggingUtils.describe(e));
      }
   }

   static TokenError classify(InvalidJwtException e) {
      if (e.hasExpired()) {
         return TokenError.TOKEN_EXPIRED;
      }
      if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID) || e.getCause() instanceof UnresolvableKeyException) {
         return TokenError.SIGNATURE_INVALID;
      }
      if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID) || e.hasErrorCode(ErrorCodes.AUDIENCE_INVALID)
              || e.hasErrorCode(ErrorCodes.AUDIENCE_MISSING) || e.hasErrorCode(ErrorCodes.ISSUER_MISSING)) {
         return TokenError.CLAIMS_INVALID;
      }
      return TokenError.MALFORMED;
   }
}
