package com.e2eq.access.policy;

import com.e2eq.access.config.PolicyEngineConfig;
import com.e2eq.access.exceptions.StorageUnavailableException;
import com.e2eq.access.jwks.JwksCache;
import com.e2eq.access.jwks.JwksException;
import com.e2eq.access.model.context.PolicyContext;
import com.e2eq.access.model.decision.AccessDecision;
import com.e2eq.access.model.policy.AccessPolicy;
import com.e2eq.access.model.token.IntrospectionResult;
import com.e2eq.access.model.token.Token;
import com.e2eq.access.model.token.TokenValidationResult;
import com.e2eq.access.policy.store.PolicyStore;
import com.e2eq.access.token.TokenRequest;
import com.e2eq.access.token.TokenService;
import com.e2eq.access.util.Deadline;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.IOException;
import java.net.URI;
import java.util.Optional;

/**
 * Single entry point for the transport layer: token issuance and validation, JWKS
 * refresh and access decisions.
 */
@ApplicationScoped
public class AccessControlService {

   private final TokenService tokens;
   private final PolicyEvaluator evaluator;
   private final JwksCache jwks;
   private final PolicyStore policies;
   private final PolicyValidator validator;
   private final JsonPolicyLoader loader;
   private final Optional<String> policiesLocation;

   @Inject
   public AccessControlService(TokenService tokens, PolicyEvaluator evaluator, JwksCache jwks, PolicyStore policies,
                               PolicyValidator validator, JsonPolicyLoader loader, PolicyEngineConfig config) {
      this.tokens = tokens;
      this.evaluator = evaluator;
      this.jwks = jwks;
      this.policies = policies;
      this.validator = validator;
      this.loader = loader;
      this.policiesLocation = config.policiesLocation();
   }

   public AccessControlService(TokenService tokens, PolicyEvaluator evaluator, JwksCache jwks, PolicyStore policies,
                               PolicyValidator validator) {
      this.tokens = tokens;
      this.evaluator = evaluator;
      this.jwks = jwks;
      this.policies = policies;
      this.validator = validator;
      this.loader = new JsonPolicyLoader(validator);
      this.policiesLocation = Optional.empty();
   }

   @PostConstruct
   void loadConfiguredPolicies() {
      if (policiesLocation.isEmpty()) {
         return;
      }
      try {
         loader.loadInto(policiesLocation.get(), policies);
      } catch (IOException | StorageUnavailableException e) {
         throw new IllegalStateException("Unable to load policies from " + policiesLocation.get(), e);
      }
   }

   public AccessDecision evaluate(PolicyContext context) {
      return evaluator.evaluate(context);
   }

   public AccessDecision evaluate(PolicyContext context, Deadline deadline) {
      return evaluator.evaluate(context, deadline);
   }

   public EvaluationResult evaluateWithAudit(PolicyContext context, Deadline deadline) {
      return evaluator.evaluateWithAudit(context, deadline);
   }

   public Token issueToken(TokenRequest request) throws StorageUnavailableException {
      return tokens.issue(request);
   }

   public TokenValidationResult validateToken(String raw) {
      return tokens.validate(raw);
   }

   public IntrospectionResult introspect(String raw) {
      return tokens.introspect(raw);
   }

   /**
    * RFC 7009 revocation; unknown or foreign tokens are ignored.
    */
   public void revokeToken(String raw, String tokenTypeHint, String clientId) throws StorageUnavailableException {
      tokens.revokeToken(raw, tokenTypeHint, clientId);
   }

   public JwksCache.CachedJwks refreshJwks(URI jwksUri) throws JwksException {
      return jwks.refresh(jwksUri);
   }

   /**
    * Validates and stores a policy.
    *
    * @throws com.e2eq.access.exceptions.ConfigurationException when the policy is invalid
    */
   public void savePolicy(AccessPolicy policy) throws StorageUnavailableException {
      validator.requireValid(policy);
      policies.save(policy);
   }

   public int loadPolicies(String location) throws IOException, StorageUnavailableException {
      return loader.loadInto(location, policies);
   }
}
