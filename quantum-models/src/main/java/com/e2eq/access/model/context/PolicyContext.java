package com.e2eq.access.model.context;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one request and the identity behind it. Built once by the
 * transport layer and handed unchanged to every policy of an evaluation.
 */
@RegisterForReflection
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PolicyContext {
   /** Null for client-credentials access. */
   UserIdentity user;
   ClientIdentity client;
   @Builder.Default
   ScopeSummary scopes = ScopeSummary.empty();
   RequestContext request;
   /** Existing resource, when the interaction targets one. */
   ResourceContext resource;
   @Builder.Default
   EnvironmentContext environment = EnvironmentContext.builder().build();

   private PolicyContext(UserIdentity user, ClientIdentity client, ScopeSummary scopes, RequestContext request,
                         ResourceContext resource, EnvironmentContext environment) {
      this.user = user;
      this.client = Objects.requireNonNull(client, "client cannot be null");
      this.scopes = scopes == null ? ScopeSummary.empty() : scopes;
      this.request = Objects.requireNonNull(request, "request cannot be null");
      this.resource = resource;
      this.environment = environment == null ? EnvironmentContext.builder().build() : environment;
   }

   public Optional<UserIdentity> user() {
      return Optional.ofNullable(user);
   }

   public Optional<ResourceContext> resource() {
      return Optional.ofNullable(resource);
   }
}
