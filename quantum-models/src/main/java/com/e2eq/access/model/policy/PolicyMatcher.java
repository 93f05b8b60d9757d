package com.e2eq.access.model.policy;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Structural filter deciding whether a policy applies to a request. Every non-empty
 * field must match; null or empty fields are ignored.
 */
@RegisterForReflection
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PolicyMatcher {
   /** Any-of client id patterns. */
   List<MatchPattern> clients;
   /** Any-of user roles; requires a user. */
   List<String> roles;
   /** Any-of FHIR user resource types (Practitioner, Patient, ...), {@code *} for any. */
   List<String> userTypes;
   /** Any-of target resource types, {@code *} for any. */
   List<String> resourceTypes;
   /** Any-of operation codes, plus {@code history} and {@code *}. */
   List<String> operations;
   /** Any-of operation ids, {@code *} or {@code prefix.*}. */
   List<String> operationIds;
   /** Any-of request path globs. */
   List<String> paths;
   /** Any-of source address CIDR blocks. */
   List<String> sourceIps;
   /** All must match. */
   List<CompartmentMatcher> compartments;
   /** All must be granted. */
   List<String> requiredScopes;

   public static PolicyMatcher any() {
      return PolicyMatcher.builder().build();
   }
}
