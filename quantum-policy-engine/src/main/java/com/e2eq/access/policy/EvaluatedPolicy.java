package com.e2eq.access.policy;

import com.e2eq.access.model.decision.AccessDecision;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * What one policy contributed to an evaluation. {@code decision} is null when the
 * matcher did not select the request.
 */
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvaluatedPolicy(String policyId, String policyName, boolean matched, AccessDecision decision) {

   static EvaluatedPolicy skipped(String policyId, String policyName) {
      return new EvaluatedPolicy(policyId, policyName, false, null);
   }
}
