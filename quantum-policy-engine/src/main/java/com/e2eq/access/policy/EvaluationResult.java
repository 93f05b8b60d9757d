package com.e2eq.access.policy;

import com.e2eq.access.model.decision.AccessDecision;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Final decision of an evaluation plus the trail that led to it.
 */
@RegisterForReflection
@Value
@Builder
public class EvaluationResult {
   AccessDecision decision;
   /** Policies in the order they were considered, up to and including a deny. */
   @Builder.Default
   List<EvaluatedPolicy> evaluatedPolicies = List.of();
   Duration evaluationTime;
   /** Whether the granted scopes were checked before any policy ran. */
   boolean scopesChecked;
   /** Outcome of the scope check, null when it was skipped. */
   AccessDecision scopeDecision;

   /**
    * Id of the policy whose deny ended the evaluation, if any.
    */
   public String decidingPolicyId() {
      return decision.getReason() == null ? null : decision.getReason().policyId();
   }
}
