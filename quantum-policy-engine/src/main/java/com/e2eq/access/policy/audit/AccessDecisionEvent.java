package com.e2eq.access.policy.audit;

import com.e2eq.access.model.decision.AccessDecision;
import com.e2eq.access.policy.EvaluatedPolicy;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@RegisterForReflection
@Value
@Builder
public class AccessDecisionEvent {
   String requestId;
   Instant timestamp;
   String clientId;
   String userId;
   String resourceType;
   String resourceId;
   String operation;
   String sourceIp;
   AccessDecision decision;
   /** Policy whose deny decided the request, null for allows and scope denials. */
   String decidingPolicyId;
   @Builder.Default
   List<EvaluatedPolicy> evaluatedPolicies = List.of();
   long evaluationMicros;
}
