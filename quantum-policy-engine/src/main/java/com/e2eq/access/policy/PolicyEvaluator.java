package com.e2eq.access.policy;

import com.e2eq.access.config.PolicyEngineConfig;
import com.e2eq.access.exceptions.StorageUnavailableException;
import com.e2eq.access.model.context.PolicyContext;
import com.e2eq.access.model.context.RequestContext;
import com.e2eq.access.model.decision.AccessDecision;
import com.e2eq.access.model.decision.DenyReason;
import com.e2eq.access.model.fhir.FhirOperation;
import com.e2eq.access.model.policy.AccessPolicy;
import com.e2eq.access.model.policy.AllowEngine;
import com.e2eq.access.model.policy.DenyEngine;
import com.e2eq.access.model.policy.PolicyEngineSpec;
import com.e2eq.access.model.policy.ScriptEngineSpec;
import com.e2eq.access.model.smart.SmartScopes;
import com.e2eq.access.policy.audit.AccessDecisionEvent;
import com.e2eq.access.policy.audit.AuditService;
import com.e2eq.access.policy.script.ScriptSandboxPool;
import com.e2eq.access.policy.store.PolicyStore;
import com.e2eq.access.util.Deadline;
import com.e2eq.access.util.ExceptionLoggingUtils;
import com.google.common.collect.Ordering;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides a request against the stored policies.
 * <ol>
 *    <li>Optionally rejects the request when the granted SMART scopes do not cover the
 *    operation.</li>
 *    <li>Loads the applicable policies and runs the active ones in priority order
 *    (lowest first, ties by id).</li>
 *    <li>A policy whose matcher does not select the request abstains without running its
 *    engine. The first deny ends the evaluation.</li>
 *    <li>Otherwise the request is allowed when any policy allowed it and denied with
 *    {@code no-matching-policy} when none did.</li>
 * </ol>
 * Every decision is reported to the {@link AuditService}.
 */
@ApplicationScoped
public class PolicyEvaluator {

   private static final Logger LOG = Logger.getLogger(PolicyEvaluator.class);

   static final Ordering<AccessPolicy> EVALUATION_ORDER = Ordering.<Integer>natural()
           .<AccessPolicy>onResultOf(AccessPolicy::getPriority)
           .compound(Ordering.<String>natural().nullsLast().<AccessPolicy>onResultOf(AccessPolicy::getId));

   private final PolicyStore store;
   private final PatternMatcher matcher;
   private final ScriptSandboxPool scripts;
   private final AuditService audit;
   private final boolean evaluateScopesFirst;
   private final Clock clock;

   @Inject
   public PolicyEvaluator(PolicyStore store, PatternMatcher matcher, ScriptSandboxPool scripts, AuditService audit,
                          PolicyEngineConfig config) {
      this(store, matcher, scripts, audit, config.evaluateScopesFirst(), Clock.systemUTC());
   }

   public PolicyEvaluator(PolicyStore store, PatternMatcher matcher, ScriptSandboxPool scripts, AuditService audit,
                          boolean evaluateScopesFirst, Clock clock) {
      this.store = store;
      this.matcher = matcher;
      this.scripts = scripts;
      this.audit = audit;
      this.evaluateScopesFirst = evaluateScopesFirst;
      this.clock = clock;
   }

   public AccessDecision evaluate(PolicyContext context) {
      return evaluateWithAudit(context, Deadline.none()).getDecision();
   }

   public AccessDecision evaluate(PolicyContext context, Deadline deadline) {
      return evaluateWithAudit(context, deadline).getDecision();
   }

   public EvaluationResult evaluateWithAudit(PolicyContext context) {
      return evaluateWithAudit(context, Deadline.none());
   }

   public EvaluationResult evaluateWithAudit(PolicyContext context, Deadline deadline) {
      long started = System.nanoTime();
      EvaluationResult.EvaluationResultBuilder result = EvaluationResult.builder();
      RequestContext request = context.getRequest();

      if (evaluateScopesFirst) {
         Optional<AccessDecision> scopeDenial = checkScopes(context);
         result.scopesChecked(true).scopeDecision(scopeDenial.orElse(AccessDecision.allow()));
         if (scopeDenial.isPresent()) {
            return finish(context, result.decision(scopeDenial.get()), started);
         }
      }

      List<AccessPolicy> candidates;
      try {
         candidates = store.findApplicable(request.getResourceType(), request.getOperation());
      } catch (StorageUnavailableException | RuntimeException e) {
         ExceptionLoggingUtils.logError(LOG, e, "Unable to load policies for %s %s",
                 request.getOperation(), request.getResourceType());
         return finish(context, result.decision(AccessDecision.deny(DenyReason.policyError(e.getMessage()))), started);
      }

      List<AccessPolicy> ordered = new ArrayList<>();
      for (AccessPolicy p : candidates) {
         if (p.isActive()) {
            ordered.add(p);
         }
      }
      ordered.sort(EVALUATION_ORDER);

      List<EvaluatedPolicy> trail = new ArrayList<>(ordered.size());
      boolean allowed = false;
      for (AccessPolicy policy : ordered) {
         if (!matcher.matches(policy.getMatcher(), context)) {
            trail.add(EvaluatedPolicy.skipped(policy.getId(), policy.getName()));
            continue;
         }
         AccessDecision decision = decide(policy, context, deadline).attributedTo(policy.getId());
         trail.add(new EvaluatedPolicy(policy.getId(), policy.getName(), true, decision));
         if (LOG.isDebugEnabled()) {
            LOG.debugf("Policy %s (%s) -> %s", policy.getId(), policy.getName(), decision);
         }
         if (decision.isDenied()) {
            return finish(context, result.decision(decision).evaluatedPolicies(trail), started);
         }
         if (decision.isAllowed()) {
            allowed = true;
         }
      }

      AccessDecision decision = allowed ? AccessDecision.allow() : AccessDecision.deny(DenyReason.noMatchingPolicy());
      return finish(context, result.decision(decision).evaluatedPolicies(trail), started);
   }

   /**
    * A deny when the granted scopes do not permit the operation, empty otherwise.
    * Operations that need no resource permission are not checked.
    */
   Optional<AccessDecision> checkScopes(PolicyContext context) {
      RequestContext request = context.getRequest();
      FhirOperation operation = request.getOperation();
      if (operation == null) {
         return Optional.empty();
      }
      Optional<Character> permission = operation.requiredPermission();
      if (permission.isEmpty()) {
         return Optional.empty();
      }
      SmartScopes granted = SmartScopes.parse(context.getScopes().getRaw());
      if (granted.permits(request.getResourceType(), operation, context.getEnvironment().getPatientContext())) {
         return Optional.empty();
      }
      String type = request.getResourceType();
      char p = permission.get();
      String required = "patient/" + type + "." + p + " or user/" + type + "." + p;
      return Optional.of(AccessDecision.deny(DenyReason.insufficientScope(required)));
   }

   private AccessDecision decide(AccessPolicy policy, PolicyContext context, Deadline deadline) {
      PolicyEngineSpec engine = policy.getEngine() == null ? PolicyEngineSpec.deny() : policy.getEngine();
      return engine.accept(new PolicyEngineSpec.Visitor<AccessDecision>() {
         @Override
         public AccessDecision visitAllow(AllowEngine allow) {
            return AccessDecision.allow();
         }

         @Override
         public AccessDecision visitDeny(DenyEngine deny) {
            return AccessDecision.deny(DenyReason.policyDenied(policy.getDenyMessage()));
         }

         @Override
         public AccessDecision visitScript(ScriptEngineSpec script) {
            return scripts.evaluate(script, context, deadline);
         }
      });
   }

   private EvaluationResult finish(PolicyContext context, EvaluationResult.EvaluationResultBuilder builder, long started) {
      EvaluationResult result = builder.evaluationTime(Duration.ofNanos(System.nanoTime() - started)).build();
      publish(context, result);
      return result;
   }

   private void publish(PolicyContext context, EvaluationResult result) {
      if (audit == null) {
         return;
      }
      RequestContext request = context.getRequest();
      try {
         audit.record(AccessDecisionEvent.builder()
                 .requestId(context.getEnvironment().getRequestId())
                 .timestamp(clock.instant())
                 .clientId(context.getClient().getId())
                 .userId(context.user().map(u -> u.getId()).orElse(null))
                 .resourceType(request.getResourceType())
                 .resourceId(request.getResourceId())
                 .operation(request.getOperation() == null ? null : request.getOperation().code())
                 .sourceIp(context.getEnvironment().getSourceIp())
                 .decision(result.getDecision())
                 .decidingPolicyId(result.decidingPolicyId())
                 .evaluatedPolicies(List.copyOf(result.getEvaluatedPolicies()))
                 .evaluationMicros(result.getEvaluationTime().toNanos() / 1_000)
                 .build());
      } catch (RuntimeException e) {
         ExceptionLoggingUtils.logWarn(LOG, e, "Audit service failed to record decision for request %s",
                 context.getEnvironment().getRequestId());
      }
   }
}
