package com.e2eq.access.policy;

import com.e2eq.access.exceptions.StorageUnavailableException;
import com.e2eq.access.model.context.PolicyContext;
import com.e2eq.access.model.context.ScopeSummary;
import com.e2eq.access.model.decision.AccessDecision;
import com.e2eq.access.model.decision.DenyReason;
import com.e2eq.access.model.fhir.FhirOperation;
import com.e2eq.access.model.policy.AccessPolicy;
import com.e2eq.access.model.policy.PolicyEngineSpec;
import com.e2eq.access.model.policy.PolicyMatcher;
import com.e2eq.access.model.policy.ScriptLanguage;
import com.e2eq.access.policy.audit.AccessDecisionEvent;
import com.e2eq.access.policy.script.PolicyScriptEngine;
import com.e2eq.access.policy.script.ScriptSandboxPool;
import com.e2eq.access.policy.script.expression.ExpressionLimits;
import com.e2eq.access.policy.script.expression.ExpressionScriptEngine;
import com.e2eq.access.policy.store.InMemoryPolicyStore;
import com.e2eq.access.policy.store.PolicyStore;
import com.e2eq.access.util.Deadline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.*;

public class PolicyEvaluatorTest {

    InMemoryPolicyStore store;
    List<AccessDecisionEvent> events;
    CountingEngine counting;
    PolicyEvaluator evaluator;

    /**
     * Stands in for the JavaScript engine and counts how often it is asked to decide.
     */
    static class CountingEngine implements PolicyScriptEngine {
        final AtomicInteger invocations = new AtomicInteger();

        @Override
        public ScriptLanguage language() {
            return ScriptLanguage.JAVASCRIPT;
        }

        @Override
        public Duration timeout() {
            return Duration.ofSeconds(1);
        }

        @Override
        public AccessDecision evaluate(String script, PolicyContext context, Deadline deadline) {
            invocations.incrementAndGet();
            return "allow".equals(script) ? AccessDecision.allow() : AccessDecision.abstain();
        }
    }

    @BeforeEach
    void init() {
        store = new InMemoryPolicyStore();
        events = new ArrayList<>();
        counting = new CountingEngine();
        ScriptSandboxPool pool = new ScriptSandboxPool(List.of(
                new ExpressionScriptEngine(ExpressionLimits.DEFAULTS, Duration.ofMillis(500), 16),
                counting));
        evaluator = new PolicyEvaluator(store, new PatternMatcher(), pool, events::add, true, Clock.systemUTC());
    }

    static AccessPolicy policy(String id, int priority, PolicyMatcher matcher, PolicyEngineSpec engine) {
        return AccessPolicy.builder()
                .id(id)
                .name(id)
                .priority(priority)
                .matcher(matcher)
                .engine(engine)
                .build();
    }

    static PolicyMatcher readObservation() {
        return PolicyMatcher.builder()
                .resourceTypes(List.of("Observation"))
                .operations(List.of("read"))
                .build();
    }

    @Test
    void later_unconditional_deny_overrides_earlier_allow() {
        store.save(policy("p1", 10, readObservation(), PolicyEngineSpec.allow()));
        store.save(policy("p2", 20, null, PolicyEngineSpec.deny()));

        AccessDecision decision = evaluator.evaluate(Contexts.readObservation());

        assertTrue(decision.isDenied());
        assertEquals(DenyReason.POLICY_DENIED, decision.getReason().code());
        assertEquals(DenyReason.DEFAULT_POLICY_DENY_MESSAGE, decision.getReason().message());
        assertEquals("p2", decision.getReason().policyId());
    }

    @Test
    void single_matching_allow_allows() {
        store.save(policy("p1", 10, readObservation(), PolicyEngineSpec.allow()));

        assertTrue(evaluator.evaluate(Contexts.readObservation()).isAllowed());
    }

    @Test
    void no_policies_denies_with_no_matching_policy() {
        AccessDecision decision = evaluator.evaluate(Contexts.readObservation());

        assertTrue(decision.isDenied());
        assertEquals(DenyReason.NO_MATCHING_POLICY, decision.getReason().code());
        assertEquals("No policy granted access to this resource", decision.getReason().message());
    }

    @Test
    void only_abstaining_policies_deny_with_no_matching_policy() {
        store.save(policy("p1", 10, null, PolicyEngineSpec.script(ScriptLanguage.EXPRESSION, "abstain()")));

        AccessDecision decision = evaluator.evaluate(Contexts.readObservation());

        assertEquals(DenyReason.NO_MATCHING_POLICY, decision.getReason().code());
    }

    @Test
    void first_deny_in_priority_order_wins() {
        store.save(AccessPolicy.builder().id("late").name("late").priority(50)
                .engine(PolicyEngineSpec.deny()).denyMessage("late deny").build());
        store.save(AccessPolicy.builder().id("early").name("early").priority(5)
                .engine(PolicyEngineSpec.deny()).denyMessage("early deny").build());

        EvaluationResult result = evaluator.evaluateWithAudit(Contexts.readObservation());

        assertEquals("early deny", result.getDecision().getReason().message());
        assertEquals("early", result.decidingPolicyId());
        assertEquals(1, result.getEvaluatedPolicies().size());
    }

    @Test
    void equal_priorities_are_ordered_by_id() {
        store.save(policy("b", 10, null, PolicyEngineSpec.allow()));
        store.save(policy("a", 10, null, PolicyEngineSpec.allow()));
        store.save(policy("c", 1, readObservation(), PolicyEngineSpec.allow()));

        EvaluationResult result = evaluator.evaluateWithAudit(Contexts.readObservation());

        List<String> order = new ArrayList<>();
        result.getEvaluatedPolicies().forEach(p -> order.add(p.policyId()));
        assertThat(order, contains("c", "a", "b"));
    }

    @Test
    void matcher_miss_never_invokes_the_engine() {
        PolicyMatcher patientsOnly = PolicyMatcher.builder().resourceTypes(List.of("Patient")).build();
        store.save(policy("js", 10, patientsOnly, PolicyEngineSpec.script(ScriptLanguage.JAVASCRIPT, "allow")));

        EvaluationResult result = evaluator.evaluateWithAudit(Contexts.readObservation());

        assertEquals(0, counting.invocations.get());
        assertEquals(DenyReason.NO_MATCHING_POLICY, result.getDecision().getReason().code());
        assertTrue(result.getEvaluatedPolicies().isEmpty(), "store prefilter drops the Patient-only policy");
    }

    @Test
    void matcher_miss_after_store_prefilter_is_recorded_as_not_matched() {
        PolicyMatcher otherClient = PolicyMatcher.builder()
                .resourceTypes(List.of("Observation"))
                .roles(List.of("nurse"))
                .build();
        store.save(policy("js", 10, otherClient, PolicyEngineSpec.script(ScriptLanguage.JAVASCRIPT, "allow")));

        EvaluationResult result = evaluator.evaluateWithAudit(Contexts.readObservation());

        assertEquals(0, counting.invocations.get());
        assertEquals(1, result.getEvaluatedPolicies().size());
        EvaluatedPolicy evaluated = result.getEvaluatedPolicies().get(0);
        assertFalse(evaluated.matched());
        assertNull(evaluated.decision());
    }

    @Test
    void matching_script_policy_invokes_the_engine_once() {
        store.save(policy("js", 10, readObservation(), PolicyEngineSpec.script(ScriptLanguage.JAVASCRIPT, "allow")));

        assertTrue(evaluator.evaluate(Contexts.readObservation()).isAllowed());
        assertEquals(1, counting.invocations.get());
    }

    @Test
    void inactive_policies_are_skipped() {
        store.save(policy("p1", 10, null, PolicyEngineSpec.allow()));
        store.save(policy("p2", 20, null, PolicyEngineSpec.deny()).toBuilder().active(false).build());

        assertTrue(evaluator.evaluate(Contexts.readObservation()).isAllowed());
    }

    @Test
    void script_deny_is_attributed_to_the_policy() {
        store.save(policy("script", 10, null,
                PolicyEngineSpec.script(ScriptLanguage.EXPRESSION, "deny(\"not on my watch\")")));

        AccessDecision decision = evaluator.evaluate(Contexts.readObservation());

        assertEquals(DenyReason.SCRIPT_DENIED, decision.getReason().code());
        assertEquals("not on my watch", decision.getReason().message());
        assertEquals("script", decision.getReason().policyId());
    }

    @Test
    void failing_script_denies_instead_of_propagating() {
        store.save(policy("broken", 10, null, PolicyEngineSpec.script(ScriptLanguage.EXPRESSION, "let x = ;")));

        AccessDecision decision = evaluator.evaluate(Contexts.readObservation());

        assertEquals(DenyReason.SCRIPT_ERROR, decision.getReason().code());
        assertEquals("broken", decision.getReason().policyId());
    }

    @Test
    void store_failure_denies_with_policy_error() {
        PolicyStore failing = new PolicyStore() {
            @Override
            public List<AccessPolicy> findApplicable(String resourceType, FhirOperation operation)
                    throws StorageUnavailableException {
                throw new StorageUnavailableException("connection refused");
            }

            @Override
            public List<AccessPolicy> findAll() {
                return List.of();
            }

            @Override
            public Optional<AccessPolicy> findById(String id) {
                return Optional.empty();
            }

            @Override
            public void save(AccessPolicy policy) {
            }

            @Override
            public boolean delete(String id) {
                return false;
            }
        };
        PolicyEvaluator broken = new PolicyEvaluator(failing, new PatternMatcher(), new ScriptSandboxPool(List.of()),
                events::add, true, Clock.systemUTC());

        AccessDecision decision = broken.evaluate(Contexts.readObservation());

        assertEquals(DenyReason.POLICY_ERROR, decision.getReason().code());
        assertEquals("connection refused", decision.getReason().details().get("error"));
        assertEquals(1, events.size());
    }

    @Test
    void missing_scope_denies_before_any_policy_runs() {
        store.save(policy("p1", 10, null, PolicyEngineSpec.allow()));
        PolicyContext context = Contexts.readObservation().toBuilder()
                .scopes(ScopeSummary.fromScopeString("openid user/Patient.rs"))
                .build();

        EvaluationResult result = evaluator.evaluateWithAudit(context);

        assertEquals(DenyReason.INSUFFICIENT_SCOPE, result.getDecision().getReason().code());
        assertEquals("patient/Observation.r or user/Observation.r",
                result.getDecision().getReason().details().get("required_scope"));
        assertTrue(result.isScopesChecked());
        assertTrue(result.getEvaluatedPolicies().isEmpty());
    }

    @Test
    void scope_check_can_be_disabled() {
        PolicyEvaluator lenient = new PolicyEvaluator(store, new PatternMatcher(), new ScriptSandboxPool(List.of()),
                events::add, false, Clock.systemUTC());
        store.save(policy("p1", 10, null, PolicyEngineSpec.allow()));
        PolicyContext context = Contexts.readObservation().toBuilder().scopes(ScopeSummary.empty()).build();

        EvaluationResult result = lenient.evaluateWithAudit(context);

        assertTrue(result.getDecision().isAllowed());
        assertFalse(result.isScopesChecked());
        assertNull(result.getScopeDecision());
    }

    @Test
    void capability_statement_needs_no_scope() {
        store.save(policy("p1", 10, null, PolicyEngineSpec.allow()));
        PolicyContext context = Contexts.practitioner(Contexts.request(FhirOperation.CAPABILITIES, "metadata", null))
                .scopes(ScopeSummary.empty())
                .build();

        assertTrue(evaluator.evaluate(context).isAllowed());
    }

    @Test
    void every_decision_is_audited() {
        store.save(policy("p1", 10, readObservation(), PolicyEngineSpec.allow()));

        evaluator.evaluate(Contexts.readObservation());

        assertEquals(1, events.size());
        AccessDecisionEvent event = events.get(0);
        assertTrue(event.getDecision().isAllowed());
        assertEquals("app-web", event.getClientId());
        assertEquals("user-1", event.getUserId());
        assertEquals("read", event.getOperation());
        assertEquals("req-1", event.getRequestId());
        assertEquals(1, event.getEvaluatedPolicies().size());
    }

    @Test
    void audit_failure_does_not_change_the_decision() {
        PolicyEvaluator noisy = new PolicyEvaluator(store, new PatternMatcher(), new ScriptSandboxPool(List.of()),
                event -> {
                    throw new IllegalStateException("audit sink down");
                }, true, Clock.systemUTC());
        store.save(policy("p1", 10, null, PolicyEngineSpec.allow()));

        assertTrue(noisy.evaluate(Contexts.readObservation()).isAllowed());
    }
}
