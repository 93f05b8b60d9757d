package com.e2eq.access.policy;

import com.e2eq.access.exceptions.ConfigurationException;
import com.e2eq.access.model.policy.AccessPolicy;
import com.e2eq.access.model.policy.CompartmentMatcher;
import com.e2eq.access.model.policy.CompartmentSource;
import com.e2eq.access.model.policy.MatchPattern;
import com.e2eq.access.model.policy.PolicyEngineSpec;
import com.e2eq.access.model.policy.PolicyMatcher;
import com.e2eq.access.model.policy.ScriptLanguage;
import com.e2eq.access.policy.script.expression.ExpressionLimits;
import com.e2eq.access.policy.script.expression.ExpressionScriptEngine;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;

public class PolicyValidatorTest {

    PolicyValidator validator = new PolicyValidator(
            new ExpressionScriptEngine(ExpressionLimits.DEFAULTS, Duration.ofMillis(100), 16));

    static AccessPolicy.AccessPolicyBuilder valid() {
        return AccessPolicy.builder()
                .id("p1")
                .name("Policy one")
                .engine(PolicyEngineSpec.allow());
    }

    @Test
    void accepts_a_complete_policy() {
        AccessPolicy policy = valid()
                .priority(AccessPolicy.MAX_PRIORITY)
                .matcher(PolicyMatcher.builder()
                        .clients(List.of(MatchPattern.regex("^app-.+$")))
                        .userTypes(List.of("Practitioner", "*"))
                        .operations(List.of("read", "history", "*"))
                        .sourceIps(List.of("10.0.0.0/8", "::1"))
                        .paths(List.of("/Observation/**"))
                        .compartments(List.of(
                                new CompartmentMatcher("Patient", CompartmentSource.launchContext()),
                                new CompartmentMatcher("Patient", CompartmentSource.fixed("p-1"))))
                        .build())
                .build();

        assertTrue(validator.validate(policy).isEmpty());
        validator.requireValid(policy);
    }

    @Test
    void identity_priority_and_engine_are_required() {
        AccessPolicy policy = AccessPolicy.builder().priority(-1).build();

        assertThat(validator.validate(policy), contains(
                "id is required",
                "name is required",
                "priority must be between 0 and 1000, was -1",
                "engine is required"));
    }

    @Test
    void matcher_values_are_checked() {
        AccessPolicy policy = valid()
                .matcher(PolicyMatcher.builder()
                        .operations(List.of("read", "frobnicate"))
                        .userTypes(List.of("Robot"))
                        .sourceIps(List.of("10.0.0.0/33"))
                        .clients(List.of(MatchPattern.regex("(unclosed")))
                        .paths(List.of(" "))
                        .compartments(List.of(
                                new CompartmentMatcher("Patient", CompartmentSource.fixed(null)),
                                new CompartmentMatcher("Patient", CompartmentSource.requestParam(""))))
                        .build())
                .build();

        List<String> violations = validator.validate(policy);

        assertThat(violations, hasItem("unknown operation 'frobnicate'"));
        assertThat(violations, hasItem("unknown user type 'Robot'"));
        assertThat(violations, hasItem("invalid CIDR '10.0.0.0/33'"));
        assertThat(violations, hasItem(startsWith("invalid client pattern regex '(unclosed'")));
        assertThat(violations, hasItem("path patterns cannot be blank"));
        assertThat(violations, hasItem("fixed compartment source needs a value"));
        assertThat(violations, hasItem("request-param compartment source needs a param"));
        assertEquals(7, violations.size());
    }

    @Test
    void expression_scripts_must_compile() {
        AccessPolicy broken = valid().engine(PolicyEngineSpec.script(ScriptLanguage.EXPRESSION, "let = 1")).build();
        assertThat(validator.validate(broken), contains(startsWith("script does not compile: Syntax error")));

        AccessPolicy empty = valid().engine(PolicyEngineSpec.script(ScriptLanguage.EXPRESSION, "  ")).build();
        assertThat(validator.validate(empty), contains("script is required for script engines"));

        AccessPolicy fine = valid().engine(PolicyEngineSpec.script(ScriptLanguage.EXPRESSION, "allow()")).build();
        assertTrue(validator.validate(fine).isEmpty());
    }

    @Test
    void javascript_is_not_compiled_up_front() {
        AccessPolicy js = valid().engine(PolicyEngineSpec.script(ScriptLanguage.JAVASCRIPT, "return (")).build();
        assertTrue(validator.validate(js).isEmpty());
        assertTrue(new PolicyValidator().validate(
                valid().engine(PolicyEngineSpec.script(ScriptLanguage.EXPRESSION, "let = 1")).build()).isEmpty());
    }

    @Test
    void require_valid_lists_every_violation() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> validator.requireValid(valid().name(null).priority(2000).build()));

        assertThat(e.getViolations(), containsInAnyOrder(
                "name is required", "priority must be between 0 and 1000, was 2000"));
        assertTrue(e.getMessage().contains("p1"), e.getMessage());
    }

    @Test
    void policy_sets_need_unique_ids() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> validator.requireValid(List.of(valid().build(), valid().name("again").build())));

        assertThat(e.getViolations(), contains("p1: duplicate policy id"));
    }
}
