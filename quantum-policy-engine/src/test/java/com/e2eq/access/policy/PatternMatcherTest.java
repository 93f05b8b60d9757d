package com.e2eq.access.policy;

import com.e2eq.access.model.context.EnvironmentContext;
import com.e2eq.access.model.context.PolicyContext;
import com.e2eq.access.model.context.RequestContext;
import com.e2eq.access.model.context.ResourceContext;
import com.e2eq.access.model.context.ScopeSummary;
import com.e2eq.access.model.context.UserIdentity;
import com.e2eq.access.model.fhir.FhirOperation;
import com.e2eq.access.model.policy.CompartmentMatcher;
import com.e2eq.access.model.policy.CompartmentSource;
import com.e2eq.access.model.policy.MatchPattern;
import com.e2eq.access.model.policy.PolicyMatcher;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.net.InetAddresses;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PatternMatcherTest {

    PatternMatcher matcher = new PatternMatcher();

    boolean matches(PolicyMatcher.PolicyMatcherBuilder builder, PolicyContext context) {
        return matcher.matches(builder.build(), context);
    }

    static PolicyContext withResource(PolicyContext context, ObjectNode json) {
        return context.toBuilder().resource(ResourceContext.fromResource(json)).build();
    }

    static ObjectNode observation(String subject) {
        ObjectNode obs = JsonNodeFactory.instance.objectNode();
        obs.put("resourceType", "Observation");
        obs.put("id", "obs-1");
        obs.putObject("subject").put("reference", subject);
        return obs;
    }

    @Test
    void empty_matcher_matches_everything() {
        assertTrue(matcher.matches(null, Contexts.readObservation()));
        assertTrue(matcher.matches(PolicyMatcher.any(), Contexts.readObservation()));
        assertTrue(matches(PolicyMatcher.builder().roles(List.of()), Contexts.readObservation()));
    }

    @Test
    void client_patterns() {
        PolicyContext ctx = Contexts.readObservation();

        assertTrue(matches(PolicyMatcher.builder().clients(List.of(MatchPattern.exact("app-web"))), ctx));
        assertTrue(matches(PolicyMatcher.builder().clients(List.of(MatchPattern.prefix("app-"))), ctx));
        assertTrue(matches(PolicyMatcher.builder().clients(List.of(MatchPattern.suffix("-web"))), ctx));
        assertTrue(matches(PolicyMatcher.builder().clients(List.of(MatchPattern.regex("^app-(web|ios)$"))), ctx));
        assertTrue(matches(PolicyMatcher.builder().clients(List.of(MatchPattern.wildcard("app-*"))), ctx));
        assertTrue(matches(PolicyMatcher.builder().clients(List.of(MatchPattern.wildcard("*"))), ctx));

        assertFalse(matches(PolicyMatcher.builder().clients(List.of(MatchPattern.exact("app-ios"))), ctx));
        assertFalse(matches(PolicyMatcher.builder().clients(List.of(MatchPattern.regex("[unclosed"))), ctx));
        assertTrue(matches(PolicyMatcher.builder().clients(List.of(
                MatchPattern.exact("other"), MatchPattern.prefix("app"))), ctx));
    }

    @Test
    void roles_and_user_types_need_a_user() {
        PolicyContext ctx = Contexts.readObservation();
        PolicyContext anonymous = ctx.toBuilder().user(null).build();

        assertTrue(matches(PolicyMatcher.builder().roles(List.of("nurse", "doctor")), ctx));
        assertFalse(matches(PolicyMatcher.builder().roles(List.of("nurse")), ctx));
        assertFalse(matches(PolicyMatcher.builder().roles(List.of("doctor")), anonymous));

        assertTrue(matches(PolicyMatcher.builder().userTypes(List.of("Practitioner")), ctx));
        assertTrue(matches(PolicyMatcher.builder().userTypes(List.of("*")), ctx));
        assertFalse(matches(PolicyMatcher.builder().userTypes(List.of("Patient")), ctx));
        assertFalse(matches(PolicyMatcher.builder().userTypes(List.of("*")), anonymous));
    }

    @Test
    void resource_types_and_operations() {
        PolicyContext ctx = Contexts.readObservation();

        assertTrue(matches(PolicyMatcher.builder().resourceTypes(List.of("Patient", "Observation")), ctx));
        assertTrue(matches(PolicyMatcher.builder().resourceTypes(List.of("*")), ctx));
        assertFalse(matches(PolicyMatcher.builder().resourceTypes(List.of("Patient")), ctx));

        assertTrue(matches(PolicyMatcher.builder().operations(List.of("read", "vread")), ctx));
        assertTrue(matches(PolicyMatcher.builder().operations(List.of("*")), ctx));
        assertFalse(matches(PolicyMatcher.builder().operations(List.of("update")), ctx));
        assertFalse(matches(PolicyMatcher.builder().operations(List.of("history")), ctx));

        PolicyContext history = Contexts.practitioner(
                Contexts.request(FhirOperation.HISTORY_TYPE, "Observation", null)).build();
        assertTrue(matches(PolicyMatcher.builder().operations(List.of("history")), history));
    }

    @Test
    void operation_ids() {
        PolicyContext ctx = Contexts.readObservation();

        assertTrue(matches(PolicyMatcher.builder().operationIds(List.of("fhir.read")), ctx));
        assertTrue(matches(PolicyMatcher.builder().operationIds(List.of("fhir.*")), ctx));
        assertTrue(matches(PolicyMatcher.builder().operationIds(List.of("*")), ctx));
        assertFalse(matches(PolicyMatcher.builder().operationIds(List.of("graphql.*")), ctx));
        assertFalse(matches(PolicyMatcher.builder().operationIds(List.of("fhir.rea")), ctx));
    }

    @Test
    void path_globs() {
        assertTrue(matcher.matchesGlob("/Observation/*", "/Observation/obs-1"));
        assertFalse(matcher.matchesGlob("/Observation/*", "/Observation/obs-1/_history/2"));
        assertTrue(matcher.matchesGlob("/Observation/**", "/Observation/obs-1/_history/2"));
        assertTrue(matcher.matchesGlob("/Patient/?", "/Patient/7"));
        assertFalse(matcher.matchesGlob("/Patient/?", "/Patient/77"));
        assertTrue(matcher.matchesGlob("/a.b/(x)", "/a.b/(x)"));
        assertFalse(matcher.matchesGlob("/a.b", "/axb"));

        assertTrue(matches(PolicyMatcher.builder().paths(List.of("/Patient/**", "/Observation/*")),
                Contexts.readObservation()));
    }

    @Test
    void source_ip_blocks() {
        assertTrue(PatternMatcher.inCidr("10.0.0.0/8", InetAddresses.forString("10.1.2.3")));
        assertFalse(PatternMatcher.inCidr("10.0.0.0/16", InetAddresses.forString("10.1.2.3")));
        assertTrue(PatternMatcher.inCidr("10.1.2.0/23", InetAddresses.forString("10.1.3.200")));
        assertTrue(PatternMatcher.inCidr("10.1.2.3", InetAddresses.forString("10.1.2.3")));
        assertTrue(PatternMatcher.inCidr("0.0.0.0/0", InetAddresses.forString("192.168.1.1")));
        assertTrue(PatternMatcher.inCidr("2001:db8::/32", InetAddresses.forString("2001:db8:1::5")));
        assertFalse(PatternMatcher.inCidr("2001:db8::/32", InetAddresses.forString("10.1.2.3")));
        assertFalse(PatternMatcher.inCidr("10.0.0.0/40", InetAddresses.forString("10.1.2.3")));
        assertFalse(PatternMatcher.inCidr("not-an-ip/8", InetAddresses.forString("10.1.2.3")));

        assertTrue(PatternMatcher.isValidCidr("192.168.0.0/16"));
        assertTrue(PatternMatcher.isValidCidr("::1"));
        assertFalse(PatternMatcher.isValidCidr("192.168.0.0/33"));
        assertFalse(PatternMatcher.isValidCidr("192.168.0.0/x"));

        PolicyContext ctx = Contexts.readObservation();
        assertTrue(matches(PolicyMatcher.builder().sourceIps(List.of("192.168.0.0/16", "10.0.0.0/8")), ctx));
        PolicyContext noIp = ctx.toBuilder().environment(EnvironmentContext.builder().build()).build();
        assertFalse(matches(PolicyMatcher.builder().sourceIps(List.of("0.0.0.0/0")), noIp));
    }

    @Test
    void patient_compartment_from_launch_context() {
        CompartmentMatcher patient = new CompartmentMatcher("Patient", CompartmentSource.launchContext());
        PolicyContext ctx = Contexts.readObservation().toBuilder()
                .environment(EnvironmentContext.builder().patientContext("p-1").build())
                .build();

        assertTrue(matches(PolicyMatcher.builder().compartments(List.of(patient)),
                withResource(ctx, observation("Patient/p-1"))));
        assertTrue(matches(PolicyMatcher.builder().compartments(List.of(patient)),
                withResource(ctx, observation("https://fhir.example.org/r4/Patient/p-1"))));
        assertFalse(matches(PolicyMatcher.builder().compartments(List.of(patient)),
                withResource(ctx, observation("Patient/p-2"))));
        // no resource and no compartment in the url
        assertFalse(matches(PolicyMatcher.builder().compartments(List.of(patient)), ctx));

        PolicyContext noLaunch = withResource(Contexts.readObservation(), observation("Patient/p-1"));
        assertFalse(matches(PolicyMatcher.builder().compartments(List.of(patient)), noLaunch));
    }

    @Test
    void patient_compartment_from_request() {
        CompartmentMatcher patient = new CompartmentMatcher("Patient", CompartmentSource.launchContext());
        EnvironmentContext launch = EnvironmentContext.builder().patientContext("p-1").build();

        PolicyContext readPatient = Contexts.practitioner(Contexts.request(FhirOperation.READ, "Patient", "p-1"))
                .environment(launch)
                .build();
        assertTrue(matches(PolicyMatcher.builder().compartments(List.of(patient)), readPatient));

        RequestContext search = Contexts.request(FhirOperation.SEARCH_TYPE, "Observation", null).toBuilder()
                .compartmentType("Patient")
                .compartmentId("p-1")
                .build();
        assertTrue(matches(PolicyMatcher.builder().compartments(List.of(patient)),
                Contexts.practitioner(search).environment(launch).build()));
    }

    @Test
    void practitioner_compartment_from_user_resource() {
        CompartmentMatcher practitioner = new CompartmentMatcher("Practitioner", CompartmentSource.userResource());
        ObjectNode report = JsonNodeFactory.instance.objectNode();
        report.put("resourceType", "DiagnosticReport");
        report.put("id", "dr-1");
        report.putArray("performer").addObject().put("reference", "Practitioner/pr-1");

        PolicyContext ctx = withResource(Contexts.readObservation(), report);
        assertTrue(matches(PolicyMatcher.builder().compartments(List.of(practitioner)), ctx));

        PolicyContext other = ctx.toBuilder()
                .user(UserIdentity.of("user-9", "Practitioner/pr-9", List.of("doctor")))
                .build();
        assertFalse(matches(PolicyMatcher.builder().compartments(List.of(practitioner)), other));

        PolicyContext patientUser = ctx.toBuilder()
                .user(UserIdentity.of("user-3", "Patient/pr-1", List.of()))
                .build();
        assertFalse(matches(PolicyMatcher.builder().compartments(List.of(practitioner)), patientUser));
    }

    @Test
    void fixed_and_request_param_sources() {
        CompartmentMatcher fixed = new CompartmentMatcher("Patient", CompartmentSource.fixed("p-1"));
        CompartmentMatcher fromParam = new CompartmentMatcher("Patient", CompartmentSource.requestParam("patient"));

        PolicyContext ctx = withResource(Contexts.readObservation(), observation("Patient/p-1"));
        assertTrue(matches(PolicyMatcher.builder().compartments(List.of(fixed)), ctx));
        assertFalse(matches(PolicyMatcher.builder().compartments(List.of(fromParam)), ctx));

        RequestContext withParam = ctx.getRequest().toBuilder().queryParams(Map.of("patient", "p-1")).build();
        PolicyContext paramCtx = ctx.toBuilder().request(withParam).build();
        assertTrue(matches(PolicyMatcher.builder().compartments(List.of(fromParam)), paramCtx));
        // every compartment matcher has to hold
        assertFalse(matches(PolicyMatcher.builder().compartments(List.of(
                fromParam, new CompartmentMatcher("Patient", CompartmentSource.fixed("p-2")))), paramCtx));
    }

    @Test
    void other_compartments_use_the_request_compartment() {
        CompartmentMatcher encounter = new CompartmentMatcher("Encounter", CompartmentSource.launchContext());
        RequestContext request = Contexts.request(FhirOperation.SEARCH_TYPE, "Observation", null).toBuilder()
                .compartmentType("Encounter")
                .compartmentId("enc-1")
                .build();

        PolicyContext ctx = Contexts.practitioner(request)
                .environment(EnvironmentContext.builder().encounterContext("enc-1").build())
                .build();
        assertTrue(matches(PolicyMatcher.builder().compartments(List.of(encounter)), ctx));

        PolicyContext elsewhere = ctx.toBuilder()
                .environment(EnvironmentContext.builder().encounterContext("enc-2").build())
                .build();
        assertFalse(matches(PolicyMatcher.builder().compartments(List.of(encounter)), elsewhere));
    }

    @Test
    void required_scopes_must_all_be_granted() {
        PolicyContext ctx = Contexts.readObservation();

        assertTrue(matches(PolicyMatcher.builder().requiredScopes(List.of("openid", "fhirUser")), ctx));
        assertFalse(matches(PolicyMatcher.builder().requiredScopes(List.of("openid", "launch")), ctx));

        PolicyContext noScopes = ctx.toBuilder().scopes(ScopeSummary.empty()).build();
        assertFalse(matches(PolicyMatcher.builder().requiredScopes(List.of("openid")), noScopes));
    }

    @Test
    void every_set_field_must_match() {
        PolicyMatcher.PolicyMatcherBuilder builder = PolicyMatcher.builder()
                .resourceTypes(List.of("Observation"))
                .operations(List.of("read"))
                .roles(List.of("doctor"))
                .sourceIps(List.of("10.0.0.0/8"));
        assertTrue(matches(builder, Contexts.readObservation()));

        builder.clients(List.of(MatchPattern.exact("someone-else")));
        assertFalse(matches(builder, Contexts.readObservation()));
    }
}
