package com.e2eq.access.policy.script.js;

import com.e2eq.access.model.context.EnvironmentContext;
import com.e2eq.access.model.context.PolicyContext;
import com.e2eq.access.model.context.ResourceContext;
import com.e2eq.access.model.decision.AccessDecision;
import com.e2eq.access.model.decision.DenyReason;
import com.e2eq.access.model.policy.ScriptEngineSpec;
import com.e2eq.access.model.policy.ScriptLanguage;
import com.e2eq.access.policy.Contexts;
import com.e2eq.access.policy.TestConfigs;
import com.e2eq.access.policy.script.ScriptExecutionException;
import com.e2eq.access.policy.script.ScriptMemoryLimitException;
import com.e2eq.access.policy.script.ScriptResourceExceededException;
import com.e2eq.access.policy.script.ScriptSandboxPool;
import com.e2eq.access.policy.script.ScriptSlotUnavailableException;
import com.e2eq.access.policy.script.ScriptTimeoutException;
import com.e2eq.access.util.Deadline;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class JavaScriptEngineTest {

    static JavaScriptEngine engine;
    PolicyContext context;

    @BeforeAll
    static void start() {
        engine = new JavaScriptEngine(Duration.ofMillis(200), Duration.ofSeconds(2), 2,
                512L * 1024 * 1024, 4L * 1024 * 1024, Long.MAX_VALUE);
    }

    @AfterAll
    static void stop() {
        engine.close();
    }

    @BeforeEach
    void init() {
        context = Contexts.readObservation();
    }

    AccessDecision run(String script) {
        return engine.evaluate(script, context, Deadline.after(Duration.ofSeconds(5)));
    }

    @Test
    void helpers_decide() {
        assertTrue(run("return allow();").isAllowed());
        assertTrue(run("return abstain();").isAbstain());

        AccessDecision denied = run("return deny('not today');");
        assertTrue(denied.isDenied());
        assertEquals(DenyReason.SCRIPT_DENIED, denied.getReason().code());
        assertEquals("not today", denied.getReason().message());

        assertEquals("Access denied", run("return deny();").getReason().message());
    }

    @Test
    void booleans_and_other_results() {
        assertTrue(run("return true;").isAllowed());
        assertTrue(run("return 1 > 2;").isDenied());
        assertTrue(run("return 42;").isAbstain());
        assertTrue(run("const x = 1;").isAbstain());
    }

    @Test
    void context_is_visible_to_the_script() {
        assertTrue(run("return hasRole('doctor') && !hasRole('nurse');").isAllowed());
        assertTrue(run("return hasAnyRole('nurse', 'doctor');").isAllowed());
        assertTrue(run("return isPractitionerUser() && !isPatientUser();").isAllowed());
        assertTrue(run("return client.id === 'app-web' && request.resourceType === 'Observation';").isAllowed());
        assertTrue(run("return environment.sourceIp === '10.1.2.3';").isAllowed());
        assertTrue(run("return resource == null;").isAllowed());
    }

    @Test
    void patient_compartment_helper() {
        ObjectNode obs = JsonNodeFactory.instance.objectNode();
        obs.put("resourceType", "Observation");
        obs.put("id", "obs-1");
        obs.putObject("subject").put("reference", "Patient/p-1");
        context = context.toBuilder()
                .resource(ResourceContext.fromResource(obs))
                .environment(EnvironmentContext.builder().patientContext("p-1").build())
                .build();

        assertTrue(run("return getPatientContext() === 'p-1' && inPatientCompartment();").isAllowed());
        assertTrue(run("return getEncounterContext() === null;").isAllowed());
    }

    @Test
    void context_is_frozen() {
        assertThrows(ScriptExecutionException.class, () -> run("user.roles.push('admin'); return true;"));
        assertTrue(run("return hasRole('admin');").isDenied());
    }

    @Test
    void console_is_routed_to_the_logger() {
        assertTrue(run("console.log('checking', request.operation); console.warn({a: 1}); return true;").isAllowed());
    }

    @Test
    void guest_errors_are_script_errors() {
        ScriptExecutionException e = assertThrows(ScriptExecutionException.class,
                () -> run("throw new Error('boom');"));
        assertTrue(e.getMessage().contains("boom"), e.getMessage());
        assertEquals(DenyReason.SCRIPT_ERROR, e.toDenyReason().code());

        assertThrows(ScriptExecutionException.class, () -> run("return ("));
    }

    @Test
    void host_access_is_blocked() {
        assertThrows(ScriptExecutionException.class, () -> run("return Java.type('java.lang.System').exit(1);"));
        assertTrue(run("return typeof require === 'undefined' && typeof process === 'undefined';").isAllowed());
    }

    @Test
    void runaway_loop_is_cancelled_at_the_deadline() {
        long started = System.nanoTime();
        ScriptTimeoutException e = assertThrows(ScriptTimeoutException.class,
                () -> engine.evaluate("while (true) {}", context, Deadline.after(Duration.ofSeconds(5))));
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertEquals(200, e.getTimeoutMillis());
        assertTrue(elapsedMillis < 1_500, "took " + elapsedMillis + " ms");

        // the slot is usable afterwards
        assertTrue(run("return allow();").isAllowed());
    }

    @Test
    void timeout_reports_the_callers_shorter_deadline() {
        ScriptTimeoutException e = assertThrows(ScriptTimeoutException.class,
                () -> engine.evaluate("while (true) {}", context, Deadline.after(Duration.ofMillis(80))));

        assertTrue(e.getTimeoutMillis() <= 80, "reported " + e.getTimeoutMillis());
    }

    @Test
    void globals_do_not_survive_into_the_next_run() {
        JavaScriptEngine single = new JavaScriptEngine(Duration.ofSeconds(2), Duration.ofSeconds(1), 1,
                512L * 1024 * 1024, 4L * 1024 * 1024, 1_000_000L);
        try {
            Deadline deadline = Deadline.after(Duration.ofSeconds(5));
            assertTrue(single.evaluate("globalThis.leak = 1; Object.prototype.tainted = true; return true;",
                    context, deadline).isAllowed());
            assertEquals(1, single.startedSlots());

            assertTrue(single.evaluate("return typeof leak === 'undefined' && ({}).tainted === undefined;",
                    context, Deadline.after(Duration.ofSeconds(5))).isAllowed());
            assertEquals(1, single.startedSlots());
        } finally {
            single.close();
        }
    }

    @Test
    void busy_slots_turn_into_resource_exhausted() throws Exception {
        JavaScriptEngine single = new JavaScriptEngine(Duration.ofSeconds(2), Duration.ofMillis(100), 1,
                512L * 1024 * 1024, 4L * 1024 * 1024, Long.MAX_VALUE);
        try {
            CompletableFuture<Throwable> busy = CompletableFuture.supplyAsync(() -> {
                try {
                    single.evaluate("while (true) {}", context, Deadline.after(Duration.ofSeconds(5)));
                    return null;
                } catch (RuntimeException e) {
                    return e;
                }
            });
            long waitUntil = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (single.startedSlots() == 0 && System.nanoTime() < waitUntil) {
                Thread.sleep(5);
            }
            assertEquals(1, single.startedSlots());

            long started = System.nanoTime();
            assertThrows(ScriptSlotUnavailableException.class, () -> single.evaluate("return true;", context,
                    Deadline.after(Duration.ofSeconds(5))));
            assertTrue(Duration.ofNanos(System.nanoTime() - started).toMillis() < 1_500);

            ScriptSandboxPool pool = new ScriptSandboxPool(List.of(single));
            AccessDecision decision = pool.evaluate(new ScriptEngineSpec(ScriptLanguage.JAVASCRIPT, "return true;"),
                    context, Deadline.after(Duration.ofSeconds(5)));
            assertEquals(DenyReason.RESOURCE_EXHAUSTED, decision.getReason().code());

            assertInstanceOf(ScriptTimeoutException.class, busy.get(10, TimeUnit.SECONDS));
        } finally {
            single.close();
        }
    }

    @Test
    void ordinary_loops_fit_the_default_allocation_budget() {
        JavaScriptEngine defaults = new JavaScriptEngine(TestConfigs.policyConfig(Map.of(
                "quantum.access.policy.script.javascript-timeout", "PT20S",
                "quantum.access.policy.script.pool-size", "1")));
        try {
            String script = "let n = 0; for (let i = 0; i < 300000; i++) { n += ('id-' + i).length; } return n > 0;";
            for (int i = 0; i < 3; i++) {
                assertTrue(defaults.evaluate(script, context, Deadline.after(Duration.ofSeconds(20))).isAllowed());
            }
        } finally {
            defaults.close();
        }
    }

    @Test
    void allocation_budget_stops_hoarding_scripts() {
        JavaScriptEngine tight = new JavaScriptEngine(Duration.ofSeconds(10), Duration.ofSeconds(1), 1,
                64L * 1024 * 1024, 4L * 1024 * 1024, Long.MAX_VALUE);
        try {
            ScriptMemoryLimitException e = assertThrows(ScriptMemoryLimitException.class,
                    () -> tight.evaluate("const a = []; while (true) { a.push('entry-' + a.length); }", context,
                            Deadline.after(Duration.ofSeconds(10))));
            assertEquals(DenyReason.SCRIPT_MEMORY_LIMIT, e.toDenyReason().code());

            assertTrue(tight.evaluate("return true;", context, Deadline.after(Duration.ofSeconds(5))).isAllowed());
        } finally {
            tight.close();
        }
    }

    @Test
    void statement_limit_stops_long_scripts() {
        JavaScriptEngine limited = new JavaScriptEngine(Duration.ofSeconds(5), Duration.ofSeconds(1), 1,
                512L * 1024 * 1024, 4L * 1024 * 1024, 5_000L);
        try {
            ScriptResourceExceededException e = assertThrows(ScriptResourceExceededException.class,
                    () -> limited.evaluate("let i = 0; while (true) { i++; }", context,
                            Deadline.after(Duration.ofSeconds(5))));
            assertEquals("statements", e.getLimit());
        } finally {
            limited.close();
        }
    }

    @Test
    void slots_start_on_demand() {
        JavaScriptEngine lazy = new JavaScriptEngine(Duration.ofSeconds(1), Duration.ofSeconds(1), 3,
                512L * 1024 * 1024, 4L * 1024 * 1024, 1_000_000L);
        try {
            assertEquals(0, lazy.startedSlots());
            lazy.evaluate("return true;", context, Deadline.after(Duration.ofSeconds(5)));
            lazy.evaluate("return true;", context, Deadline.after(Duration.ofSeconds(5)));
            assertEquals(1, lazy.startedSlots());
            assertEquals(3, lazy.poolSize());
        } finally {
            lazy.close();
        }
    }

    @Test
    void pool_size_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new JavaScriptEngine(Duration.ofSeconds(1),
                Duration.ofSeconds(1), 0, 1L, 1L, 1L));
    }
}
