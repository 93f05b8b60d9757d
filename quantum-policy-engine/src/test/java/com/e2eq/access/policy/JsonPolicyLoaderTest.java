package com.e2eq.access.policy;

import com.e2eq.access.exceptions.ConfigurationException;
import com.e2eq.access.model.fhir.FhirOperation;
import com.e2eq.access.model.policy.AccessPolicy;
import com.e2eq.access.model.policy.ScriptEngineSpec;
import com.e2eq.access.model.policy.ScriptLanguage;
import com.e2eq.access.policy.script.expression.ExpressionLimits;
import com.e2eq.access.policy.script.expression.ExpressionScriptEngine;
import com.e2eq.access.policy.store.InMemoryPolicyStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.*;

public class JsonPolicyLoaderTest {

    JsonPolicyLoader loader = new JsonPolicyLoader(new PolicyValidator(
            new ExpressionScriptEngine(ExpressionLimits.DEFAULTS, Duration.ofMillis(100), 16)));

    @Test
    void loads_policies_from_the_classpath() throws Exception {
        List<AccessPolicy> policies = loader.load("classpath:access-policies.json");

        assertEquals(4, policies.size());
        AccessPolicy network = policies.get(0);
        assertEquals("block-untrusted-network", network.getId());
        assertEquals(5, network.getPriority());
        ScriptEngineSpec script = assertInstanceOf(ScriptEngineSpec.class, network.getEngine());
        assertEquals(ScriptLanguage.EXPRESSION, script.language());
        assertFalse(policies.get(3).isActive());
    }

    @Test
    void load_into_fills_the_store() throws Exception {
        InMemoryPolicyStore store = new InMemoryPolicyStore();

        assertEquals(4, loader.loadInto("access-policies.json", store));

        assertEquals(4, store.findAll().size());
        assertTrue(store.findById("patient-own-data").isPresent());
        // inactive policies are stored but never applicable
        assertTrue(store.findApplicable("Observation", FhirOperation.READ).stream()
                .noneMatch(p -> p.getId().equals("retired")));
    }

    @Test
    void loads_from_the_filesystem(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("policies.json");
        Files.writeString(file, "[{\"id\": \"all\", \"name\": \"Allow all\", \"engine\": {\"type\": \"allow\"}}]",
                StandardCharsets.UTF_8);

        List<AccessPolicy> policies = loader.load("file:" + file);

        assertEquals(1, policies.size());
        assertEquals(AccessPolicy.DEFAULT_PRIORITY, policies.get(0).getPriority());
    }

    @Test
    void rejects_invalid_policy_sets() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> loader.load("invalid-policies.json"));

        assertThat(e.getViolations(), hasItem("dup: duplicate policy id"));
        assertThat(e.getViolations(), hasItem("dup: unknown operation 'frobnicate'"));
        assertThat(e.getViolations(), hasItem("dup: priority must be between 0 and 1000, was 5000"));
    }

    @Test
    void rejects_malformed_documents() {
        assertThrows(ConfigurationException.class, () -> loader.parse("{\"id\": \"not-a-list\"}"));
        assertThrows(ConfigurationException.class, () -> loader.parse("[{\"engine\": {\"type\": \"teleport\"}}]"));
        assertThrows(ConfigurationException.class, () -> loader.parse("null"));
    }

    @Test
    void missing_locations_fail_with_io_errors() {
        assertThrows(IOException.class, () -> loader.load("classpath:nowhere.json"));
    }
}
