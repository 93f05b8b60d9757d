package com.e2eq.access.model.context;

import com.e2eq.access.model.json.JSONUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ResourceContextTest {

    private JsonNode json(String raw) throws Exception {
        return JSONUtils.instance().mapper().readTree(raw);
    }

    @Test
    void extractsSubjectAndAuthorReferences() throws Exception {
        ResourceContext obs = ResourceContext.fromResource(json(
                "{\"resourceType\":\"Observation\",\"id\":\"o1\",\"meta\":{\"versionId\":\"3\"},"
                        + "\"subject\":{\"reference\":\"Patient/123\"},"
                        + "\"performer\":[{\"reference\":\"Practitioner/9\"}]}"));

        assertEquals("Observation", obs.getResourceType());
        assertEquals("o1", obs.getId());
        assertEquals("3", obs.getVersionId());
        assertEquals("Patient/123", obs.getSubject());
        assertEquals("Practitioner/9", obs.getAuthor());
    }

    @Test
    void patientResourceIsItsOwnSubject() throws Exception {
        ResourceContext patient = ResourceContext.fromResource(json("{\"resourceType\":\"Patient\",\"id\":\"123\"}"));
        assertEquals("Patient/123", patient.getSubject());
        assertNull(patient.getAuthor());
    }

    @Test
    void userIdentityDerivesTypeFromFhirUser() {
        UserIdentity user = UserIdentity.of("u1", "https://fhir.example.org/Practitioner/42", List.of("doctor"));
        assertEquals("Practitioner", user.getFhirUserType());
        assertEquals("42", user.getFhirUserId());
        assertTrue(user.hasRole("doctor"));

        assertNull(UserIdentity.of("u2", "not-a-reference", null).getFhirUserType());
        assertTrue(FhirReferences.refersTo("https://x/Patient/1", "Patient", "1"));
        assertFalse(FhirReferences.refersTo("Patient/11", "Patient", "1"));
    }

    @Test
    void contextSerialisesWithCamelCaseAndWithoutNulls() {
        PolicyContext ctx = PolicyContext.builder()
                .client(ClientIdentity.of("app"))
                .scopes(ScopeSummary.fromScopeString("user/Observation.rs launch"))
                .request(RequestContext.builder().resourceType("Observation").path("/Observation").method("GET").build())
                .build();

        Map<String, Object> map = JSONUtils.instance().toMap(ctx);
        assertFalse(map.containsKey("user"));
        assertFalse(map.containsKey("resource"));
        @SuppressWarnings("unchecked")
        Map<String, Object> scopes = (Map<String, Object>) map.get("scopes");
        assertEquals(List.of("user/Observation.rs"), scopes.get("userScopes"));
        assertEquals(Boolean.TRUE, scopes.get("launch"));
        assertTrue(ctx.getScopes().contains("launch"));
        assertFalse(ctx.getScopes().contains("laun"));
    }
}
