package com.e2eq.access.model.context;

import com.e2eq.access.model.fhir.FhirOperation;
import com.fasterxml.jackson.databind.JsonNode;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * The FHIR interaction being attempted.
 */
@RegisterForReflection
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RequestContext {
   FhirOperation operation;
   /** Operation id used for policy targeting, e.g. {@code fhir.read} or {@code graphql.query}. */
   String operationId;
   String resourceType;
   String resourceId;
   /** Compartment from the URL, e.g. {@code Patient} in {@code /Patient/123/Observation}. */
   String compartmentType;
   String compartmentId;
   JsonNode body;
   @Builder.Default
   Map<String, String> queryParams = Map.of();
   String path;
   String method;
}
