package com.e2eq.access.model.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Requires the target to sit in the compartment of {@code compartmentType} whose owner
 * id is resolved from exactly one {@link CompartmentSource}.
 */
@RegisterForReflection
public record CompartmentMatcher(@JsonProperty("compartmentType") String compartmentType,
                                 @JsonProperty("source") CompartmentSource source) {
}
