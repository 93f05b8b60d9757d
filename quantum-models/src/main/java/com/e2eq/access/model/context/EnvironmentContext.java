package com.e2eq.access.model.context;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@RegisterForReflection
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EnvironmentContext {
   @Builder.Default
   Instant requestTime = Instant.now();
   String sourceIp;
   String requestId;
   /** Patient id selected at launch. */
   String patientContext;
   /** Encounter id selected at launch. */
   String encounterContext;
}
