package com.e2eq.access.model.policy;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A prioritized access rule: an optional matcher selecting requests and an engine
 * deciding them. Lower priority values are evaluated first.
 */
@RegisterForReflection
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AccessPolicy {

   public static final int DEFAULT_PRIORITY = 100;
   public static final int MIN_PRIORITY = 0;
   public static final int MAX_PRIORITY = 1000;

   String id;
   String name;
   String description;
   @Builder.Default
   boolean active = true;
   @Builder.Default
   int priority = DEFAULT_PRIORITY;
   /** Null matches every request. */
   PolicyMatcher matcher;
   PolicyEngineSpec engine;
   /** Message for {@code deny} engines. */
   String denyMessage;
}
