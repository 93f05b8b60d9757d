package com.e2eq.access.model.policy;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Unconditional deny, reported with the policy's deny message.
 */
@RegisterForReflection
public record DenyEngine() implements PolicyEngineSpec {

   public static final DenyEngine INSTANCE = new DenyEngine();

   @Override
   public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDeny(this);
   }
}
