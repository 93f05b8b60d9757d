package com.e2eq.access.model.policy;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Unconditional allow.
 */
@RegisterForReflection
public record AllowEngine() implements PolicyEngineSpec {

   public static final AllowEngine INSTANCE = new AllowEngine();

   @Override
   public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAllow(this);
   }
}
