package com.e2eq.access.model.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Operator supplied script deciding the policy outcome.
 */
@RegisterForReflection
public record ScriptEngineSpec(@JsonProperty("language") ScriptLanguage language,
                               @JsonProperty("script") String script) implements PolicyEngineSpec {

   public ScriptEngineSpec {
      if (language == null) {
         language = ScriptLanguage.EXPRESSION;
      }
   }

   @Override
   public <R> R accept(Visitor<R> visitor) {
      return visitor.visitScript(this);
   }
}
