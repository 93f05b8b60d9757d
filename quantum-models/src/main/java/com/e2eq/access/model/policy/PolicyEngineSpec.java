package com.e2eq.access.model.policy;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * How a policy reaches its decision once its matcher has selected the request.
 * The set of variants is closed: callers dispatch through {@link Visitor}, so a new
 * variant is a compile-time change for every consumer.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AllowEngine.class, name = "allow"),
        @JsonSubTypes.Type(value = DenyEngine.class, name = "deny"),
        @JsonSubTypes.Type(value = ScriptEngineSpec.class, name = "script")
})
public interface PolicyEngineSpec {

   <R> R accept(Visitor<R> visitor);

   interface Visitor<R> {
      R visitAllow(AllowEngine engine);

      R visitDeny(DenyEngine engine);

      R visitScript(ScriptEngineSpec engine);
   }

   static PolicyEngineSpec allow() {
      return AllowEngine.INSTANCE;
   }

   static PolicyEngineSpec deny() {
      return DenyEngine.INSTANCE;
   }

   static PolicyEngineSpec script(ScriptLanguage language, String script) {
      return new ScriptEngineSpec(language, script);
   }
}
