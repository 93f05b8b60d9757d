package com.e2eq.access.model.context;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@RegisterForReflection
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ClientIdentity {
   String id;
   String name;
   /** Confidential client holding system level scopes. */
   boolean trusted;
   @Builder.Default
   ClientType clientType = ClientType.PUBLIC;

   public static ClientIdentity of(String id) {
      return ClientIdentity.builder().id(id).name(id).build();
   }
}
