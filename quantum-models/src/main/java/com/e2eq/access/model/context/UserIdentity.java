package com.e2eq.access.model.context;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * The end user behind a request. Absent for client-credentials (system) access.
 */
@RegisterForReflection
@Value
@Builder(toBuilder = true)
@Jacksonized
public class UserIdentity {
   String id;
   /** FHIR reference of the user's own resource, e.g. {@code Practitioner/123}. */
   String fhirUser;
   String fhirUserType;
   String fhirUserId;
   @Builder.Default
   List<String> roles = List.of();
   @Builder.Default
   Map<String, Object> attributes = Map.of();

   /**
    * Builds an identity, deriving the user type and id from the fhirUser reference.
    */
   public static UserIdentity of(String id, String fhirUser, List<String> roles) {
      String[] ref = FhirReferences.parse(fhirUser);
      return UserIdentity.builder()
              .id(id)
              .fhirUser(fhirUser)
              .fhirUserType(ref == null ? null : ref[0])
              .fhirUserId(ref == null ? null : ref[1])
              .roles(roles == null ? List.of() : List.copyOf(roles))
              .build();
   }

   public boolean hasRole(String role) {
      return roles != null && roles.contains(role);
   }
}
