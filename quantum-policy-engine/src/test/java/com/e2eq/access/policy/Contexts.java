package com.e2eq.access.policy;

import com.e2eq.access.model.context.ClientIdentity;
import com.e2eq.access.model.context.EnvironmentContext;
import com.e2eq.access.model.context.PolicyContext;
import com.e2eq.access.model.context.RequestContext;
import com.e2eq.access.model.context.ScopeSummary;
import com.e2eq.access.model.context.UserIdentity;
import com.e2eq.access.model.fhir.FhirOperation;

import java.util.List;

/**
 * Request contexts shared by the policy tests.
 */
public final class Contexts {

   public static final String ALL_USER_SCOPES = "openid fhirUser user/*.cruds";

   private Contexts() {
   }

   public static RequestContext request(FhirOperation operation, String resourceType, String resourceId) {
      return RequestContext.builder()
              .operation(operation)
              .operationId("fhir." + operation.code())
              .resourceType(resourceType)
              .resourceId(resourceId)
              .path(resourceId == null ? "/" + resourceType : "/" + resourceType + "/" + resourceId)
              .method(operation.isReadOnly() ? "GET" : "POST")
              .build();
   }

   public static PolicyContext.PolicyContextBuilder practitioner(RequestContext request) {
      return PolicyContext.builder()
              .user(UserIdentity.of("user-1", "Practitioner/pr-1", List.of("doctor")))
              .client(ClientIdentity.of("app-web"))
              .scopes(ScopeSummary.fromScopeString(ALL_USER_SCOPES))
              .request(request)
              .environment(EnvironmentContext.builder().requestId("req-1").sourceIp("10.1.2.3").build());
   }

   public static PolicyContext readObservation() {
      return practitioner(request(FhirOperation.READ, "Observation", "obs-1")).build();
   }
}
