package com.e2eq.access.model.context;

import com.e2eq.access.model.smart.ScopeContext;
import com.e2eq.access.model.smart.SmartScope;
import com.e2eq.access.model.smart.SmartScopes;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Policy friendly view of the granted scopes.
 */
@RegisterForReflection
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ScopeSummary {
   /** Original space separated scope string. */
   @Builder.Default
   String raw = "";
   @Builder.Default
   List<String> patientScopes = List.of();
   @Builder.Default
   List<String> userScopes = List.of();
   @Builder.Default
   List<String> systemScopes = List.of();
   boolean hasWildcard;
   boolean launch;
   boolean openid;
   boolean fhirUser;
   boolean offlineAccess;

   public static ScopeSummary empty() {
      return ScopeSummary.builder().build();
   }

   public static ScopeSummary fromScopeString(String raw) {
      SmartScopes scopes = SmartScopes.parse(raw);
      List<String> patient = new ArrayList<>();
      List<String> user = new ArrayList<>();
      List<String> system = new ArrayList<>();
      for (SmartScope scope : scopes.getResourceScopes()) {
         if (scope.context() == ScopeContext.PATIENT) {
            patient.add(scope.toString());
         } else if (scope.context() == ScopeContext.USER) {
            user.add(scope.toString());
         } else {
            system.add(scope.toString());
         }
      }
      return ScopeSummary.builder()
              .raw(raw == null ? "" : raw)
              .patientScopes(List.copyOf(patient))
              .userScopes(List.copyOf(user))
              .systemScopes(List.copyOf(system))
              .hasWildcard(scopes.hasWildcardAccess())
              .launch(scopes.isLaunch())
              .openid(scopes.isOpenid())
              .fhirUser(scopes.isFhirUser())
              .offlineAccess(scopes.isOfflineAccess())
              .build();
   }

   /**
    * Whether the raw scope string contains {@code scope} as a whole token.
    */
   public boolean contains(String scope) {
      if (raw == null || scope == null) {
         return false;
      }
      for (String granted : raw.trim().split("\\s+")) {
         if (granted.equals(scope)) {
            return true;
         }
      }
      return false;
   }
}
