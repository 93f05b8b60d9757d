package com.e2eq.access.model.smart;

import com.e2eq.access.model.fhir.FhirOperation;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * The full set of scopes granted to a client: resource scopes plus the launch and
 * identity scopes.
 */
public final class SmartScopes {

   private static final Logger LOG = Logger.getLogger(SmartScopes.class);

   public static final String LAUNCH = "launch";
   public static final String LAUNCH_PATIENT = "launch/patient";
   public static final String LAUNCH_ENCOUNTER = "launch/encounter";
   public static final String OPENID = "openid";
   public static final String FHIR_USER = "fhirUser";
   public static final String OFFLINE_ACCESS = "offline_access";
   public static final String ONLINE_ACCESS = "online_access";

   private final List<SmartScope> resourceScopes = new ArrayList<>();
   private boolean launch;
   private boolean launchPatient;
   private boolean launchEncounter;
   private boolean openid;
   private boolean fhirUser;
   private boolean offlineAccess;
   private boolean onlineAccess;

   private SmartScopes() {
   }

   public static SmartScopes empty() {
      return new SmartScopes();
   }

   /**
    * Parses a space separated scope string. Scopes that are neither special scopes nor
    * well formed resource scopes are ignored.
    */
   public static SmartScopes parse(String scopeString) {
      SmartScopes scopes = new SmartScopes();
      if (scopeString == null) {
         return scopes;
      }
      for (String scope : scopeString.trim().split("\\s+")) {
         if (scope.isEmpty()) {
            continue;
         }
         switch (scope) {
            case LAUNCH -> scopes.launch = true;
            case LAUNCH_PATIENT -> scopes.launchPatient = true;
            case LAUNCH_ENCOUNTER -> scopes.launchEncounter = true;
            case OPENID -> scopes.openid = true;
            case FHIR_USER -> scopes.fhirUser = true;
            case OFFLINE_ACCESS -> scopes.offlineAccess = true;
            case ONLINE_ACCESS -> scopes.onlineAccess = true;
            default -> {
               try {
                  scopes.resourceScopes.add(SmartScope.parse(scope));
               } catch (ScopeParseException e) {
                  LOG.debugf("Ignoring unrecognised scope '%s': %s", scope, e.getMessage());
               }
            }
         }
      }
      return scopes;
   }

   public List<SmartScope> getResourceScopes() {
      return Collections.unmodifiableList(resourceScopes);
   }

   public boolean isLaunch() {
      return launch;
   }

   public boolean isLaunchPatient() {
      return launchPatient;
   }

   public boolean isLaunchEncounter() {
      return launchEncounter;
   }

   public boolean isOpenid() {
      return openid;
   }

   public boolean isFhirUser() {
      return fhirUser;
   }

   public boolean isOfflineAccess() {
      return offlineAccess;
   }

   public boolean isOnlineAccess() {
      return onlineAccess;
   }

   public boolean wantsRefreshToken() {
      return offlineAccess || onlineAccess;
   }

   public boolean hasWildcardAccess() {
      return resourceScopes.stream().anyMatch(SmartScope::isWildcard);
   }

   public boolean hasSystemScopes() {
      return resourceScopes.stream().anyMatch(s -> s.context() == ScopeContext.SYSTEM);
   }

   public boolean permits(String resourceType, FhirOperation operation, String patientContext) {
      if (operation.alwaysAllowed()) {
         return true;
      }
      return resourceScopes.stream().anyMatch(s -> s.permits(resourceType, operation, patientContext));
   }

   /**
    * Checks every requested scope against these (allowed) scopes.
    *
    * @return the requested scopes, when all of them are covered
    * @throws ScopeParseException of kind {@code SCOPE_NOT_PERMITTED} naming the first
    *                             requested scope that is not covered
    */
   public SmartScopes validateAgainst(SmartScopes requested) throws ScopeParseException {
      SmartScopes result = new SmartScopes();
      for (SmartScope req : requested.resourceScopes) {
         if (resourceScopes.stream().noneMatch(s -> s.covers(req))) {
            throw notPermitted(req.toString());
         }
         result.resourceScopes.add(req);
      }
      result.launch = requireSpecial(requested.launch, launch, LAUNCH);
      result.launchPatient = requireSpecial(requested.launchPatient, launchPatient, LAUNCH_PATIENT);
      result.launchEncounter = requireSpecial(requested.launchEncounter, launchEncounter, LAUNCH_ENCOUNTER);
      result.openid = requireSpecial(requested.openid, openid, OPENID);
      result.fhirUser = requireSpecial(requested.fhirUser, fhirUser, FHIR_USER);
      result.offlineAccess = requireSpecial(requested.offlineAccess, offlineAccess, OFFLINE_ACCESS);
      result.onlineAccess = requireSpecial(requested.onlineAccess, onlineAccess, ONLINE_ACCESS);
      return result;
   }

   private static boolean requireSpecial(boolean requested, boolean allowed, String name) throws ScopeParseException {
      if (requested && !allowed) {
         throw notPermitted(name);
      }
      return requested;
   }

   private static ScopeParseException notPermitted(String scope) {
      return new ScopeParseException(ScopeParseException.Kind.SCOPE_NOT_PERMITTED,
              "Scope " + scope + " not permitted by allowed scopes");
   }

   @Override
   public String toString() {
      StringJoiner joiner = new StringJoiner(" ");
      if (launch) joiner.add(LAUNCH);
      if (launchPatient) joiner.add(LAUNCH_PATIENT);
      if (launchEncounter) joiner.add(LAUNCH_ENCOUNTER);
      if (openid) joiner.add(OPENID);
      if (fhirUser) joiner.add(FHIR_USER);
      if (offlineAccess) joiner.add(OFFLINE_ACCESS);
      if (onlineAccess) joiner.add(ONLINE_ACCESS);
      resourceScopes.forEach(s -> joiner.add(s.toString()));
      return joiner.toString();
   }
}
