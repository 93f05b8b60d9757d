package com.e2eq.access.model.smart;

import com.e2eq.access.model.fhir.FhirOperation;

import java.util.Optional;

/**
 * A parsed SMART resource scope, e.g. {@code patient/Observation.rs?category=vital-signs}.
 *
 * @param context      patient, user or system
 * @param resourceType a FHIR resource type or {@code *}
 * @param permissions  granted cruds letters
 * @param filterParam  optional search parameter restricting the scope
 * @param filterValue  value of {@code filterParam}
 */
public record SmartScope(ScopeContext context,
                         String resourceType,
                         Permissions permissions,
                         String filterParam,
                         String filterValue) {

   public static final String WILDCARD = "*";

   public static SmartScope parse(String scope) throws ScopeParseException {
      if (scope == null || scope.isBlank()) {
         throw new ScopeParseException(ScopeParseException.Kind.EMPTY, "Empty scope string");
      }
      int slash = scope.indexOf('/');
      if (slash < 0) {
         throw new ScopeParseException(ScopeParseException.Kind.INVALID_FORMAT, "Invalid scope format: " + scope);
      }
      ScopeContext context = ScopeContext.fromCode(scope.substring(0, slash));
      String rest = scope.substring(slash + 1);

      String filterParam = null;
      String filterValue = null;
      int question = rest.indexOf('?');
      if (question >= 0) {
         String filter = rest.substring(question + 1);
         rest = rest.substring(0, question);
         int eq = filter.indexOf('=');
         filterParam = eq < 0 ? filter : filter.substring(0, eq);
         filterValue = eq < 0 ? "" : filter.substring(eq + 1);
      }

      int dot = rest.indexOf('.');
      if (dot <= 0) {
         throw new ScopeParseException(ScopeParseException.Kind.INVALID_FORMAT, "Invalid scope format: " + scope);
      }
      String resourceType = rest.substring(0, dot);
      Permissions permissions = Permissions.parse(rest.substring(dot + 1));
      return new SmartScope(context, resourceType, permissions, filterParam, filterValue);
   }

   public boolean isWildcard() {
      return WILDCARD.equals(resourceType);
   }

   public boolean matchesResource(String type) {
      return isWildcard() || resourceType.equals(type);
   }

   public Optional<String> filter() {
      return filterParam == null ? Optional.empty() : Optional.of(filterParam + "=" + filterValue);
   }

   /**
    * Whether this scope permits {@code operation} on {@code type}. Patient scopes only
    * apply when a patient is in context.
    */
   public boolean permits(String type, FhirOperation operation, String patientContext) {
      if (operation.alwaysAllowed()) {
         return true;
      }
      if (!matchesResource(type)) {
         return false;
      }
      if (context == ScopeContext.PATIENT && patientContext == null) {
         return false;
      }
      return operation.requiredPermission().map(permissions::has).orElse(true);
   }

   /**
    * True when this scope grants at least what {@code other} asks for.
    */
   public boolean covers(SmartScope other) {
      if (context != other.context) {
         return false;
      }
      if (!isWildcard() && (other.isWildcard() || !resourceType.equals(other.resourceType))) {
         return false;
      }
      return permissions.covers(other.permissions);
   }

   /**
    * The narrowest scope granted by both, or null when they do not overlap.
    */
   public SmartScope intersect(SmartScope other) {
      if (context != other.context) {
         return null;
      }
      String type;
      if (isWildcard()) {
         type = other.resourceType;
      } else if (other.isWildcard() || resourceType.equals(other.resourceType)) {
         type = resourceType;
      } else {
         return null;
      }
      Permissions shared = permissions.intersect(other.permissions);
      if (shared == null) {
         return null;
      }
      String param = filterParam != null ? filterParam : other.filterParam;
      String value = filterParam != null ? filterValue : other.filterValue;
      return new SmartScope(context, type, shared, param, value);
   }

   @Override
   public String toString() {
      String base = context.code() + "/" + resourceType + "." + permissions;
      return filterParam == null ? base : base + "?" + filterParam + "=" + filterValue;
   }
}
