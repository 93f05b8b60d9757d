package com.e2eq.access.policy.script;

import com.e2eq.access.model.context.ClientIdentity;
import com.e2eq.access.model.context.EnvironmentContext;
import com.e2eq.access.model.context.PolicyContext;
import com.e2eq.access.model.context.RequestContext;
import com.e2eq.access.model.context.ResourceContext;
import com.e2eq.access.model.context.ScopeSummary;
import com.e2eq.access.model.context.UserIdentity;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain map view of a {@link PolicyContext} handed to policy scripts. Values are
 * {@code null}, {@link Boolean}, {@link Long}, {@link Double}, {@link String},
 * {@link List} or {@link Map}; both engines see the same shape.
 */
public final class ScriptBindings {

   public static final String USER = "user";
   public static final String CLIENT = "client";
   public static final String REQUEST = "request";
   public static final String SCOPES = "scopes";
   public static final String ENVIRONMENT = "environment";
   public static final String RESOURCE = "resource";
   public static final String CONTEXT = "context";

   private ScriptBindings() {
   }

   /**
    * The top level variables: {@code user, client, request, scopes, environment,
    * resource}. {@code user} and {@code resource} are null when absent.
    */
   public static Map<String, Object> of(PolicyContext context) {
      Map<String, Object> vars = new LinkedHashMap<>();
      vars.put(USER, context.user().map(ScriptBindings::user).orElse(null));
      vars.put(CLIENT, client(context.getClient()));
      vars.put(REQUEST, request(context.getRequest()));
      vars.put(SCOPES, scopes(context.getScopes()));
      vars.put(ENVIRONMENT, environment(context.getEnvironment()));
      vars.put(RESOURCE, context.resource().map(ScriptBindings::resource).orElse(null));
      return vars;
   }

   static Map<String, Object> user(UserIdentity user) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("id", user.getId());
      putIfPresent(map, "fhirUser", user.getFhirUser());
      putIfPresent(map, "fhirUserType", user.getFhirUserType());
      putIfPresent(map, "fhirUserId", user.getFhirUserId());
      map.put("roles", user.getRoles() == null ? new ArrayList<>() : new ArrayList<Object>(user.getRoles()));
      Map<String, Object> attributes = new LinkedHashMap<>();
      if (user.getAttributes() != null) {
         user.getAttributes().forEach((k, v) -> attributes.put(k, normalize(v)));
      }
      map.put("attributes", attributes);
      return map;
   }

   static Map<String, Object> client(ClientIdentity client) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("id", client.getId());
      map.put("name", client.getName());
      map.put("trusted", client.isTrusted());
      map.put("clientType", client.getClientType() == null ? null : client.getClientType().code());
      return map;
   }

   static Map<String, Object> request(RequestContext request) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("operation", request.getOperation() == null ? null : request.getOperation().code());
      putIfPresent(map, "operationId", request.getOperationId());
      map.put("resourceType", request.getResourceType());
      putIfPresent(map, "resourceId", request.getResourceId());
      putIfPresent(map, "compartmentType", request.getCompartmentType());
      putIfPresent(map, "compartmentId", request.getCompartmentId());
      map.put("path", request.getPath());
      map.put("method", request.getMethod());
      Map<String, Object> params = new LinkedHashMap<>();
      if (request.getQueryParams() != null) {
         params.putAll(request.getQueryParams());
      }
      map.put("queryParams", params);
      if (request.getBody() != null) {
         map.put("body", fromJson(request.getBody()));
      }
      return map;
   }

   static Map<String, Object> scopes(ScopeSummary scopes) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("raw", scopes.getRaw());
      map.put("patientScopes", new ArrayList<Object>(scopes.getPatientScopes()));
      map.put("userScopes", new ArrayList<Object>(scopes.getUserScopes()));
      map.put("systemScopes", new ArrayList<Object>(scopes.getSystemScopes()));
      map.put("hasWildcard", scopes.isHasWildcard());
      map.put("launch", scopes.isLaunch());
      map.put("openid", scopes.isOpenid());
      map.put("fhirUser", scopes.isFhirUser());
      map.put("offlineAccess", scopes.isOfflineAccess());
      return map;
   }

   static Map<String, Object> environment(EnvironmentContext env) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("requestId", env.getRequestId());
      map.put("requestTime", env.getRequestTime() == null ? null : env.getRequestTime().toString());
      putIfPresent(map, "sourceIp", env.getSourceIp());
      putIfPresent(map, "patientContext", env.getPatientContext());
      putIfPresent(map, "encounterContext", env.getEncounterContext());
      return map;
   }

   static Map<String, Object> resource(ResourceContext resource) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("id", resource.getId());
      map.put("resourceType", resource.getResourceType());
      putIfPresent(map, "versionId", resource.getVersionId());
      putIfPresent(map, "lastUpdated", resource.getLastUpdated());
      putIfPresent(map, "subject", resource.getSubject());
      putIfPresent(map, "author", resource.getAuthor());
      map.put("data", resource.getResource() == null ? null : fromJson(resource.getResource()));
      return map;
   }

   /**
    * Converts a JSON tree into script values; integral numbers become {@link Long},
    * other numbers {@link Double}.
    */
   public static Object fromJson(JsonNode node) {
      if (node == null || node.isNull() || node.isMissingNode()) {
         return null;
      }
      if (node.isBoolean()) {
         return node.booleanValue();
      }
      if (node.isIntegralNumber() && node.canConvertToLong()) {
         return node.longValue();
      }
      if (node.isNumber()) {
         return node.doubleValue();
      }
      if (node.isTextual()) {
         return node.textValue();
      }
      if (node.isArray()) {
         List<Object> list = new ArrayList<>(node.size());
         node.forEach(n -> list.add(fromJson(n)));
         return list;
      }
      if (node.isObject()) {
         Map<String, Object> map = new LinkedHashMap<>();
         Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
         while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            map.put(field.getKey(), fromJson(field.getValue()));
         }
         return map;
      }
      return node.asText();
   }

   private static Object normalize(Object value) {
      if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
         return ((Number) value).longValue();
      }
      if (value instanceof Float) {
         return ((Float) value).doubleValue();
      }
      if (value instanceof List<?> list) {
         List<Object> copy = new ArrayList<>(list.size());
         list.forEach(v -> copy.add(normalize(v)));
         return copy;
      }
      if (value instanceof Map<?, ?> m) {
         Map<String, Object> copy = new LinkedHashMap<>();
         m.forEach((k, v) -> copy.put(String.valueOf(k), normalize(v)));
         return copy;
      }
      if (value == null || value instanceof Boolean || value instanceof Long || value instanceof Double
              || value instanceof String) {
         return value;
      }
      return String.valueOf(value);
   }

   private static void putIfPresent(Map<String, Object> map, String key, Object value) {
      if (value != null) {
         map.put(key, value);
      }
   }
}
