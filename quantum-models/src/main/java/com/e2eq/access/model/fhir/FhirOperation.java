package com.e2eq.access.model.fhir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * FHIR interactions a request can perform, with the SMART permission each one needs.
 */
public enum FhirOperation {
   READ("read", 'r'),
   VREAD("vread", 'r'),
   UPDATE("update", 'u'),
   PATCH("patch", 'u'),
   DELETE("delete", 'd'),
   HISTORY_INSTANCE("history-instance", 'r'),
   HISTORY_TYPE("history-type", 'r'),
   HISTORY_SYSTEM("history-system", 'r'),
   CREATE("create", 'c'),
   SEARCH("search", 's'),
   SEARCH_TYPE("search-type", 's'),
   SEARCH_SYSTEM("search-system", 's'),
   CAPABILITIES("capabilities", null),
   BATCH("batch", null),
   TRANSACTION("transaction", null),
   OPERATION("operation", null);

   /** Matcher shorthand for the three history interactions. */
   public static final String HISTORY_ALIAS = "history";
   public static final String ANY = "*";

   private static final Map<String, FhirOperation> BY_CODE = Arrays.stream(values())
           .collect(Collectors.toUnmodifiableMap(FhirOperation::code, Function.identity()));

   private final String code;
   private final Character permission;

   FhirOperation(String code, Character permission) {
      this.code = code;
      this.permission = permission;
   }

   @JsonValue
   public String code() {
      return code;
   }

   /**
    * The SMART permission letter required, empty for interactions that are not
    * resource-scoped (capabilities, batch, transaction, custom operations).
    */
   public Optional<Character> requiredPermission() {
      return Optional.ofNullable(permission);
   }

   /**
    * Scope checks are skipped entirely for the capability statement.
    */
   public boolean alwaysAllowed() {
      return this == CAPABILITIES;
   }

   public boolean isReadOnly() {
      return permission != null && (permission == 'r' || permission == 's') || this == CAPABILITIES;
   }

   @JsonCreator
   public static FhirOperation fromCode(String code) {
      FhirOperation op = code == null ? null : BY_CODE.get(code.toLowerCase(Locale.ROOT));
      if (op == null) {
         throw new IllegalArgumentException("Unknown FHIR operation: " + code);
      }
      return op;
   }

   /**
    * Every code accepted in a policy matcher's operation list: the operation codes plus
    * {@code history} and {@code *}.
    */
   public static Set<String> matcherCodes() {
      Set<String> codes = new java.util.TreeSet<>(BY_CODE.keySet());
      codes.add(HISTORY_ALIAS);
      codes.add(ANY);
      return codes;
   }

   /**
    * Expands a matcher operation code into the operations it stands for.
    */
   public static Set<FhirOperation> expand(String matcherCode) {
      if (ANY.equals(matcherCode)) {
         return EnumSet.allOf(FhirOperation.class);
      }
      if (HISTORY_ALIAS.equalsIgnoreCase(matcherCode)) {
         return EnumSet.of(HISTORY_INSTANCE, HISTORY_TYPE, HISTORY_SYSTEM);
      }
      FhirOperation op = matcherCode == null ? null : BY_CODE.get(matcherCode.toLowerCase(Locale.ROOT));
      return op == null ? EnumSet.noneOf(FhirOperation.class) : EnumSet.of(op);
   }

   /**
    * Derives the interaction from an HTTP method and a path relative to the FHIR base.
    */
   public static FhirOperation detect(String method, String path, boolean hasBody) {
      String trimmed = path == null ? "" : path.replaceAll("^/+", "");
      int query = trimmed.indexOf('?');
      if (query >= 0) {
         trimmed = trimmed.substring(0, query);
      }
      List<String> segments = Arrays.stream(trimmed.split("/")).filter(s -> !s.isEmpty()).collect(Collectors.toList());

      switch (method == null ? "" : method.toUpperCase(Locale.ROOT)) {
         case "GET":
            return detectGet(trimmed, segments);
         case "POST":
            return detectPost(trimmed, segments, hasBody);
         case "PUT":
            return UPDATE;
         case "PATCH":
            return PATCH;
         case "DELETE":
            return DELETE;
         default:
            return READ;
      }
   }

   private static FhirOperation detectGet(String path, List<String> segments) {
      if ("metadata".equals(path)) {
         return CAPABILITIES;
      }
      int historyIdx = segments.indexOf("_history");
      if (historyIdx >= 0) {
         switch (historyIdx) {
            case 0:
               return HISTORY_SYSTEM;
            case 1:
               return HISTORY_TYPE;
            case 2:
               return segments.size() > 3 ? VREAD : HISTORY_INSTANCE;
            default:
               break;
         }
      }
      switch (segments.size()) {
         case 0:
            return SEARCH_SYSTEM;
         case 1:
            return segments.get(0).startsWith("$") ? OPERATION : SEARCH_TYPE;
         case 2:
            if (segments.get(1).startsWith("$")) {
               return OPERATION;
            }
            return segments.get(1).startsWith("_") ? SEARCH_TYPE : READ;
         case 3:
            return segments.get(2).startsWith("$") ? OPERATION : SEARCH;
         default:
            return SEARCH;
      }
   }

   private static FhirOperation detectPost(String path, List<String> segments, boolean hasBody) {
      if (segments.contains("_search")) {
         return segments.size() <= 2 && segments.size() > 1 ? SEARCH_TYPE : SEARCH_SYSTEM;
      }
      if (path.contains("/$") || (segments.size() == 1 && segments.get(0).startsWith("$"))) {
         return OPERATION;
      }
      if (segments.isEmpty() && hasBody) {
         return BATCH;
      }
      if (segments.size() == 1 && hasBody) {
         return CREATE;
      }
      return SEARCH;
   }
}
