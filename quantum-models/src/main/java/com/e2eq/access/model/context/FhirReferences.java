package com.e2eq.access.model.context;

import org.apache.commons.lang3.StringUtils;

/**
 * Helpers for relative FHIR references such as {@code Practitioner/123}.
 */
public final class FhirReferences {

   private FhirReferences() {
   }

   /**
    * Splits a reference into {@code [type, id]}, ignoring any base URL and
    * {@code _history} suffix. Returns null when the value is not a reference.
    */
   public static String[] parse(String reference) {
      if (StringUtils.isBlank(reference)) {
         return null;
      }
      String[] parts = StringUtils.split(reference, '/');
      int historyIdx = -1;
      for (int i = 0; i < parts.length; i++) {
         if ("_history".equals(parts[i])) {
            historyIdx = i;
            break;
         }
      }
      int end = historyIdx >= 0 ? historyIdx : parts.length;
      if (end < 2) {
         return null;
      }
      String type = parts[end - 2];
      String id = parts[end - 1];
      if (type.isEmpty() || !Character.isUpperCase(type.charAt(0)) || id.isEmpty()) {
         return null;
      }
      return new String[]{type, id};
   }

   /**
    * True when {@code reference} points at {@code type/id}, either exactly or as the
    * tail of an absolute reference.
    */
   public static boolean refersTo(String reference, String type, String id) {
      if (reference == null || id == null) {
         return false;
      }
      String relative = type + "/" + id;
      return reference.equals(relative) || reference.endsWith("/" + relative);
   }
}
