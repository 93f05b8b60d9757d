package com.e2eq.access.model.context;

import com.fasterxml.jackson.databind.JsonNode;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Snapshot of the existing resource targeted by read, update, patch or delete.
 */
@RegisterForReflection
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ResourceContext {
   JsonNode resource;
   String id;
   String resourceType;
   String versionId;
   String lastUpdated;
   /** Extracted subject reference, e.g. {@code Patient/123}. */
   String subject;
   /** Extracted author/performer reference. */
   String author;

   private static final String[][] SUBJECT_PATHS = {
           {"subject", "reference"},
           {"patient", "reference"},
   };

   private static final String[][] AUTHOR_PATHS = {
           {"author", "reference"},
           {"author", "0", "reference"},
           {"performer", "reference"},
           {"performer", "0", "reference"},
           {"performer", "0", "actor", "reference"},
           {"recorder", "reference"},
           {"asserter", "reference"},
           {"requester", "reference"},
   };

   public static ResourceContext fromResource(JsonNode resource) {
      String type = text(resource, "resourceType");
      String id = text(resource, "id");
      String subject = firstText(resource, SUBJECT_PATHS);
      if (subject == null && "Patient".equals(type) && id != null) {
         subject = "Patient/" + id;
      }
      return ResourceContext.builder()
              .resource(resource)
              .id(id)
              .resourceType(type)
              .versionId(text(resource.path("meta"), "versionId"))
              .lastUpdated(text(resource.path("meta"), "lastUpdated"))
              .subject(subject)
              .author(firstText(resource, AUTHOR_PATHS))
              .build();
   }

   private static String firstText(JsonNode root, String[][] paths) {
      for (String[] path : paths) {
         JsonNode node = root;
         for (String segment : path) {
            node = node.isArray() && Character.isDigit(segment.charAt(0))
                    ? node.path(Integer.parseInt(segment))
                    : node.path(segment);
         }
         if (node.isTextual()) {
            return node.asText();
         }
      }
      return null;
   }

   private static String text(JsonNode node, String field) {
      JsonNode value = node.path(field);
      return value.isTextual() ? value.asText() : null;
   }
}
