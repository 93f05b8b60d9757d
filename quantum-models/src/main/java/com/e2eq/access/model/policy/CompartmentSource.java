package com.e2eq.access.model.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Objects;

/**
 * Where the id of the compartment owner comes from.
 *
 * @param type  the source kind
 * @param value fixed id, only for {@link Kind#FIXED}
 * @param param query parameter name, only for {@link Kind#REQUEST_PARAM}
 */
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompartmentSource(@JsonProperty("type") Kind type,
                                @JsonProperty("value") String value,
                                @JsonProperty("param") String param) {

   public enum Kind {
      /** Patient or encounter selected at launch. */
      LAUNCH_CONTEXT("launch-context"),
      /** The user's own linked FHIR resource (fhirUser). */
      USER_RESOURCE("user-resource"),
      FIXED("fixed"),
      REQUEST_PARAM("request-param");

      private final String code;

      Kind(String code) {
         this.code = code;
      }

      @JsonValue
      public String code() {
         return code;
      }

      @JsonCreator
      public static Kind fromCode(String code) {
         for (Kind k : values()) {
            if (k.code.equals(code)) {
               return k;
            }
         }
         throw new IllegalArgumentException("Unknown compartment source: " + code);
      }
   }

   public CompartmentSource {
      Objects.requireNonNull(type, "compartment source type cannot be null");
   }

   public static CompartmentSource launchContext() {
      return new CompartmentSource(Kind.LAUNCH_CONTEXT, null, null);
   }

   public static CompartmentSource userResource() {
      return new CompartmentSource(Kind.USER_RESOURCE, null, null);
   }

   public static CompartmentSource fixed(String value) {
      return new CompartmentSource(Kind.FIXED, value, null);
   }

   public static CompartmentSource requestParam(String param) {
      return new CompartmentSource(Kind.REQUEST_PARAM, null, param);
   }
}
