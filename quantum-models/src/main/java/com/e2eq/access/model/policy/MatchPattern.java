package com.e2eq.access.model.policy;

import com.e2eq.access.util.WildCardMatcher;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * String pattern used to match identifiers such as client ids.
 * JSON accepts {@code {"type":"prefix","value":"app-"}} or a bare string, which is an
 * exact pattern unless it contains {@code *} or {@code ?}.
 */
@RegisterForReflection
public record MatchPattern(Kind type, String value) {

   public enum Kind {
      EXACT,
      PREFIX,
      SUFFIX,
      REGEX,
      WILDCARD;

      public String code() {
         return name().toLowerCase(Locale.ROOT);
      }
   }

   public MatchPattern {
      Objects.requireNonNull(type, "pattern type cannot be null");
      Objects.requireNonNull(value, "pattern value cannot be null");
   }

   @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
   public static MatchPattern of(String value) {
      return WildCardMatcher.isWildcard(value) ? new MatchPattern(Kind.WILDCARD, value) : new MatchPattern(Kind.EXACT, value);
   }

   @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
   static MatchPattern fromJson(@JsonProperty("type") String type,
                                @JsonProperty("value") @JsonAlias("pattern") String value) {
      if (type == null) {
         return of(value);
      }
      return new MatchPattern(Kind.valueOf(type.toUpperCase(Locale.ROOT)), value);
   }

   public static MatchPattern exact(String value) {
      return new MatchPattern(Kind.EXACT, value);
   }

   public static MatchPattern prefix(String value) {
      return new MatchPattern(Kind.PREFIX, value);
   }

   public static MatchPattern suffix(String value) {
      return new MatchPattern(Kind.SUFFIX, value);
   }

   public static MatchPattern regex(String value) {
      return new MatchPattern(Kind.REGEX, value);
   }

   public static MatchPattern wildcard(String value) {
      return new MatchPattern(Kind.WILDCARD, value);
   }

   @JsonValue
   Map<String, String> toJson() {
      Map<String, String> json = new LinkedHashMap<>();
      json.put("type", type.code());
      json.put("value", value);
      return json;
   }
}
