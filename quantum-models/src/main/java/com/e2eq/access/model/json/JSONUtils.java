package com.e2eq.access.model.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

/**
 * Shared {@link ObjectMapper} for policy documents, contexts handed to script engines
 * and token payloads.
 */
public class JSONUtils {
   private static final JSONUtils instance = new JSONUtils();
   protected final ObjectMapper mapper;

   private JSONUtils() {
      mapper = new ObjectMapper();
      mapper.registerModule(new JavaTimeModule());
      mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
      mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
      mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
      mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
   }

   public static JSONUtils instance() {
      return instance;
   }

   public ObjectMapper mapper() {
      return mapper;
   }

   public String toJson(Object value) throws JsonProcessingException {
      return mapper.writeValueAsString(value);
   }

   public JsonNode toTree(Object value) {
      return mapper.valueToTree(value);
   }

   @SuppressWarnings("unchecked")
   public Map<String, Object> toMap(Object value) {
      return mapper.convertValue(value, Map.class);
   }
}
