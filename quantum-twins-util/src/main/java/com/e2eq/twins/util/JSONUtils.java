package com.e2eq.twins.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.UncheckedIOException;

public class JSONUtils {
   private static final JSONUtils instance = new JSONUtils();
   protected ObjectMapper mapper;

   private JSONUtils() {
      mapper = new ObjectMapper();
      mapper.registerModule(new JavaTimeModule());
      mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
      mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
   }

   public static JSONUtils instance() {
      return instance;
   }

   public ObjectMapper getMapper() {
      return mapper;
   }

   public ObjectNode createObjectNode() {
      return mapper.createObjectNode();
   }

   /**
    * Parses the text into a tree, raising {@link IllegalArgumentException} for malformed JSON.
    */
   public JsonNode readTree(String json) {
      try {
         return mapper.readTree(json);
      } catch (JsonProcessingException e) {
         throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
      }
   }

   public String writeValueAsString(Object value) {
      try {
         return mapper.writeValueAsString(value);
      } catch (JsonProcessingException e) {
         throw new UncheckedIOException(e);
      }
   }

   public <T> T convertValue(Object value, Class<T> type) {
      return mapper.convertValue(value, type);
   }

   public JsonNode valueToTree(Object value) {
      return mapper.valueToTree(value);
   }
}
