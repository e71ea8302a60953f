package com.example.layerflow.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Helpers for the JSON-shaped {@code Map<String, Object>} payloads passed between layers.
 * Bean properties are mapped to snake_case keys.
 */
public final class PayloadUtils {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private PayloadUtils() {}

  public static ObjectMapper mapper() {
    return OBJECT_MAPPER;
  }

  /** Converts a bean or map into a mutable JSON-shaped map. */
  public static Map<String, Object> toPayload(Object value) {
    if (value == null) {
      return new LinkedHashMap<>();
    }
    return OBJECT_MAPPER.convertValue(value, MAP_TYPE);
  }

  public static <T> T fromPayload(Map<String, Object> payload, Class<T> type) {
    return OBJECT_MAPPER.convertValue(payload, type);
  }

  /** Deep, unmodifiable copy. Nested maps and collections are copied as well. */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> freeze(Map<String, Object> payload) {
    if (payload == null) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    payload.forEach((k, v) -> copy.put(k, freezeValue(v)));
    return Collections.unmodifiableMap(copy);
  }

  @SuppressWarnings("unchecked")
  private static Object freezeValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return freeze((Map<String, Object>) map);
    }
    if (value instanceof Collection<?> collection) {
      List<Object> copy = new ArrayList<>(collection.size());
      collection.forEach(item -> copy.add(freezeValue(item)));
      return Collections.unmodifiableList(copy);
    }
    return value;
  }

  /** Size of the payload serialised as UTF-8 JSON, or -1 when it cannot be serialised. */
  public static long sizeOf(Map<String, Object> payload) {
    try {
      return OBJECT_MAPPER.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8).length;
    } catch (JsonProcessingException ex) {
      return -1;
    }
  }

  public static Optional<Double> number(Map<String, Object> payload, String key) {
    if (payload == null) {
      return Optional.empty();
    }
    Object value = payload.get(key);
    return value instanceof Number n ? Optional.of(n.doubleValue()) : Optional.empty();
  }
}
