package com.example.layerflow.model;

import java.util.Collection;
import java.util.Map;

/**
 * Shape of a single payload field. Matching is done against the plain Java values that
 * Jackson produces for a JSON document (String, Number, Boolean, List, Map).
 */
public enum FieldType {
  STRING,
  NUMBER,
  BOOLEAN,
  ARRAY,
  OBJECT,
  ANY;

  public boolean matches(Object value) {
    if (value == null) {
      return false;
    }
    return switch (this) {
      case STRING -> value instanceof CharSequence;
      case NUMBER -> value instanceof Number;
      case BOOLEAN -> value instanceof Boolean;
      case ARRAY -> value instanceof Collection<?> || value.getClass().isArray();
      case OBJECT -> value instanceof Map<?, ?>;
      case ANY -> true;
    };
  }

  public String getCode() {
    return name().toLowerCase();
  }
}
