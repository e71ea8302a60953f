package com.example.layerflow.validation;

import com.example.layerflow.model.FieldType;
import com.example.layerflow.model.ValidationRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural check of a payload against a field schema. Required fields must be present
 * and non-null, present schema fields must have the declared shape and fields outside the
 * schema are passed through.
 */
public final class SchemaValidator {

  public static final String SCHEMA_RULE = "schema";

  private SchemaValidator() {}

  public static ValidationRecord check(
      String ruleName, Map<String, FieldType> schema, Set<String> required, Map<String, Object> payload) {
    if (payload == null) {
      return ValidationRecord.fail(ruleName, "payload is null", false);
    }
    List<String> missing = new ArrayList<>();
    List<String> mistyped = new ArrayList<>();

    for (String field : required) {
      if (payload.get(field) == null) {
        missing.add(field);
      }
    }
    for (Map.Entry<String, FieldType> entry : schema.entrySet()) {
      Object value = payload.get(entry.getKey());
      if (value != null && !entry.getValue().matches(value)) {
        mistyped.add(entry.getKey() + " (expected " + entry.getValue().getCode()
            + ", got " + value.getClass().getSimpleName() + ")");
      }
    }

    if (missing.isEmpty() && mistyped.isEmpty()) {
      return ValidationRecord.pass(ruleName, "all " + schema.size() + " schema fields conform");
    }
    StringBuilder detail = new StringBuilder();
    if (!missing.isEmpty()) {
      detail.append("missing fields: ").append(String.join(", ", missing));
    }
    if (!mistyped.isEmpty()) {
      if (detail.length() > 0) detail.append("; ");
      detail.append("mistyped fields: ").append(String.join(", ", mistyped));
    }
    return ValidationRecord.fail(ruleName, detail.toString(), false);
  }

  /** Convenience for checks against an output schema where every field is required. */
  public static ValidationRecord checkOutput(Map<String, FieldType> schema, Map<String, Object> payload) {
    return check("output-schema", schema, schema.keySet(), payload);
  }
}
