package com.example.layerflow.model;

import com.example.layerflow.validation.ValidationRule;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable contract of a layer: what it accepts, what it produces, which rules a payload
 * handed to it must satisfy and which quality and performance bounds apply.
 *
 * <p>{@code requiredFields} defaults to every field of the input schema. Collections are
 * copied on construction, so an expectation cannot change once attached to a layer.
 */
@Value
public class LayerExpectation {

  public static final String MAX_DURATION_SECONDS = "max_duration_seconds";
  public static final String MAX_MEMORY_BYTES = "max_memory_bytes";
  public static final String MAX_PAYLOAD_BYTES = "max_payload_bytes";

  LayerRole layerRole;
  Map<String, FieldType> inputSchema;
  Set<String> requiredFields;
  Map<String, FieldType> outputSchema;
  List<ValidationRule> validationRules;
  Map<String, Double> qualityRequirements;
  Map<String, Double> performanceConstraints;

  @Builder(toBuilder = true)
  private LayerExpectation(
      LayerRole layerRole,
      Map<String, FieldType> inputSchema,
      Set<String> requiredFields,
      Map<String, FieldType> outputSchema,
      List<ValidationRule> validationRules,
      Map<String, Double> qualityRequirements,
      Map<String, Double> performanceConstraints) {
    this.layerRole = Objects.requireNonNull(layerRole, "layerRole");
    this.inputSchema = copy(inputSchema);
    this.requiredFields = requiredFields == null
        ? this.inputSchema.keySet()
        : Collections.unmodifiableSet(new LinkedHashSet<>(requiredFields));
    this.outputSchema = copy(outputSchema);
    this.validationRules = validationRules == null ? List.of() : List.copyOf(validationRules);
    this.qualityRequirements = copy(qualityRequirements);
    this.performanceConstraints = copy(performanceConstraints);
  }

  /** Expectation with no schema, rules or bounds for the given role. */
  public static LayerExpectation open(LayerRole role) {
    return LayerExpectation.builder().layerRole(role).build();
  }

  public Optional<Double> getMaxDurationSeconds() {
    return Optional.ofNullable(performanceConstraints.get(MAX_DURATION_SECONDS));
  }

  public Optional<Double> getMaxPayloadBytes() {
    return Optional.ofNullable(performanceConstraints.get(MAX_PAYLOAD_BYTES));
  }

  private static <V> Map<String, V> copy(Map<String, V> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
