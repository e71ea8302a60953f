package com.example.layerflow.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Execution log entry for one stage. {@code validationResults} holds the records of the
 * hand-off buffer built from this stage's output; it is empty for the terminal stage.
 */
@Value
@Builder(toBuilder = true)
public class StageRecord {
  LayerRole role;
  String layerName;
  Instant startedAt;
  Duration duration;
  boolean success;
  String failureReason;
  String failureDetail;
  @Builder.Default List<ValidationRecord> validationResults = List.of();
  @Builder.Default Map<String, Double> qualityMetrics = Map.of();
}
