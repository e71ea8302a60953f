package com.example.layerflow.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Result of a single {@code DirectionBuffer.validate} call. */
@Value
@Builder(toBuilder = true)
public class ValidationOutcome {
  boolean passed;
  boolean fatalFailure;
  boolean waived;
  LayerRole targetRole;
  long payloadSize;
  List<ValidationRecord> records;

  public List<ValidationRecord> failures() {
    return records.stream().filter(r -> !r.isPassed()).toList();
  }

  public String summary() {
    if (passed) {
      return "passed " + records.size() + " checks";
    }
    return failures().stream()
        .map(r -> r.getRuleName() + ": " + r.getDetail())
        .reduce((a, b) -> a + "; " + b)
        .orElse("failed");
  }
}
