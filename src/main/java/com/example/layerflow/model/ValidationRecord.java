package com.example.layerflow.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** One entry of a buffer's append-only validation audit trail. */
@Value
@Builder
public class ValidationRecord {
  String ruleName;
  boolean passed;
  String detail;
  boolean fatal;
  Instant recordedAt;

  public static ValidationRecord pass(String ruleName, String detail) {
    return new ValidationRecord(ruleName, true, detail, false, Instant.now());
  }

  public static ValidationRecord fail(String ruleName, String detail, boolean fatal) {
    return new ValidationRecord(ruleName, false, detail, fatal, Instant.now());
  }
}
