package com.example.layerflow.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Outcome of one full pipeline run. Either completed with output or aborted with a reason. */
@Value
@Builder
public class ExecutionResult {

  public static final String PRECONDITION_FAILED = "precondition_failed";
  public static final String CONTRACT_VIOLATION = "contract_violation";
  public static final String CANCELLED = "cancelled";

  String correlationId;
  ExecutionStatus status;
  String abortReason;
  String failureDetail;
  Map<String, Object> finalOutput;
  Double qualityScore;
  @Builder.Default List<StageRecord> executionLog = List.of();
  @Builder.Default List<ValidationRecord> validationTrail = List.of();
  Duration totalDuration;

  public boolean isCompleted() {
    return status == ExecutionStatus.COMPLETED;
  }

  public List<StageRecord> stagesFor(LayerRole role) {
    return executionLog.stream().filter(s -> s.getRole() == role).toList();
  }
}
