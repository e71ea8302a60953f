package com.example.layerflow.layer;

import com.example.layerflow.model.LayerRole;
import java.util.Objects;

/** A layer's own processing failed or exceeded its performance constraints. */
public class StageFailureException extends LayerException {

  private final StageFailureReason failureReason;

  public StageFailureException(LayerRole role, StageFailureReason failureReason, String message) {
    super(role, message);
    this.failureReason = Objects.requireNonNull(failureReason, "failureReason");
  }

  public StageFailureException(LayerRole role, StageFailureReason failureReason, String message, Throwable cause) {
    super(role, message, cause);
    this.failureReason = Objects.requireNonNull(failureReason, "failureReason");
  }

  public StageFailureReason getFailureReason() {
    return failureReason;
  }

  @Override
  public String reason() {
    return failureReason.getCode();
  }
}
