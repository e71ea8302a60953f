package com.example.layerflow.layer;

public enum StageFailureReason {
  TIMEOUT("timeout"),
  INTERNAL_ERROR("internal_error"),
  REMOTE_UNREACHABLE("remote_unreachable"),
  TRANSLATION_FAILED("translation_failed"),
  QUALITY_GATE("quality_gate_failed");

  private final String code;

  StageFailureReason(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
