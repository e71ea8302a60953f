package com.example.layerflow.service;

import com.example.layerflow.model.LayerRole;

/** States of a single workflow run, in the order a successful run passes through them. */
public enum OrchestratorState {
  IDLE,
  RUNNING_LEADING,
  VALIDATING_TO_INTERMEDIATE,
  RUNNING_INTERMEDIATE,
  VALIDATING_TO_TERMINAL,
  RUNNING_TERMINAL,
  COMPLETED,
  ABORTED;

  public static OrchestratorState running(LayerRole role) {
    return switch (role) {
      case LEADING -> RUNNING_LEADING;
      case INTERMEDIATE -> RUNNING_INTERMEDIATE;
      case TERMINAL -> RUNNING_TERMINAL;
    };
  }

  public static OrchestratorState validatingTo(LayerRole target) {
    return switch (target) {
      case INTERMEDIATE -> VALIDATING_TO_INTERMEDIATE;
      case TERMINAL -> VALIDATING_TO_TERMINAL;
      case LEADING -> throw new IllegalArgumentException("nothing hands off to the leading layer");
    };
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == ABORTED;
  }
}
