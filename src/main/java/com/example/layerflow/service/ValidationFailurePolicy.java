package com.example.layerflow.service;

/** What the orchestrator does when a hand-off buffer fails validation. */
public enum ValidationFailurePolicy {
  /** Abort the run with {@code contract_violation}. */
  ABORT,
  /**
   * Waive non-fatal failures, recording the waiver in the buffer's audit trail, and keep
   * going. Fatal rule failures still abort.
   */
  CONTINUE
}
