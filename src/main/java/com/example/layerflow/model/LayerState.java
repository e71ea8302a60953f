package com.example.layerflow.model;

/** Lifecycle of a layer instance within a single invocation. */
public enum LayerState {
  /** No input buffer bound yet. */
  UNBOUND,
  /** A validated buffer is bound and has not been processed. */
  READY,
  /** Output produced for the bound buffer. */
  PROCESSED
}
