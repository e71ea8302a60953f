package com.example.layerflow.layer;

import com.example.layerflow.model.LayerRole;

/** Root of the engine's error taxonomy. Each subtype maps to an abort reason code. */
public abstract class LayerException extends RuntimeException {

  private final LayerRole role;

  protected LayerException(LayerRole role, String message) {
    super(message);
    this.role = role;
  }

  protected LayerException(LayerRole role, String message, Throwable cause) {
    super(message, cause);
    this.role = role;
  }

  /** Layer that raised the error, null when not attributable to one layer. */
  public LayerRole getRole() {
    return role;
  }

  /** Machine readable reason, used as the abort reason of a run. */
  public abstract String reason();
}
