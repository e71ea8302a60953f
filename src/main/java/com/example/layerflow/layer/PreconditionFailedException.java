package com.example.layerflow.layer;

import com.example.layerflow.model.ExecutionResult;
import com.example.layerflow.model.LayerRole;

/** A layer cannot meet its declared requirements; raised before any work starts. */
public class PreconditionFailedException extends LayerException {

  public PreconditionFailedException(LayerRole role, String message) {
    super(role, message);
  }

  public PreconditionFailedException(LayerRole role, String message, Throwable cause) {
    super(role, message, cause);
  }

  @Override
  public String reason() {
    return ExecutionResult.PRECONDITION_FAILED;
  }
}
