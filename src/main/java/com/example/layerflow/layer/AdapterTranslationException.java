package com.example.layerflow.layer;

import com.example.layerflow.model.LayerRole;

/** A remote agent's response could not be mapped onto the declared output schema. */
public class AdapterTranslationException extends StageFailureException {

  public AdapterTranslationException(LayerRole role, String message) {
    super(role, StageFailureReason.TRANSLATION_FAILED, message);
  }

  public AdapterTranslationException(LayerRole role, String message, Throwable cause) {
    super(role, StageFailureReason.TRANSLATION_FAILED, message, cause);
  }
}
