package com.example.layerflow.model;

import java.util.Optional;

/** The three fixed positions of the pipeline, in execution order. */
public enum LayerRole {
  LEADING("leading"),
  INTERMEDIATE("intermediate"),
  TERMINAL("terminal");

  private final String code;

  LayerRole(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  /** The role that consumes this role's output, empty for {@link #TERMINAL}. */
  public Optional<LayerRole> next() {
    return switch (this) {
      case LEADING -> Optional.of(INTERMEDIATE);
      case INTERMEDIATE -> Optional.of(TERMINAL);
      case TERMINAL -> Optional.empty();
    };
  }

  public boolean isAdjacentTo(LayerRole target) {
    return next().map(n -> n == target).orElse(false);
  }

  public static LayerRole fromCode(String code) {
    for (LayerRole role : values()) {
      if (role.code.equalsIgnoreCase(code) || role.name().equalsIgnoreCase(code)) {
        return role;
      }
    }
    throw new IllegalArgumentException("Unknown layer role: " + code);
  }
}
