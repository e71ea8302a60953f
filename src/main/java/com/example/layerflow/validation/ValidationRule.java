package com.example.layerflow.validation;

import java.util.Map;
import java.util.Objects;
import lombok.Value;

/**
 * Named predicate over a proposed payload. A fatal rule stops evaluation of the remaining
 * rules when it fails.
 */
public interface ValidationRule {

  String name();

  default boolean fatal() {
    return false;
  }

  Result evaluate(Map<String, Object> payload);

  @Value
  class Result {
    boolean passed;
    String detail;

    public static Result pass(String detail) {
      return new Result(true, Objects.requireNonNullElse(detail, "ok"));
    }

    public static Result fail(String detail) {
      return new Result(false, Objects.requireNonNullElse(detail, "failed"));
    }
  }
}
