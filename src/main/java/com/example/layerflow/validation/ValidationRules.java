package com.example.layerflow.validation;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/** Factory for the built-in {@link ValidationRule}s. */
public final class ValidationRules {

  private ValidationRules() {}

  /** Generic rule backed by a predicate over the whole payload. */
  public static ValidationRule of(String name, Predicate<Map<String, Object>> predicate) {
    return of(name, predicate, false);
  }

  public static ValidationRule of(String name, Predicate<Map<String, Object>> predicate, boolean fatal) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(predicate, "predicate");
    return new ValidationRule() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public boolean fatal() {
        return fatal;
      }

      @Override
      public Result evaluate(Map<String, Object> payload) {
        return predicate.test(payload) ? Result.pass("ok") : Result.fail("predicate not satisfied");
      }
    };
  }

  /** Same rule, but failure stops evaluation of the rules after it. */
  public static ValidationRule fatal(ValidationRule rule) {
    return new ValidationRule() {
      @Override
      public String name() {
        return rule.name();
      }

      @Override
      public boolean fatal() {
        return true;
      }

      @Override
      public Result evaluate(Map<String, Object> payload) {
        return rule.evaluate(payload);
      }
    };
  }

  /** {@code field > threshold}; non-numeric or missing values fail. */
  public static ValidationRule greaterThan(String field, double threshold) {
    return numeric(field + " > " + format(threshold), field, v -> v > threshold);
  }

  /** {@code field >= threshold}; non-numeric or missing values fail. */
  public static ValidationRule atLeast(String field, double threshold) {
    return numeric(field + " >= " + format(threshold), field, v -> v >= threshold);
  }

  /** {@code field <= threshold}; non-numeric or missing values fail. */
  public static ValidationRule atMost(String field, double threshold) {
    return numeric(field + " <= " + format(threshold), field, v -> v <= threshold);
  }

  /** String field present and not blank. */
  public static ValidationRule notBlank(String field) {
    String name = field + "_must_be_non_empty";
    return new ValidationRule() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public Result evaluate(Map<String, Object> payload) {
        Object value = payload.get(field);
        if (value instanceof CharSequence text && !text.toString().isBlank()) {
          return Result.pass("ok");
        }
        return Result.fail("field '" + field + "' is missing or blank");
      }
    };
  }

  /** Collection field holding at most {@code max} items; absent counts as empty. */
  public static ValidationRule maxItems(String field, int max) {
    String name = field + " has at most " + max + " items";
    return new ValidationRule() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public Result evaluate(Map<String, Object> payload) {
        Object value = payload.get(field);
        int size = value instanceof Collection<?> c ? c.size() : 0;
        if (value != null && !(value instanceof Collection<?>)) {
          return Result.fail("field '" + field + "' is not an array");
        }
        return size <= max
            ? Result.pass(size + " items")
            : Result.fail(size + " items exceeds limit of " + max);
      }
    };
  }

  private static ValidationRule numeric(String name, String field, Predicate<Double> check) {
    return new ValidationRule() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public Result evaluate(Map<String, Object> payload) {
        Object value = payload.get(field);
        if (!(value instanceof Number number)) {
          return Result.fail("field '" + field + "' is not numeric: " + value);
        }
        double actual = number.doubleValue();
        return check.test(actual)
            ? Result.pass("actual=" + format(actual))
            : Result.fail("actual=" + format(actual));
      }
    };
  }

  static String format(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value)) {
      return String.valueOf((long) value);
    }
    return String.valueOf(value);
  }
}
