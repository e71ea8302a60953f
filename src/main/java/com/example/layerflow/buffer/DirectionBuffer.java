package com.example.layerflow.buffer;

import com.example.layerflow.model.LayerExpectation;
import com.example.layerflow.model.LayerRole;
import com.example.layerflow.model.ValidationOutcome;
import com.example.layerflow.model.ValidationRecord;
import com.example.layerflow.util.PayloadUtils;
import com.example.layerflow.validation.SchemaValidator;
import com.example.layerflow.validation.ValidationRule;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Transport envelope between two adjacent layers. The payload and metadata are frozen on
 * construction; the only thing that grows afterwards is the validation audit trail.
 */
@Slf4j
public class DirectionBuffer {

  public static final String CREATED_AT = "created_at";
  public static final String SOURCE_ROLE = "source_role";
  public static final String CORRELATION_ID = "correlation_id";

  private final LayerRole sourceRole;
  private final LayerRole targetRole;
  private final Map<String, Object> payload;
  private final Map<String, Object> metadata;
  private final List<ValidationRecord> validationResults = new ArrayList<>();
  private ValidationOutcome lastOutcome;

  public DirectionBuffer(
      LayerRole sourceRole, LayerRole targetRole, Map<String, Object> payload, Map<String, Object> metadata) {
    Objects.requireNonNull(sourceRole, "sourceRole");
    Objects.requireNonNull(targetRole, "targetRole");
    if (!sourceRole.isAdjacentTo(targetRole)) {
      throw new IllegalArgumentException(
          "Buffer must connect adjacent layers, got " + sourceRole + " -> " + targetRole);
    }
    this.sourceRole = sourceRole;
    this.targetRole = targetRole;
    this.payload = PayloadUtils.freeze(payload);
    Map<String, Object> meta = new LinkedHashMap<>();
    if (metadata != null) {
      meta.putAll(metadata);
    }
    meta.putIfAbsent(CREATED_AT, Instant.now().toString());
    meta.putIfAbsent(SOURCE_ROLE, sourceRole.getCode());
    this.metadata = PayloadUtils.freeze(meta);
  }

  /**
   * Checks the payload against the expectation of the target layer and appends the records
   * to the audit trail. Every rule is evaluated unless a fatal rule fails; quality gates and
   * payload size are checked after the rules.
   */
  public synchronized ValidationOutcome validate(LayerExpectation expectation) {
    Objects.requireNonNull(expectation, "expectation");
    if (expectation.getLayerRole() != targetRole) {
      throw new IllegalArgumentException(
          "Expectation for " + expectation.getLayerRole() + " cannot validate a buffer addressed to " + targetRole);
    }

    List<ValidationRecord> records = new ArrayList<>();
    records.add(SchemaValidator.check(
        SchemaValidator.SCHEMA_RULE, expectation.getInputSchema(), expectation.getRequiredFields(), payload));

    boolean fatalFailure = false;
    for (ValidationRule rule : expectation.getValidationRules()) {
      ValidationRecord record = evaluate(rule);
      records.add(record);
      if (!record.isPassed() && rule.fatal()) {
        fatalFailure = true;
        break;
      }
    }

    if (!fatalFailure) {
      expectation.getQualityRequirements().forEach((metric, minimum) -> records.add(qualityGate(metric, minimum)));
      expectation.getMaxPayloadBytes().ifPresent(limit -> records.add(payloadSizeCheck(limit)));
    }

    boolean passed = !fatalFailure && records.stream().allMatch(ValidationRecord::isPassed);
    ValidationOutcome outcome = ValidationOutcome.builder()
        .passed(passed)
        .fatalFailure(fatalFailure)
        .targetRole(targetRole)
        .payloadSize(PayloadUtils.sizeOf(payload))
        .records(List.copyOf(records))
        .build();

    validationResults.addAll(records);
    lastOutcome = outcome;
    log.debug("Buffer {} -> {} validated: {}", sourceRole, targetRole, outcome.summary());
    return outcome;
  }

  /**
   * Accepts a failed outcome without fatal failures. The waiver is appended to the audit
   * trail as its own record, the earlier failures stay in place.
   */
  public synchronized ValidationOutcome waive(String reason) {
    if (lastOutcome == null) {
      throw new IllegalStateException("cannot waive a buffer that has not been validated");
    }
    if (lastOutcome.isPassed()) {
      return lastOutcome;
    }
    if (lastOutcome.isFatalFailure()) {
      throw new IllegalStateException("fatal validation failures cannot be waived");
    }
    ValidationRecord waiver = ValidationRecord.pass("waiver", reason + ": " + lastOutcome.summary());
    validationResults.add(waiver);
    List<ValidationRecord> records = new ArrayList<>(lastOutcome.getRecords());
    records.add(waiver);
    lastOutcome = lastOutcome.toBuilder().passed(true).waived(true).records(List.copyOf(records)).build();
    log.warn("Buffer {} -> {} accepted with waived failures ({})", sourceRole, targetRole, reason);
    return lastOutcome;
  }

  private ValidationRecord evaluate(ValidationRule rule) {
    try {
      ValidationRule.Result result = rule.evaluate(payload);
      return result.isPassed()
          ? ValidationRecord.pass(rule.name(), result.getDetail())
          : ValidationRecord.fail(rule.name(), result.getDetail(), rule.fatal());
    } catch (RuntimeException ex) {
      log.warn("Validation rule '{}' threw while checking buffer {} -> {}", rule.name(), sourceRole, targetRole, ex);
      return ValidationRecord.fail(rule.name(), "rule error: " + ex.getMessage(), rule.fatal());
    }
  }

  private ValidationRecord qualityGate(String metric, double minimum) {
    String name = "quality:" + metric;
    return PayloadUtils.number(payload, metric)
        .map(actual -> actual >= minimum
            ? ValidationRecord.pass(name, actual + " >= " + minimum)
            : ValidationRecord.fail(name, actual + " below minimum " + minimum, false))
        .orElseGet(() -> ValidationRecord.fail(name, "metric '" + metric + "' not reported", false));
  }

  private ValidationRecord payloadSizeCheck(double limit) {
    String name = "performance:" + LayerExpectation.MAX_PAYLOAD_BYTES;
    long size = PayloadUtils.sizeOf(payload);
    return size >= 0 && size <= limit
        ? ValidationRecord.pass(name, size + " bytes")
        : ValidationRecord.fail(name, size + " bytes exceeds " + (long) limit, false);
  }

  public LayerRole getSourceRole() {
    return sourceRole;
  }

  public LayerRole getTargetRole() {
    return targetRole;
  }

  public Map<String, Object> getPayload() {
    return payload;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public Optional<String> getCorrelationId() {
    return Optional.ofNullable(metadata.get(CORRELATION_ID)).map(Object::toString);
  }

  public synchronized List<ValidationRecord> getValidationResults() {
    return Collections.unmodifiableList(new ArrayList<>(validationResults));
  }

  public synchronized boolean isValidated() {
    return lastOutcome != null;
  }

  public synchronized Optional<ValidationOutcome> getLastOutcome() {
    return Optional.ofNullable(lastOutcome);
  }
}
