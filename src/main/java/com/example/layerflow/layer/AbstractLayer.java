package com.example.layerflow.layer;

import com.example.layerflow.buffer.DirectionBuffer;
import com.example.layerflow.model.LayerExpectation;
import com.example.layerflow.model.LayerRole;
import com.example.layerflow.model.LayerState;
import com.example.layerflow.model.ValidationOutcome;
import com.example.layerflow.model.ValidationRecord;
import com.example.layerflow.validation.SchemaValidator;
import com.example.layerflow.validation.ValidationRule;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Base implementation of the {@link Layer} contract. Subclasses provide {@link #doProcess};
 * binding, output schema enforcement, provenance stamping and requirement checks live here.
 */
@Slf4j
public abstract class AbstractLayer implements Layer {

  public static final String REQUIRED_CAPABILITIES = "required_capabilities";
  public static final String SOURCE_LAYER = "source_layer";

  private static final Set<String> METRIC_KEYS = Set.of("quality", "quality_score", "confidence_score");
  private static final List<String> COST_KEYS =
      List.of(LayerExpectation.MAX_DURATION_SECONDS, LayerExpectation.MAX_MEMORY_BYTES);

  private final String name;
  private final LayerExpectation expectation;
  private volatile DirectionBuffer inputBuffer;
  private volatile LayerState state = LayerState.UNBOUND;

  protected AbstractLayer(String name, LayerExpectation expectation) {
    this.name = Objects.requireNonNull(name, "name");
    this.expectation = Objects.requireNonNull(expectation, "expectation");
  }

  /** The stage's own work. Input is never null. */
  protected abstract Mono<Map<String, Object>> doProcess(Map<String, Object> input);

  /** Capabilities advertised to the pre-flight requirement check. */
  protected Set<String> capabilities() {
    return Set.of();
  }

  /** Expected resource usage per invocation, keyed like performance constraints. */
  protected Map<String, Double> estimatedCosts() {
    return Map.of();
  }

  /** Whether {@link #process} needs a bound, validated input buffer. */
  protected boolean requiresBoundInput() {
    return true;
  }

  protected Map<String, Object> beforeProcess(Map<String, Object> input) {
    return input;
  }

  protected Map<String, Object> afterProcess(Map<String, Object> output) {
    return output;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public LayerRole role() {
    return expectation.getLayerRole();
  }

  @Override
  public LayerExpectation expectation() {
    return expectation;
  }

  @Override
  public LayerState state() {
    return state;
  }

  @Override
  public Optional<DirectionBuffer> inputBuffer() {
    return Optional.ofNullable(inputBuffer);
  }

  @Override
  public final Mono<Map<String, Object>> process(Map<String, Object> input) {
    return Mono.defer(() -> {
      if (requiresBoundInput() && state != LayerState.READY) {
        return Mono.error(new ContractViolationException(
            role(), name + " has no validated input buffer bound (state " + state + ")"));
      }
      Map<String, Object> prepared = beforeProcess(input == null ? Map.of() : input);
      return doProcess(prepared)
          .switchIfEmpty(Mono.error(() -> new StageFailureException(
              role(), StageFailureReason.INTERNAL_ERROR, name + " produced no output")))
          .map(this::checkOwnOutput)
          .map(this::afterProcess)
          .doOnNext(out -> state = LayerState.PROCESSED);
    }).onErrorMap(ex -> !(ex instanceof LayerException), this::toStageFailure);
  }

  /**
   * Checks a raw request against this layer's own input schema and rules. Used by layers that
   * receive external input rather than a validated buffer.
   */
  protected Map<String, Object> checkRequest(Map<String, Object> request) {
    List<ValidationRecord> records = new ArrayList<>();
    records.add(SchemaValidator.check(SchemaValidator.SCHEMA_RULE,
        expectation.getInputSchema(), expectation.getRequiredFields(), request));
    for (ValidationRule rule : expectation.getValidationRules()) {
      ValidationRule.Result result = rule.evaluate(request);
      records.add(result.isPassed()
          ? ValidationRecord.pass(rule.name(), result.getDetail())
          : ValidationRecord.fail(rule.name(), result.getDetail(), rule.fatal()));
      if (!result.isPassed() && rule.fatal()) {
        break;
      }
    }
    List<ValidationRecord> failures = records.stream().filter(r -> !r.isPassed()).toList();
    if (!failures.isEmpty()) {
      throw new ContractViolationException(role(), name + " rejected request: "
          + failures.stream().map(r -> r.getRuleName() + ": " + r.getDetail()).toList(), records);
    }
    return request;
  }

  private Map<String, Object> checkOwnOutput(Map<String, Object> output) {
    ValidationRecord check = SchemaValidator.checkOutput(expectation.getOutputSchema(), output);
    if (!check.isPassed()) {
      throw new StageFailureException(role(), StageFailureReason.INTERNAL_ERROR,
          name + " output does not match its declared output schema: " + check.getDetail());
    }
    return new LinkedHashMap<>(output);
  }

  private StageFailureException toStageFailure(Throwable ex) {
    log.warn("[{}] processing failed: {}", name, ex.toString());
    return new StageFailureException(role(), StageFailureReason.INTERNAL_ERROR,
        name + " failed: " + ex.getMessage(), ex);
  }

  @Override
  public boolean validateRequirements(Map<String, Object> candidateRequirements) {
    if (candidateRequirements == null || candidateRequirements.isEmpty()) {
      return true;
    }
    Object required = candidateRequirements.get(REQUIRED_CAPABILITIES);
    if (required instanceof Collection<?> wanted) {
      Set<String> available = capabilities();
      for (Object capability : wanted) {
        if (!available.contains(String.valueOf(capability))) {
          log.info("[{}] missing capability '{}'", name, capability);
          return false;
        }
      }
    }
    Map<String, Double> costs = estimatedCosts();
    for (String key : COST_KEYS) {
      Object bound = candidateRequirements.get(key);
      Double estimate = costs.get(key);
      if (bound instanceof Number limit && estimate != null && estimate > limit.doubleValue()) {
        log.info("[{}] estimated {}={} exceeds bound {}", name, key, estimate, limit);
        return false;
      }
    }
    return true;
  }

  @Override
  public void bindInput(DirectionBuffer buffer) {
    Objects.requireNonNull(buffer, "buffer");
    if (buffer.getTargetRole() != role()) {
      throw new ContractViolationException(role(),
          "buffer addressed to " + buffer.getTargetRole() + " cannot be bound to " + role());
    }
    ValidationOutcome outcome = buffer.getLastOutcome().orElseThrow(() ->
        new ContractViolationException(role(), "buffer has not been validated"));
    if (!outcome.isPassed()) {
      throw new ContractViolationException(role(),
          "buffer failed validation: " + outcome.summary(), buffer.getValidationResults());
    }
    this.inputBuffer = buffer;
    this.state = LayerState.READY;
  }

  @Override
  public DirectionBuffer emitOutput(LayerRole targetRole, Map<String, Object> data) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(DirectionBuffer.CREATED_AT, Instant.now().toString());
    metadata.put(DirectionBuffer.SOURCE_ROLE, role().getCode());
    metadata.put(SOURCE_LAYER, name);
    metadata.put(DirectionBuffer.CORRELATION_ID, inputBuffer()
        .flatMap(DirectionBuffer::getCorrelationId)
        .orElseGet(() -> UUID.randomUUID().toString()));
    return new DirectionBuffer(role(), targetRole, data, metadata);
  }

  @Override
  public Map<String, Double> qualityMetrics(Map<String, Object> output) {
    Map<String, Double> metrics = new LinkedHashMap<>();
    if (output == null) {
      return metrics;
    }
    output.forEach((key, value) -> {
      if (value instanceof Number number
          && (METRIC_KEYS.contains(key) || expectation.getQualityRequirements().containsKey(key))) {
        metrics.put(key, number.doubleValue());
      }
    });
    return metrics;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + name + ", " + role() + ", " + state + "]";
  }
}
