package com.example.layerflow.service;

import com.example.layerflow.buffer.DirectionBuffer;
import com.example.layerflow.config.OrchestratorProperties;
import com.example.layerflow.layer.ContractViolationException;
import com.example.layerflow.layer.Layer;
import com.example.layerflow.layer.LayerException;
import com.example.layerflow.layer.LeadingLayer;
import com.example.layerflow.layer.PreconditionFailedException;
import com.example.layerflow.layer.StageFailureException;
import com.example.layerflow.layer.StageFailureReason;
import com.example.layerflow.model.ExecutionResult;
import com.example.layerflow.model.ExecutionStatus;
import com.example.layerflow.model.LayerRole;
import com.example.layerflow.model.StageRecord;
import com.example.layerflow.model.ValidationOutcome;
import com.example.layerflow.model.ValidationRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Drives the fixed Leading → Intermediate → Terminal chain. Each hand-off is wrapped in a
 * {@link DirectionBuffer} and validated against the receiving layer's expectation before the
 * layer may consume it.
 *
 * <p>An instance runs one workflow at a time and never retries. Every failure, including
 * unexpected ones, ends in an {@link ExecutionStatus#ABORTED} result that keeps the partial
 * execution log; {@link #executeWorkflow} does not signal errors for stage failures.
 *
 * <p>Layers bound to this orchestrator must not be shared with another orchestrator running
 * concurrently, since binding an input buffer is per-instance state.
 */
@Slf4j
public class ThreeLayerOrchestrator {

  private static final String LEADING_TO_INTERMEDIATE = "leading_to_intermediate";
  private static final String INTERMEDIATE_TO_TERMINAL = "intermediate_to_terminal";

  private final Layer leading;
  private final Layer intermediate;
  private final Layer terminal;
  private final OrchestratorProperties properties;
  private final QualityAggregator qualityAggregator;

  private final AtomicBoolean running = new AtomicBoolean();
  private volatile OrchestratorState state = OrchestratorState.IDLE;
  private volatile Run current;

  public ThreeLayerOrchestrator(Layer leading, Layer intermediate, Layer terminal) {
    this(leading, intermediate, terminal, new OrchestratorProperties());
  }

  public ThreeLayerOrchestrator(
      Layer leading, Layer intermediate, Layer terminal, OrchestratorProperties properties) {
    this.leading = requireRole(leading, LayerRole.LEADING);
    this.intermediate = requireRole(intermediate, LayerRole.INTERMEDIATE);
    this.terminal = requireRole(terminal, LayerRole.TERMINAL);
    this.properties = Objects.requireNonNull(properties, "properties");
    this.qualityAggregator =
        new QualityAggregator(properties.getQualityAggregation(), properties.getWeights());
  }

  /**
   * Runs the three layers over {@code initialRequest}. Emits exactly one result, completed or
   * aborted. Cancelling the subscription aborts the run with reason {@code cancelled}.
   */
  public Mono<ExecutionResult> executeWorkflow(Map<String, Object> initialRequest) {
    return Mono.defer(() -> {
      if (!running.compareAndSet(false, true)) {
        return Mono.error(new IllegalStateException("a workflow is already running on this orchestrator"));
      }
      Run run = new Run();
      current = run;
      state = OrchestratorState.IDLE;
      Map<String, Object> request = initialRequest == null ? Map.of() : initialRequest;
      log.info("3-layer workflow start: run={}, layers=[{}, {}, {}], fields={}",
          run.runId, leading.name(), intermediate.name(), terminal.name(), request.keySet());

      return Mono.fromRunnable(this::checkPreconditions)
          .then(Mono.defer(() -> runStage(leading, request, run)))
          .flatMap(out -> handOff(leading, intermediate, out, run))
          .flatMap(payload -> runStage(intermediate, payload, run))
          .flatMap(out -> handOff(intermediate, terminal, out, run))
          .flatMap(payload -> runStage(terminal, payload, run))
          .map(out -> complete(out, run))
          .onErrorResume(ex -> Mono.just(abort(ex, run)))
          .doOnCancel(() -> cancel(run))
          .doFinally(signal -> running.set(false));
    });
  }

  public OrchestratorState getState() {
    return state;
  }

  /** Log of the current or most recent run. */
  public List<StageRecord> getExecutionLog() {
    Run run = current;
    return run == null ? List.of() : List.copyOf(run.executionLog);
  }

  /** Summary of the current or most recent run: steps, log and per hand-off validations. */
  public Map<String, Object> executionSummary() {
    Run run = current;
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("state", state.name());
    summary.put("total_steps", run == null ? 0 : run.executionLog.size());
    summary.put("execution_log", getExecutionLog());
    List<Map<String, Object>> validations = new ArrayList<>();
    if (run != null) {
      run.handoffs.forEach((name, buffer) -> buffer.getValidationResults()
          .forEach(record -> validations.add(Map.of("buffer", name, "validation", record))));
    }
    summary.put("buffer_validations", validations);
    return summary;
  }

  // ---- preconditions ----

  private void checkPreconditions() {
    for (Layer layer : List.of(leading, intermediate, terminal)) {
      Map<String, Object> candidate = requirementsFor(layer);
      boolean satisfied;
      try {
        satisfied = layer.validateRequirements(candidate);
      } catch (RuntimeException ex) {
        throw new PreconditionFailedException(layer.role(),
            layer.name() + " requirement check failed: " + ex.getMessage(), ex);
      }
      if (!satisfied) {
        throw new PreconditionFailedException(layer.role(),
            layer.name() + " cannot satisfy requirements " + candidate);
      }
    }
  }

  private Map<String, Object> requirementsFor(Layer layer) {
    Map<String, Object> candidate = new LinkedHashMap<>(layer.expectation().getPerformanceConstraints());
    candidate.putAll(layer.expectation().getQualityRequirements());
    Map<String, Object> configured = properties.getRequirements().get(layer.role().getCode());
    if (configured != null) {
      candidate.putAll(configured);
    }
    if (leading instanceof LeadingLayer directing && layer != leading) {
      candidate.putAll(directing.downstreamRequirements(layer.role()));
    }
    return candidate;
  }

  // ---- stages ----

  private Mono<Map<String, Object>> runStage(Layer layer, Map<String, Object> input, Run run) {
    return Mono.defer(() -> {
      state = OrchestratorState.running(layer.role());
      Instant startedAt = Instant.now();
      long start = System.nanoTime();
      run.stageStart = start;
      run.stageStartedAt = startedAt;
      run.lastDuration = null;

      Mono<Map<String, Object>> work = layer.process(input);
      Optional<Duration> limit = stageTimeout(layer);
      if (limit.isPresent()) {
        Duration max = limit.get();
        work = work.timeout(max)
            .onErrorMap(TimeoutException.class, ex -> new StageFailureException(layer.role(),
                StageFailureReason.TIMEOUT,
                layer.name() + " exceeded max_duration_seconds=" + max.toMillis() / 1000.0, ex));
      }
      return work
          .doOnError(ex -> run.executionLog.add(failedStage(layer, run, reasonOf(ex), ex.getMessage(), List.of())))
          .doOnNext(out -> {
            run.lastDuration = Duration.ofNanos(System.nanoTime() - start);
            if (layer.role() == LayerRole.TERMINAL) {
              run.executionLog.add(stageRecord(layer, run, true, null, null, List.of(), layer.qualityMetrics(out)));
            }
          });
    });
  }

  private Optional<Duration> stageTimeout(Layer layer) {
    Optional<Duration> declared = layer.expectation().getMaxDurationSeconds()
        .filter(seconds -> seconds > 0)
        .map(seconds -> Duration.ofNanos((long) (seconds * 1_000_000_000L)));
    return declared.or(() -> Optional.ofNullable(properties.getDefaultStageTimeout()));
  }

  // ---- hand-offs ----

  private Mono<Map<String, Object>> handOff(Layer source, Layer target, Map<String, Object> output, Run run) {
    return Mono.fromCallable(() -> {
      state = OrchestratorState.validatingTo(target.role());
      DirectionBuffer buffer = source.emitOutput(target.role(), output);
      run.handoffs.put(source.role() == LayerRole.LEADING ? LEADING_TO_INTERMEDIATE : INTERMEDIATE_TO_TERMINAL, buffer);
      if (run.correlationId == null) {
        run.correlationId = buffer.getCorrelationId().orElse(run.runId);
      }

      ValidationOutcome outcome = buffer.validate(target.expectation());
      if (!outcome.isPassed()) {
        outcome = applyPolicy(buffer, outcome, source, target);
      }
      if (!outcome.isPassed()) {
        run.executionLog.add(failedStage(source, run, ExecutionResult.CONTRACT_VIOLATION,
            outcome.summary(), outcome.getRecords()).toBuilder().duration(run.lastDuration).build());
        throw new ContractViolationException(target.role(),
            "output of " + source.name() + " violates the contract of " + target.name() + ": " + outcome.summary(),
            buffer.getValidationResults());
      }

      run.executionLog.add(stageRecord(source, run, true, null, null,
          outcome.getRecords(), source.qualityMetrics(output)));
      target.bindInput(buffer);
      return buffer.getPayload();
    });
  }

  private ValidationOutcome applyPolicy(
      DirectionBuffer buffer, ValidationOutcome outcome, Layer source, Layer target) {
    if (properties.getValidationFailurePolicy() == ValidationFailurePolicy.CONTINUE && !outcome.isFatalFailure()) {
      log.warn("Hand-off {} -> {} failed validation, continuing by policy: {}",
          source.name(), target.name(), outcome.summary());
      return buffer.waive("policy=CONTINUE");
    }
    log.warn("Hand-off {} -> {} failed validation: {}", source.name(), target.name(), outcome.summary());
    return outcome;
  }

  // ---- results ----

  private ExecutionResult complete(Map<String, Object> finalOutput, Run run) {
    state = OrchestratorState.COMPLETED;
    ExecutionResult result = ExecutionResult.builder()
        .correlationId(run.correlationId())
        .status(ExecutionStatus.COMPLETED)
        .finalOutput(finalOutput)
        .qualityScore(qualityAggregator.aggregate(run.executionLog))
        .executionLog(List.copyOf(run.executionLog))
        .validationTrail(run.trail())
        .totalDuration(run.elapsed())
        .build();
    log.info("3-layer workflow complete: run={}, quality={}, duration={}ms",
        run.runId, result.getQualityScore(), result.getTotalDuration().toMillis());
    return result;
  }

  private ExecutionResult abort(Throwable ex, Run run) {
    state = OrchestratorState.ABORTED;
    String reason = reasonOf(ex);
    if (ex instanceof LayerException) {
      log.warn("3-layer workflow aborted: run={}, reason={}, detail={}", run.runId, reason, ex.getMessage());
    } else {
      log.error("3-layer workflow aborted by unexpected error: run={}", run.runId, ex);
    }
    return ExecutionResult.builder()
        .correlationId(run.correlationId())
        .status(ExecutionStatus.ABORTED)
        .abortReason(reason)
        .failureDetail(ex.getMessage())
        .executionLog(List.copyOf(run.executionLog))
        .validationTrail(run.trail())
        .totalDuration(run.elapsed())
        .build();
  }

  private void cancel(Run run) {
    state = OrchestratorState.ABORTED;
    log.info("3-layer workflow cancelled: run={}, completed stages={}", run.runId, run.executionLog.size());
  }

  private static String reasonOf(Throwable ex) {
    if (ex instanceof LayerException layerException) {
      return layerException.reason();
    }
    return StageFailureReason.INTERNAL_ERROR.getCode();
  }

  private StageRecord failedStage(
      Layer layer, Run run, String reason, String detail, List<ValidationRecord> records) {
    return stageRecord(layer, run, false, reason, detail, records, Map.of());
  }

  private static StageRecord stageRecord(Layer layer, Run run, boolean success, String reason, String detail,
      List<ValidationRecord> records, Map<String, Double> metrics) {
    Duration duration = run.lastDuration != null && success
        ? run.lastDuration
        : Duration.ofNanos(System.nanoTime() - run.stageStart);
    return StageRecord.builder()
        .role(layer.role())
        .layerName(layer.name())
        .startedAt(run.stageStartedAt)
        .duration(duration)
        .success(success)
        .failureReason(reason)
        .failureDetail(detail)
        .validationResults(List.copyOf(records))
        .qualityMetrics(Map.copyOf(metrics))
        .build();
  }

  private static Layer requireRole(Layer layer, LayerRole role) {
    Objects.requireNonNull(layer, role.getCode() + " layer");
    if (layer.role() != role) {
      throw new IllegalArgumentException(layer.name() + " has role " + layer.role() + ", expected " + role);
    }
    return layer;
  }

  /** Mutable state of one run; only touched by that run's sequential chain. */
  private static final class Run {
    private final String runId = UUID.randomUUID().toString();
    private final long startNanos = System.nanoTime();
    private final List<StageRecord> executionLog = new ArrayList<>();
    private final Map<String, DirectionBuffer> handoffs = new LinkedHashMap<>();
    private String correlationId;
    private long stageStart = System.nanoTime();
    private Instant stageStartedAt;
    private Duration lastDuration;

    private String correlationId() {
      return correlationId == null ? runId : correlationId;
    }

    private Duration elapsed() {
      return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private List<ValidationRecord> trail() {
      List<ValidationRecord> trail = new ArrayList<>();
      handoffs.values().forEach(buffer -> trail.addAll(buffer.getValidationResults()));
      return List.copyOf(trail);
    }
  }
}
