package com.example.layerflow.layer;

import com.example.layerflow.buffer.DirectionBuffer;
import com.example.layerflow.model.LayerExpectation;
import com.example.layerflow.model.LayerRole;
import com.example.layerflow.model.LayerState;
import java.util.Map;
import java.util.Optional;
import reactor.core.publisher.Mono;

/**
 * A pipeline stage. Local stages and adapters to remote agent systems implement the same
 * contract, the orchestrator cannot tell them apart.
 */
public interface Layer {

  String name();

  LayerRole role();

  LayerExpectation expectation();

  LayerState state();

  /**
   * Does the stage's work. Output is checked against the layer's own output schema before it
   * is emitted; failures are signalled as {@link StageFailureException}.
   */
  Mono<Map<String, Object>> process(Map<String, Object> input);

  /** Pre-flight check: can this layer, as configured, satisfy the given requirements. */
  boolean validateRequirements(Map<String, Object> candidateRequirements);

  /** Attaches a validated buffer as input; rejects unvalidated or failed buffers. */
  void bindInput(DirectionBuffer buffer);

  Optional<DirectionBuffer> inputBuffer();

  /** Wraps output into a buffer addressed to {@code targetRole}, stamped with provenance. */
  DirectionBuffer emitOutput(LayerRole targetRole, Map<String, Object> data);

  /** Quality metrics the layer reports for one of its outputs. */
  Map<String, Double> qualityMetrics(Map<String, Object> output);
}
