package com.example.layerflow.layer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.layerflow.buffer.DirectionBuffer;
import com.example.layerflow.model.FieldType;
import com.example.layerflow.model.LayerExpectation;
import com.example.layerflow.model.LayerRole;
import com.example.layerflow.model.LayerState;
import com.example.layerflow.validation.ValidationRules;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class AbstractLayerTest {

  private static final LayerExpectation INTERMEDIATE = LayerExpectation.builder()
      .layerRole(LayerRole.INTERMEDIATE)
      .inputSchema(Map.of("claim_count", FieldType.NUMBER))
      .validationRules(List.of(ValidationRules.greaterThan("claim_count", 0)))
      .outputSchema(Map.of("verified", FieldType.BOOLEAN))
      .build();

  private static DirectionBuffer validated(Map<String, Object> payload) {
    DirectionBuffer buffer = new DirectionBuffer(LayerRole.LEADING, LayerRole.INTERMEDIATE, payload,
        Map.of(DirectionBuffer.CORRELATION_ID, "corr-42"));
    buffer.validate(INTERMEDIATE);
    return buffer;
  }

  private static StubLayers.Intermediate intermediate(Map<String, Object> output) {
    return new StubLayers.Intermediate("critic", INTERMEDIATE, StubLayers.emit(output));
  }

  @Test
  void bindingValidatedBufferMakesLayerReady() {
    StubLayers.Intermediate layer = intermediate(Map.of("verified", true));
    assertThat(layer.state()).isEqualTo(LayerState.UNBOUND);

    layer.bindInput(validated(Map.of("claim_count", 2)));

    assertThat(layer.state()).isEqualTo(LayerState.READY);
    assertThat(layer.inputBuffer()).isPresent();
  }

  @Test
  void bindingRejectsUnvalidatedFailedOrMisaddressedBuffers() {
    StubLayers.Intermediate layer = intermediate(Map.of("verified", true));
    DirectionBuffer unvalidated = new DirectionBuffer(LayerRole.LEADING, LayerRole.INTERMEDIATE,
        Map.of("claim_count", 2), Map.of());
    DirectionBuffer failed = validated(Map.of("claim_count", 0));
    DirectionBuffer toTerminal = new DirectionBuffer(LayerRole.INTERMEDIATE, LayerRole.TERMINAL, Map.of(), Map.of());

    assertThatThrownBy(() -> layer.bindInput(unvalidated)).isInstanceOf(ContractViolationException.class);
    assertThatThrownBy(() -> layer.bindInput(failed))
        .isInstanceOf(ContractViolationException.class)
        .satisfies(ex -> assertThat(((ContractViolationException) ex).getValidationResults()).isNotEmpty());
    assertThatThrownBy(() -> layer.bindInput(toTerminal)).isInstanceOf(ContractViolationException.class);
    assertThat(layer.state()).isEqualTo(LayerState.UNBOUND);
  }

  @Test
  void processWithoutBoundInputIsContractViolation() {
    StubLayers.Intermediate layer = intermediate(Map.of("verified", true));

    assertThatThrownBy(() -> layer.process(Map.of("claim_count", 2)).block())
        .isInstanceOf(ContractViolationException.class);
    assertThat(layer.calls).hasValue(0);
  }

  @Test
  void processMarksLayerProcessed() {
    StubLayers.Intermediate layer = intermediate(Map.of("verified", true, "quality", 0.9));
    layer.bindInput(validated(Map.of("claim_count", 2)));

    Map<String, Object> out = layer.process(Map.of("claim_count", 2)).block();

    assertThat(out).containsEntry("verified", true);
    assertThat(layer.state()).isEqualTo(LayerState.PROCESSED);
    assertThat(layer.qualityMetrics(out)).containsEntry("quality", 0.9);
  }

  @Test
  void outputViolatingOwnSchemaIsStageFailure() {
    StubLayers.Intermediate layer = intermediate(Map.of("verified", "yes"));
    layer.bindInput(validated(Map.of("claim_count", 2)));

    assertThatThrownBy(() -> layer.process(Map.of()).block())
        .isInstanceOf(StageFailureException.class)
        .satisfies(ex -> assertThat(((StageFailureException) ex).getFailureReason())
            .isEqualTo(StageFailureReason.INTERNAL_ERROR));
  }

  @Test
  void unexpectedExceptionBecomesInternalError() {
    StubLayers.Intermediate layer = new StubLayers.Intermediate("critic", INTERMEDIATE,
        StubLayers.fail(new IllegalStateException("model down")));
    layer.bindInput(validated(Map.of("claim_count", 2)));

    assertThatThrownBy(() -> layer.process(Map.of()).block())
        .isInstanceOf(StageFailureException.class)
        .hasMessageContaining("model down")
        .satisfies(ex -> assertThat(((LayerException) ex).reason()).isEqualTo("internal_error"));
  }

  @Test
  void emptyResultIsInternalError() {
    StubLayers.Intermediate layer = new StubLayers.Intermediate("critic", INTERMEDIATE, in -> Mono.empty());
    layer.bindInput(validated(Map.of("claim_count", 2)));

    assertThatThrownBy(() -> layer.process(Map.of()).block()).isInstanceOf(StageFailureException.class);
  }

  @Test
  void failingQualityGateFailsTheStage() {
    StubLayers.Intermediate layer = intermediate(Map.of("verified", false))
        .withGate(ValidationRules.of("must_be_verified", out -> Boolean.TRUE.equals(out.get("verified"))));
    layer.bindInput(validated(Map.of("claim_count", 2)));

    assertThatThrownBy(() -> layer.process(Map.of()).block())
        .isInstanceOf(StageFailureException.class)
        .satisfies(ex -> assertThat(((StageFailureException) ex).getFailureReason())
            .isEqualTo(StageFailureReason.QUALITY_GATE));
    assertThat(layer.qualityGateNames()).containsExactly("must_be_verified");
  }

  @Test
  void emittedBufferCarriesProvenanceAndInheritedCorrelationId() {
    StubLayers.Intermediate layer = intermediate(Map.of("verified", true));
    layer.bindInput(validated(Map.of("claim_count", 2)));

    DirectionBuffer out = layer.emitOutput(LayerRole.TERMINAL, Map.of("verified", true));

    assertThat(out.getSourceRole()).isEqualTo(LayerRole.INTERMEDIATE);
    assertThat(out.getTargetRole()).isEqualTo(LayerRole.TERMINAL);
    assertThat(out.getMetadata())
        .containsEntry(DirectionBuffer.SOURCE_ROLE, "intermediate")
        .containsEntry(AbstractLayer.SOURCE_LAYER, "critic")
        .containsKey(DirectionBuffer.CREATED_AT);
    assertThat(out.getCorrelationId()).contains("corr-42");
    assertThat(out.isValidated()).isFalse();
  }

  @Test
  void leadingLayerStartsNewCorrelationAndChecksRawRequest() {
    LayerExpectation leadingExpectation = LayerExpectation.builder()
        .layerRole(LayerRole.LEADING)
        .inputSchema(Map.of("question", FieldType.STRING))
        .validationRules(List.of(ValidationRules.notBlank("question")))
        .build();
    StubLayers.Leading leading = new StubLayers.Leading("auditor", leadingExpectation,
        StubLayers.emit(Map.of("claim_count", 1)));

    assertThatThrownBy(() -> leading.process(Map.of("question", " ")).block())
        .isInstanceOf(ContractViolationException.class);
    assertThat(leading.calls).hasValue(0);
    assertThat(leading.process(Map.of("question", "Why?")).block()).containsEntry("claim_count", 1);
    assertThat(leading.emitOutput(LayerRole.INTERMEDIATE, Map.of()).getCorrelationId()).isPresent();
  }

  @Test
  void terminalLayerCannotEmitAndAppliesFinalizationRules() {
    StubLayers.Terminal terminal = new StubLayers.Terminal("reviser", LayerExpectation.open(LayerRole.TERMINAL),
        input -> Mono.just(Map.of("final_output", input.get("answer"))))
        .withFinalization("upper", in -> {
          Map<String, Object> copy = new HashMap<>(in);
          copy.put("answer", String.valueOf(in.get("answer")).toUpperCase());
          return copy;
        });
    DirectionBuffer input = new DirectionBuffer(LayerRole.INTERMEDIATE, LayerRole.TERMINAL,
        Map.of("answer", "paris"), Map.of());
    input.validate(terminal.expectation());
    terminal.bindInput(input);

    assertThat(terminal.process(Map.of("answer", "paris")).block()).containsEntry("final_output", "PARIS");
    assertThatThrownBy(() -> terminal.emitOutput(LayerRole.TERMINAL, Map.of()))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void requirementsCheckCoversCapabilitiesAndCostBounds() {
    StubLayers.Intermediate layer = intermediate(Map.of())
        .withCapabilities("claim_verification")
        .withCosts(Map.of(LayerExpectation.MAX_DURATION_SECONDS, 20.0));

    assertThat(layer.validateRequirements(Map.of())).isTrue();
    assertThat(layer.validateRequirements(
        Map.of(AbstractLayer.REQUIRED_CAPABILITIES, List.of("claim_verification")))).isTrue();
    assertThat(layer.validateRequirements(
        Map.of(AbstractLayer.REQUIRED_CAPABILITIES, List.of("text_revision")))).isFalse();
    assertThat(layer.validateRequirements(Map.of(LayerExpectation.MAX_DURATION_SECONDS, 30))).isTrue();
    assertThat(layer.validateRequirements(Map.of(LayerExpectation.MAX_DURATION_SECONDS, 10))).isFalse();
  }

  @Test
  void layerRejectsExpectationForAnotherRole() {
    assertThatThrownBy(() -> new StubLayers.Intermediate("x", LayerExpectation.open(LayerRole.TERMINAL),
        StubLayers.emit(Map.of()))).isInstanceOf(IllegalArgumentException.class);
  }
}
