package com.example.layerflow.buffer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.layerflow.model.FieldType;
import com.example.layerflow.model.LayerExpectation;
import com.example.layerflow.model.LayerRole;
import com.example.layerflow.model.ValidationOutcome;
import com.example.layerflow.model.ValidationRecord;
import com.example.layerflow.validation.ValidationRule;
import com.example.layerflow.validation.ValidationRules;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DirectionBufferTest {

  private static LayerExpectation intermediateExpectation(ValidationRule... rules) {
    return LayerExpectation.builder()
        .layerRole(LayerRole.INTERMEDIATE)
        .inputSchema(Map.of("claim_count", FieldType.NUMBER))
        .validationRules(List.of(rules))
        .build();
  }

  private static DirectionBuffer toIntermediate(Map<String, Object> payload) {
    return new DirectionBuffer(LayerRole.LEADING, LayerRole.INTERMEDIATE, payload, Map.of());
  }

  @Test
  void conformingPayloadPassesWithOneRecordPerRulePlusSchema() {
    DirectionBuffer buffer = toIntermediate(Map.of("claim_count", 2));

    ValidationOutcome outcome = buffer.validate(intermediateExpectation(
        ValidationRules.greaterThan("claim_count", 0),
        ValidationRules.atMost("claim_count", 20)));

    assertThat(outcome.isPassed()).isTrue();
    assertThat(outcome.getRecords()).hasSize(3);
    assertThat(outcome.getRecords()).allMatch(ValidationRecord::isPassed);
    assertThat(buffer.getValidationResults()).extracting(ValidationRecord::getRuleName)
        .containsExactly("schema", "claim_count > 0", "claim_count <= 20");
    assertThat(buffer.isValidated()).isTrue();
  }

  @Test
  void missingRequiredFieldFailsSchemaRecord() {
    DirectionBuffer buffer = toIntermediate(Map.of("claims", List.of()));

    ValidationOutcome outcome = buffer.validate(intermediateExpectation());

    assertThat(outcome.isPassed()).isFalse();
    assertThat(outcome.getRecords()).hasSize(1);
    assertThat(outcome.getRecords().get(0).getRuleName()).isEqualTo("schema");
    assertThat(outcome.getRecords().get(0).getDetail()).contains("claim_count");
  }

  @Test
  void nonFatalFailureStillEvaluatesRemainingRules() {
    DirectionBuffer buffer = toIntermediate(Map.of("claim_count", 0));

    ValidationOutcome outcome = buffer.validate(intermediateExpectation(
        ValidationRules.greaterThan("claim_count", 0),
        ValidationRules.atMost("claim_count", 20)));

    assertThat(outcome.isPassed()).isFalse();
    assertThat(outcome.isFatalFailure()).isFalse();
    assertThat(outcome.getRecords()).hasSize(3);
    assertThat(outcome.failures()).extracting(ValidationRecord::getRuleName).containsExactly("claim_count > 0");
  }

  @Test
  void fatalFailureStopsEvaluation() {
    DirectionBuffer buffer = toIntermediate(Map.of("claim_count", 0));

    ValidationOutcome outcome = buffer.validate(intermediateExpectation(
        ValidationRules.fatal(ValidationRules.greaterThan("claim_count", 0)),
        ValidationRules.atMost("claim_count", 20)));

    assertThat(outcome.isPassed()).isFalse();
    assertThat(outcome.isFatalFailure()).isTrue();
    assertThat(outcome.getRecords()).extracting(ValidationRecord::getRuleName)
        .containsExactly("schema", "claim_count > 0");
    assertThat(outcome.getRecords().get(1).isFatal()).isTrue();
  }

  @Test
  void throwingRuleIsRecordedAsFailure() {
    ValidationRule broken = ValidationRules.of("explodes", p -> {
      throw new IllegalStateException("boom");
    });
    DirectionBuffer buffer = toIntermediate(Map.of("claim_count", 1));

    ValidationOutcome outcome = buffer.validate(intermediateExpectation(broken));

    assertThat(outcome.isPassed()).isFalse();
    assertThat(outcome.failures().get(0).getDetail()).contains("rule error: boom");
  }

  @Test
  void repeatedValidationGivesSameOutcomeAndAppendsToTrail() {
    DirectionBuffer buffer = toIntermediate(Map.of("claim_count", 2));
    LayerExpectation expectation = intermediateExpectation(ValidationRules.greaterThan("claim_count", 0));

    ValidationOutcome first = buffer.validate(expectation);
    ValidationOutcome second = buffer.validate(expectation);

    assertThat(second.isPassed()).isEqualTo(first.isPassed());
    assertThat(second.getRecords()).hasSameSizeAs(first.getRecords());
    assertThat(buffer.getValidationResults()).hasSize(first.getRecords().size() * 2);
  }

  @Test
  void qualityRequirementsAreCheckedAgainstPayloadMetrics() {
    LayerExpectation terminal = LayerExpectation.builder()
        .layerRole(LayerRole.TERMINAL)
        .qualityRequirements(Map.of("quality", 0.8))
        .build();

    ValidationOutcome good = new DirectionBuffer(LayerRole.INTERMEDIATE, LayerRole.TERMINAL,
        Map.of("quality", 0.85), Map.of()).validate(terminal);
    ValidationOutcome low = new DirectionBuffer(LayerRole.INTERMEDIATE, LayerRole.TERMINAL,
        Map.of("quality", 0.5), Map.of()).validate(terminal);
    ValidationOutcome absent = new DirectionBuffer(LayerRole.INTERMEDIATE, LayerRole.TERMINAL,
        Map.of("verified", true), Map.of()).validate(terminal);

    assertThat(good.isPassed()).isTrue();
    assertThat(good.getRecords()).extracting(ValidationRecord::getRuleName).contains("quality:quality");
    assertThat(low.isPassed()).isFalse();
    assertThat(absent.isPassed()).isFalse();
    assertThat(absent.failures().get(0).getDetail()).contains("not reported");
  }

  @Test
  void payloadSizeLimitIsEnforced() {
    LayerExpectation small = LayerExpectation.builder()
        .layerRole(LayerRole.INTERMEDIATE)
        .performanceConstraints(Map.of(LayerExpectation.MAX_PAYLOAD_BYTES, 10.0))
        .build();

    ValidationOutcome outcome = toIntermediate(Map.of("answer", "far more than ten bytes")).validate(small);

    assertThat(outcome.isPassed()).isFalse();
    assertThat(outcome.failures().get(0).getRuleName()).isEqualTo("performance:max_payload_bytes");
  }

  @Test
  void rejectsNonAdjacentRoles() {
    assertThatThrownBy(() -> new DirectionBuffer(LayerRole.LEADING, LayerRole.TERMINAL, Map.of(), Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new DirectionBuffer(LayerRole.TERMINAL, LayerRole.LEADING, Map.of(), Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new DirectionBuffer(LayerRole.INTERMEDIATE, LayerRole.LEADING, Map.of(), Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsExpectationOfAnotherRole() {
    DirectionBuffer buffer = toIntermediate(Map.of("claim_count", 1));

    assertThatThrownBy(() -> buffer.validate(LayerExpectation.open(LayerRole.TERMINAL)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(buffer.isValidated()).isFalse();
  }

  @Test
  void payloadIsFrozenCopy() {
    Map<String, Object> source = new HashMap<>();
    source.put("claims", new ArrayList<>(List.of("a")));
    DirectionBuffer buffer = toIntermediate(source);

    source.put("claim_count", 3);

    assertThat(buffer.getPayload()).doesNotContainKey("claim_count");
    assertThatThrownBy(() -> buffer.getPayload().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    @SuppressWarnings("unchecked")
    List<Object> claims = (List<Object>) buffer.getPayload().get("claims");
    assertThatThrownBy(() -> claims.add("b")).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void stampsProvenanceMetadata() {
    DirectionBuffer buffer = new DirectionBuffer(LayerRole.LEADING, LayerRole.INTERMEDIATE,
        Map.of(), Map.of(DirectionBuffer.CORRELATION_ID, "corr-1"));

    assertThat(buffer.getMetadata()).containsEntry(DirectionBuffer.SOURCE_ROLE, "leading")
        .containsKey(DirectionBuffer.CREATED_AT);
    assertThat(buffer.getCorrelationId()).contains("corr-1");
  }

  @Test
  void waiverAcceptsNonFatalFailureAndIsAudited() {
    DirectionBuffer buffer = toIntermediate(Map.of("claim_count", 0));
    buffer.validate(intermediateExpectation(ValidationRules.greaterThan("claim_count", 0)));

    ValidationOutcome waived = buffer.waive("policy=CONTINUE");

    assertThat(waived.isPassed()).isTrue();
    assertThat(waived.isWaived()).isTrue();
    assertThat(buffer.getValidationResults()).extracting(ValidationRecord::getRuleName)
        .containsExactly("schema", "claim_count > 0", "waiver");
    assertThat(buffer.getValidationResults().get(1).isPassed()).isFalse();
  }

  @Test
  void fatalFailureCannotBeWaived() {
    DirectionBuffer buffer = toIntermediate(Map.of("claim_count", 0));
    buffer.validate(intermediateExpectation(ValidationRules.fatal(ValidationRules.greaterThan("claim_count", 0))));

    assertThatThrownBy(() -> buffer.waive("policy=CONTINUE")).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void unvalidatedBufferCannotBeWaived() {
    assertThatThrownBy(() -> toIntermediate(Map.of()).waive("x")).isInstanceOf(IllegalStateException.class);
  }
}
