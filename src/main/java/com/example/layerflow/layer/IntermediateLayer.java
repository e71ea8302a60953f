package com.example.layerflow.layer;

import com.example.layerflow.model.LayerExpectation;
import com.example.layerflow.model.LayerRole;
import com.example.layerflow.validation.ValidationRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Middle stage. The only stage that applies quality gates to its own output before handing
 * it on; a failing gate fails the stage.
 */
@Slf4j
public abstract class IntermediateLayer extends AbstractLayer {

  private final List<ValidationRule> qualityGates = new ArrayList<>();

  protected IntermediateLayer(String name, LayerExpectation expectation) {
    super(name, LeadingLayer.requireRole(expectation, LayerRole.INTERMEDIATE));
  }

  protected void addQualityGate(ValidationRule gate) {
    qualityGates.add(gate);
  }

  public List<String> qualityGateNames() {
    return qualityGates.stream().map(ValidationRule::name).toList();
  }

  @Override
  protected Map<String, Object> afterProcess(Map<String, Object> output) {
    for (ValidationRule gate : qualityGates) {
      ValidationRule.Result result = gate.evaluate(output);
      if (!result.isPassed()) {
        log.warn("[{}] quality gate '{}' failed: {}", name(), gate.name(), result.getDetail());
        throw new StageFailureException(role(), StageFailureReason.QUALITY_GATE,
            "quality gate '" + gate.name() + "' failed: " + result.getDetail());
      }
    }
    return output;
  }
}
