package com.example.layerflow.layer;

import com.example.layerflow.buffer.DirectionBuffer;
import com.example.layerflow.model.LayerExpectation;
import com.example.layerflow.model.LayerRole;
import com.example.layerflow.validation.ValidationRule;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;

/**
 * Last stage. Applies finalisation rules to its input, produces the final output and runs
 * advisory output validators. There is nothing after it to emit to.
 */
@Slf4j
public abstract class TerminalLayer extends AbstractLayer {

  private final Map<String, UnaryOperator<Map<String, Object>>> finalizationRules = new LinkedHashMap<>();
  private final List<ValidationRule> outputValidators = new ArrayList<>();

  protected TerminalLayer(String name, LayerExpectation expectation) {
    super(name, LeadingLayer.requireRole(expectation, LayerRole.TERMINAL));
  }

  protected void addFinalizationRule(String ruleName, UnaryOperator<Map<String, Object>> rule) {
    finalizationRules.put(ruleName, rule);
  }

  protected void addOutputValidator(ValidationRule validator) {
    outputValidators.add(validator);
  }

  @Override
  protected Map<String, Object> beforeProcess(Map<String, Object> input) {
    Map<String, Object> current = new LinkedHashMap<>(input);
    for (Map.Entry<String, UnaryOperator<Map<String, Object>>> rule : finalizationRules.entrySet()) {
      current = rule.getValue().apply(current);
      log.debug("[{}] applied finalization rule '{}'", name(), rule.getKey());
    }
    return current;
  }

  @Override
  protected Map<String, Object> afterProcess(Map<String, Object> output) {
    for (ValidationRule validator : outputValidators) {
      ValidationRule.Result result = validator.evaluate(output);
      if (!result.isPassed()) {
        log.warn("[{}] output validator '{}' failed: {}", name(), validator.name(), result.getDetail());
      }
    }
    return output;
  }

  @Override
  public final DirectionBuffer emitOutput(LayerRole targetRole, Map<String, Object> data) {
    throw new IllegalStateException("terminal layer " + name() + " has no successor to emit to");
  }
}
