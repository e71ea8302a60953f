package com.example.layerflow.config;

import com.example.layerflow.model.LayerRole;
import com.example.layerflow.service.QualityAggregation;
import com.example.layerflow.service.ValidationFailurePolicy;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "layerflow.orchestrator")
@Validated
public class OrchestratorProperties {

  @NotNull
  private ValidationFailurePolicy validationFailurePolicy = ValidationFailurePolicy.ABORT;

  @NotNull
  private QualityAggregation qualityAggregation = QualityAggregation.MINIMUM;

  /** Per-role weights for {@link QualityAggregation#WEIGHTED_AVERAGE}, keyed by role code. */
  private final Map<String, Double> weights = new LinkedHashMap<>();

  /** Extra pre-flight requirements per role code, merged into each layer's own constraints. */
  private final Map<String, Map<String, Object>> requirements = new LinkedHashMap<>();

  /** Stage timeout used when a layer declares no {@code max_duration_seconds}. Null means none. */
  private Duration defaultStageTimeout;

  public ValidationFailurePolicy getValidationFailurePolicy() {
    return validationFailurePolicy;
  }

  public void setValidationFailurePolicy(ValidationFailurePolicy validationFailurePolicy) {
    this.validationFailurePolicy = validationFailurePolicy;
  }

  public QualityAggregation getQualityAggregation() {
    return qualityAggregation;
  }

  public void setQualityAggregation(QualityAggregation qualityAggregation) {
    this.qualityAggregation = qualityAggregation;
  }

  public Map<String, Double> getWeights() {
    return weights;
  }

  public void setWeights(Map<String, Double> weights) {
    this.weights.clear();
    if (weights != null) {
      this.weights.putAll(weights);
    }
  }

  public Map<String, Map<String, Object>> getRequirements() {
    return requirements;
  }

  public void setRequirements(Map<String, Map<String, Object>> requirements) {
    this.requirements.clear();
    if (requirements != null) {
      requirements.forEach((role, values) -> this.requirements.put(LayerRole.fromCode(role).getCode(), values));
    }
  }

  public Duration getDefaultStageTimeout() {
    return defaultStageTimeout;
  }

  public void setDefaultStageTimeout(Duration defaultStageTimeout) {
    this.defaultStageTimeout = defaultStageTimeout;
  }
}
