package com.example.layerflow.service;

import com.example.layerflow.model.LayerRole;
import com.example.layerflow.model.StageRecord;
import java.util.Collection;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Folds the quality metrics reported by each stage into one score. A stage's score is the
 * minimum of its own metrics; stages that reported nothing are left out. Returns null when
 * no stage reported a metric.
 */
public class QualityAggregator {

  private final QualityAggregation mode;
  private final Map<String, Double> weights;

  public QualityAggregator(QualityAggregation mode, Map<String, Double> weights) {
    this.mode = mode == null ? QualityAggregation.MINIMUM : mode;
    this.weights = weights == null ? Map.of() : Map.copyOf(weights);
  }

  public Double aggregate(Collection<StageRecord> stages) {
    double weightedSum = 0;
    double totalWeight = 0;
    Double minimum = null;

    for (StageRecord stage : stages) {
      OptionalDouble score = stageScore(stage);
      if (score.isEmpty()) {
        continue;
      }
      double value = score.getAsDouble();
      minimum = minimum == null ? value : Math.min(minimum, value);
      double weight = weightOf(stage.getRole());
      weightedSum += value * weight;
      totalWeight += weight;
    }

    if (minimum == null) {
      return null;
    }
    if (mode == QualityAggregation.MINIMUM || totalWeight <= 0) {
      return minimum;
    }
    return weightedSum / totalWeight;
  }

  private static OptionalDouble stageScore(StageRecord stage) {
    if (!stage.isSuccess() || stage.getQualityMetrics() == null) {
      return OptionalDouble.empty();
    }
    return stage.getQualityMetrics().values().stream().mapToDouble(Double::doubleValue).min();
  }

  private double weightOf(LayerRole role) {
    Double weight = weights.get(role.getCode());
    return weight == null ? 1.0 : Math.max(0.0, weight);
  }
}
