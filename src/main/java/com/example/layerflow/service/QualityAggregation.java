package com.example.layerflow.service;

public enum QualityAggregation {
  /** Lowest stage score wins. */
  MINIMUM,
  /** Average of stage scores weighted by role. */
  WEIGHTED_AVERAGE
}
