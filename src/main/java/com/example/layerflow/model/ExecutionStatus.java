package com.example.layerflow.model;

public enum ExecutionStatus {
  COMPLETED,
  ABORTED
}
