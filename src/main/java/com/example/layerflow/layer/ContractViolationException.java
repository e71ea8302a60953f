package com.example.layerflow.layer;

import com.example.layerflow.model.ExecutionResult;
import com.example.layerflow.model.LayerRole;
import com.example.layerflow.model.ValidationRecord;
import java.util.List;

/** A buffer failed, or was never put through, validation against the receiving layer. */
public class ContractViolationException extends LayerException {

  private final List<ValidationRecord> validationResults;

  public ContractViolationException(LayerRole role, String message) {
    this(role, message, List.of());
  }

  public ContractViolationException(LayerRole role, String message, List<ValidationRecord> validationResults) {
    super(role, message);
    this.validationResults = List.copyOf(validationResults);
  }

  public List<ValidationRecord> getValidationResults() {
    return validationResults;
  }

  @Override
  public String reason() {
    return ExecutionResult.CONTRACT_VIOLATION;
  }
}
