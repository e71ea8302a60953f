package com.example.layerflow.response;

import com.example.layerflow.model.StageRecord;
import com.example.layerflow.model.ValidationRecord;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowResponse {
  private String correlationId;
  private String backend;
  private String status;
  private String abortReason;
  private String failureDetail;
  private String finalOutput;
  private Double qualityScore;
  private Map<String, Object> output;
  private List<StageRecord> stages;
  private List<ValidationRecord> validationTrail;
  private Long totalDurationMs;
  private List<String> errors;
}
