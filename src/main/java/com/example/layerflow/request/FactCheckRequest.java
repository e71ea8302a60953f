package com.example.layerflow.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class FactCheckRequest {
  @NotBlank private String question;
  @NotBlank private String answer;
  private String context;

  /** local (default), a2a or adk */
  private String backend;
}
