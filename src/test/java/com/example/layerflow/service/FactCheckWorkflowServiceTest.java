package com.example.layerflow.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.layerflow.adapter.RemoteLayerFactory;
import com.example.layerflow.config.OrchestratorProperties;
import com.example.layerflow.config.RemoteAgentProperties;
import com.example.layerflow.factcheck.ClaimVerification;
import com.example.layerflow.factcheck.FactCheckAuditorLayer;
import com.example.layerflow.factcheck.FactCheckCriticLayer;
import com.example.layerflow.factcheck.FactCheckReviserLayer;
import com.example.layerflow.factcheck.Verdict;
import com.example.layerflow.model.ExecutionResult;
import com.example.layerflow.model.ExecutionStatus;
import com.example.layerflow.request.FactCheckRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class FactCheckWorkflowServiceTest {

  @SuppressWarnings("unchecked")
  private final ObjectProvider<FactCheckAuditorLayer> auditors = mock(ObjectProvider.class);
  @SuppressWarnings("unchecked")
  private final ObjectProvider<FactCheckCriticLayer> critics = mock(ObjectProvider.class);
  @SuppressWarnings("unchecked")
  private final ObjectProvider<FactCheckReviserLayer> revisers = mock(ObjectProvider.class);

  private final FactCheckWorkflowService service = new FactCheckWorkflowService(
      auditors, critics, revisers,
      new RemoteLayerFactory(WebClient.builder(), new RemoteAgentProperties()),
      new OrchestratorProperties());

  private static FactCheckRequest request(String backend) {
    return FactCheckRequest.builder()
        .question("What is the boiling point of water?")
        .answer("Water boils at 100 degrees Celsius at sea level.")
        .backend(backend)
        .build();
  }

  @Test
  void backendDefaultsToLocal() {
    assertThat(service.backendOf(request(null))).isEqualTo("local");
    assertThat(service.backendOf(request("  "))).isEqualTo("local");
    assertThat(service.backendOf(request("LOCAL"))).isEqualTo("local");
    assertThat(service.backendOf(request("Adk"))).isEqualTo("adk");
    assertThatThrownBy(() -> service.backendOf(request("crewai")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void localBackendRunsFreshLayers() {
    when(auditors.getObject()).thenReturn(new FactCheckAuditorLayer(30, 0.7));
    when(critics.getObject()).thenReturn(new FactCheckCriticLayer(60,
        (claim, question) -> Mono.just(ClaimVerification.builder()
            .claim(claim)
            .verdict(Verdict.ACCURATE)
            .confidence(0.95)
            .justification("matches reference")
            .build())));
    when(revisers.getObject()).thenReturn(new FactCheckReviserLayer(30));

    ExecutionResult result = service.factCheck(request(null)).block();

    assertThat(result.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
    assertThat(result.getFinalOutput())
        .containsEntry("final_output", "Water boils at 100 degrees Celsius at sea level.");
    assertThat(result.getQualityScore()).isEqualTo(0.95);
  }

  @Test
  void unconfiguredRemoteBackendFailsWithoutTouchingLocalLayers() {
    assertThatThrownBy(() -> service.factCheck(request("a2a")).block())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("a2a.auditor-url");
    verifyNoInteractions(auditors, critics, revisers);
  }
}
