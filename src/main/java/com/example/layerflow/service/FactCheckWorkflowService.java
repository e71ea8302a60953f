package com.example.layerflow.service;

import com.example.layerflow.adapter.AgentBackend;
import com.example.layerflow.adapter.RemoteLayerFactory;
import com.example.layerflow.config.OrchestratorProperties;
import com.example.layerflow.factcheck.FactCheckAuditorLayer;
import com.example.layerflow.factcheck.FactCheckCriticLayer;
import com.example.layerflow.factcheck.FactCheckReviserLayer;
import com.example.layerflow.model.ExecutionResult;
import com.example.layerflow.request.FactCheckRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/** Runs fact-check requests through a freshly wired three-layer pipeline. */
@Slf4j
@Service
@RequiredArgsConstructor
public class FactCheckWorkflowService {

  public static final String LOCAL_BACKEND = "local";

  private final ObjectProvider<FactCheckAuditorLayer> auditors;
  private final ObjectProvider<FactCheckCriticLayer> critics;
  private final ObjectProvider<FactCheckReviserLayer> revisers;
  private final RemoteLayerFactory remoteLayerFactory;
  private final OrchestratorProperties orchestratorProperties;

  public Mono<ExecutionResult> factCheck(FactCheckRequest request) {
    return Mono.defer(() -> {
      String backend = backendOf(request);
      ThreeLayerOrchestrator orchestrator = orchestratorFor(backend);
      log.info("Fact-check requested on backend '{}'", backend);
      return orchestrator.executeWorkflow(toPayload(request));
    });
  }

  /** Normalised backend code; unknown codes raise {@link IllegalArgumentException}. */
  public String backendOf(FactCheckRequest request) {
    String raw = request.getBackend();
    if (raw == null || raw.isBlank() || LOCAL_BACKEND.equalsIgnoreCase(raw.trim())) {
      return LOCAL_BACKEND;
    }
    return AgentBackend.fromCode(raw).getCode();
  }

  public Map<String, Object> adapterInfo(String backend) {
    return remoteLayerFactory.frameworkInfo(AgentBackend.fromCode(backend));
  }

  private ThreeLayerOrchestrator orchestratorFor(String backend) {
    if (LOCAL_BACKEND.equals(backend)) {
      return new ThreeLayerOrchestrator(
          auditors.getObject(), critics.getObject(), revisers.getObject(), orchestratorProperties);
    }
    RemoteLayerFactory.LayerSet set = remoteLayerFactory.create(AgentBackend.fromCode(backend));
    return new ThreeLayerOrchestrator(set.leading(), set.intermediate(), set.terminal(), orchestratorProperties);
  }

  private static Map<String, Object> toPayload(FactCheckRequest request) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("question", request.getQuestion());
    payload.put("answer", request.getAnswer());
    if (request.getContext() != null) {
      payload.put("context", request.getContext());
    }
    return payload;
  }
}
