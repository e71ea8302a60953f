package com.example.layerflow.adapter;

import com.example.layerflow.config.RemoteAgentProperties;
import com.example.layerflow.factcheck.FactCheckContracts;
import com.example.layerflow.layer.Layer;
import com.example.layerflow.model.LayerRole;
import io.netty.channel.ChannelOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Builds fact-check layer sets backed by remote agents. Every call creates new layers and a
 * new {@link WebClient}, so nothing is shared between runs.
 */
@Slf4j
public class RemoteLayerFactory {

    public static final String FRAMEWORK_VERSION = "1.0.0";
    static final List<String> SUPPORTED_OPERATIONS = List.of("fact_check", "claim_verification", "text_revision");

    private final WebClient.Builder webClientBuilder;
    private final RemoteAgentProperties properties;

    public RemoteLayerFactory(WebClient.Builder webClientBuilder, RemoteAgentProperties properties) {
        this.webClientBuilder = webClientBuilder;
        this.properties = properties;
    }

    public record LayerSet(AgentBackend backend, Layer leading, Layer intermediate, Layer terminal) {
    }

    public LayerSet create(AgentBackend backend) {
        WebClient client = newClient();
        double maxStage = properties.getMaxStageSeconds();
        return switch (backend) {
            case A2A -> {
                RemoteAgentProperties.A2a a2a = properties.getA2a();
                A2aTranslator translator = new A2aTranslator();
                yield new LayerSet(backend,
                        new RemoteAgentLayer("a2a-auditor", FactCheckContracts.auditor(maxStage), client,
                                require(a2a.getAuditorUrl(), "a2a.auditor-url"), translator,
                                Set.of("claim_extraction")),
                        new RemoteAgentLayer("a2a-critic", FactCheckContracts.critic(maxStage), client,
                                require(a2a.getCriticUrl(), "a2a.critic-url"), translator,
                                Set.of("claim_verification", "evidence_search")),
                        new RemoteAgentLayer("a2a-reviser", FactCheckContracts.reviser(maxStage), client,
                                require(a2a.getReviserUrl(), "a2a.reviser-url"), translator,
                                Set.of("text_revision", "style_preservation")));
            }
            case ADK -> {
                RemoteAgentProperties.Adk adk = properties.getAdk();
                String gateway = require(adk.getGatewayUrl(), "adk.gateway-url");
                AdkTranslator translator = new AdkTranslator(Map.of(
                        LayerRole.LEADING, adk.getAuditorAgent(),
                        LayerRole.INTERMEDIATE, adk.getCriticAgent(),
                        LayerRole.TERMINAL, adk.getReviserAgent()));
                yield new LayerSet(backend,
                        new RemoteAgentLayer("adk-auditor", FactCheckContracts.auditor(maxStage), client,
                                gateway, translator, Set.of("claim_extraction")),
                        new RemoteAgentLayer("adk-critic", FactCheckContracts.critic(maxStage), client,
                                gateway, translator, Set.of("claim_verification", "evidence_search")),
                        new RemoteAgentLayer("adk-reviser", FactCheckContracts.reviser(maxStage), client,
                                gateway, translator, Set.of("text_revision", "style_preservation")));
            }
        };
    }

    public Map<String, Object> frameworkInfo(AgentBackend backend) {
        Map<String, Object> config = new LinkedHashMap<>();
        if (backend == AgentBackend.A2A) {
            RemoteAgentProperties.A2a a2a = properties.getA2a();
            config.put("auditor_url", a2a.getAuditorUrl());
            config.put("critic_url", a2a.getCriticUrl());
            config.put("reviser_url", a2a.getReviserUrl());
            config.put("model_name", a2a.getModelName());
            config.put("model_provider", a2a.getModelProvider());
        } else {
            RemoteAgentProperties.Adk adk = properties.getAdk();
            config.put("gateway_url", adk.getGatewayUrl());
            config.put("agent_module_path", adk.getAgentModulePath());
            config.put("model_endpoint", adk.getModelEndpoint());
        }
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("agent_type", backend.getCode());
        info.put("config", config);
        info.put("framework_version", FRAMEWORK_VERSION);
        info.put("supported_operations", SUPPORTED_OPERATIONS);
        return info;
    }

    private WebClient newClient() {
        HttpClient http = HttpClient.create()
                .responseTimeout(properties.getResponseTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) Math.min(Integer.MAX_VALUE, properties.getResponseTimeout().toMillis()));
        return webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }

    private static String require(String url, String property) {
        if (!StringUtils.hasText(url)) {
            throw new IllegalArgumentException("layerflow.remote." + property + " is not configured");
        }
        return url;
    }
}
