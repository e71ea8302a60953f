package com.example.layerflow.config;

import com.example.layerflow.adapter.RemoteLayerFactory;
import com.example.layerflow.factcheck.ClaimVerifier;
import com.example.layerflow.factcheck.FactCheckAuditorLayer;
import com.example.layerflow.factcheck.FactCheckCriticLayer;
import com.example.layerflow.factcheck.FactCheckReviserLayer;
import com.example.layerflow.factcheck.LlmClaimVerifier;
import dev.langchain4j.model.chat.ChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Local fact-check layers are stateful per run, so they are prototype beans; the workflow
 * service asks for a fresh set on every request.
 */
@Configuration
@EnableConfigurationProperties({
        OrchestratorProperties.class,
        RemoteAgentProperties.class
})
public class LayerBeansConfig {

    @Bean
    public ClaimVerifier claimVerifier(ChatModel chatModel) {
        return new LlmClaimVerifier(chatModel);
    }

    @Bean
    @Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
    public FactCheckAuditorLayer factCheckAuditorLayer(
            @Value("${layerflow.factcheck.auditor-max-seconds:30}") double maxSeconds,
            @Value("${layerflow.factcheck.confidence-threshold:0.7}") double confidenceThreshold) {
        return new FactCheckAuditorLayer(maxSeconds, confidenceThreshold);
    }

    @Bean
    @Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
    public FactCheckCriticLayer factCheckCriticLayer(
            @Value("${layerflow.factcheck.critic-max-seconds:180}") double maxSeconds,
            ClaimVerifier claimVerifier) {
        return new FactCheckCriticLayer(maxSeconds, claimVerifier);
    }

    @Bean
    @Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
    public FactCheckReviserLayer factCheckReviserLayer(
            @Value("${layerflow.factcheck.reviser-max-seconds:60}") double maxSeconds) {
        return new FactCheckReviserLayer(maxSeconds);
    }

    @Bean
    public RemoteLayerFactory remoteLayerFactory(WebClient.Builder webClientBuilder,
                                                 RemoteAgentProperties properties) {
        return new RemoteLayerFactory(webClientBuilder, properties);
    }
}
