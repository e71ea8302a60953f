package com.example.layerflow.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Binds properties:
 *
 * layerflow.remote.a2a.auditor-url=http://localhost:9101/agent
 * layerflow.remote.adk.gateway-url=http://localhost:9200/run
 * layerflow.remote.response-timeout=30s
 */
@Data
@Validated
@ConfigurationProperties(prefix = "layerflow.remote")
public class RemoteAgentProperties {

    @Valid
    private A2a a2a = new A2a();

    @Valid
    private Adk adk = new Adk();

    /** HTTP response timeout of each remote call. */
    private Duration responseTimeout = Duration.ofSeconds(30);

    /** Upper bound of one remote stage, enforced by the orchestrator. */
    @Positive
    private double maxStageSeconds = 120;

    @Data
    public static class A2a {
        private String auditorUrl;
        private String criticUrl;
        private String reviserUrl;
        private String modelName = "gpt-4o-mini";
        private String modelProvider = "openai";
    }

    @Data
    public static class Adk {
        private String gatewayUrl;
        private String agentModulePath;
        private String modelEndpoint;
        private String auditorAgent = "fact_check_auditor";
        private String criticAgent = "fact_check_critic";
        private String reviserAgent = "fact_check_reviser";
    }
}
