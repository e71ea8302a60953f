package com.example.layerflow.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "Layer Flow API",
        version = "v1",
        description = "Three-layer fact-check workflow with validated hand-offs between stages."
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public GroupedOpenApi workflowApi() {
    return GroupedOpenApi.builder()
        .group("workflow")
        .packagesToScan("com.example.layerflow.controller")
        .pathsToMatch("/v1/**")
        .build();
  }
}
