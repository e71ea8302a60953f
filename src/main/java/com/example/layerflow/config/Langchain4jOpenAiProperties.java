package com.example.layerflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds properties:
 *
 * langchain4j.openai.api-key=...
 * langchain4j.openai.chat-model=...
 * langchain4j.openai.temperature=0.0
 */
@Data
@ConfigurationProperties(prefix = "langchain4j.openai")
public class Langchain4jOpenAiProperties {

    /**
     * OpenAI API key
     */
    private String apiKey;

    /**
     * Chat model name used for claim verification, e.g. "gpt-4o-mini"
     */
    private String chatModel = "gpt-4o-mini";

    /**
     * Verification wants repeatable verdicts
     */
    private double temperature = 0.0;

    private Integer maxOutputTokens = 400;
}
