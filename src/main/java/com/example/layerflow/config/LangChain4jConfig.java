package com.example.layerflow.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(Langchain4jOpenAiProperties.class)
public class LangChain4jConfig {

    @Bean
    public ChatModel chatModel(Langchain4jOpenAiProperties props) {
        return OpenAiChatModel.builder()
                .apiKey(props.getApiKey())
                .modelName(props.getChatModel())
                .temperature(props.getTemperature())
                .maxTokens(props.getMaxOutputTokens())
                .build();
    }
}
