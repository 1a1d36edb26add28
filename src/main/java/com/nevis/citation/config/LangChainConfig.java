package com.nevis.citation.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LangChainConfig {

    @Value("${app.gemini.api-key}")
    private String apiKey;

    @Value("${app.gemini.chat-model:gemini-2.5-flash}")
    private String chatModelName;

    @Value("${app.gemini.embedding-model:gemini-embedding-001}")
    private String embeddingModelName;

    @Value("${app.gemini.timeout-seconds:60}")
    private int timeoutSeconds;

    @Bean
    public ChatModel chatLanguageModel() {
        return GoogleAiGeminiChatModel.builder()
            .apiKey(apiKey)
            .modelName(chatModelName)
            .temperature(0.0)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .maxRetries(3)
            .build();
    }

    @Bean
    public EmbeddingModel embeddingModel() {
        return GoogleAiEmbeddingModel.builder()
            .apiKey(apiKey)
            .modelName(embeddingModelName)
            .outputDimensionality(768)
            .maxRetries(3)
            .build();
    }
}
