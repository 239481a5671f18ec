package com.architecture.memory.traceback.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * OpenAI embedding model used for both document ingestion and query-time dense search.
 */
@Configuration
@Slf4j
public class OpenAIConfig {

    @Value("${openai.api-key}")
    private String apiKey;

    @Value("${openai.model.embedding:text-embedding-3-small}")
    private String embeddingModel;

    @Value("${openai.timeout:60}")
    private int timeoutSeconds;

    @Value("${openai.max-retries:3}")
    private int maxRetries;

    @Bean
    public EmbeddingModel embeddingModel() {
        log.info("[OpenAI Config] Embedding model: {}", embeddingModel);
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[OpenAI Config] openai.api-key is empty, dense search will fail until it is set");
        }

        return OpenAiEmbeddingModel.builder()
                .apiKey(apiKey)
                .modelName(embeddingModel)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(maxRetries)
                .logRequests(false)
                .logResponses(false)
                .build();
    }
}
