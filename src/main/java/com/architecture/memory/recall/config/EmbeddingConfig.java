package com.architecture.memory.recall.config;

import com.architecture.memory.recall.service.embed.EmbeddingClient;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Embedding model used for both indexing and queries.
 * {@code local} runs all-MiniLM-L6-v2 in process (384 dims); {@code openai} calls the OpenAI API.
 */
@Configuration
@Slf4j
public class EmbeddingConfig {

    @Value("${embedding.provider:local}")
    private String provider;

    @Value("${embedding.dimension:384}")
    private int dimension;

    @Value("${embedding.openai-model:text-embedding-3-small}")
    private String openAiModel;

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.timeout:60}")
    private int timeoutSeconds;

    @Value("${openai.max-retries:3}")
    private int maxRetries;

    @Bean
    public EmbeddingModel embeddingModel() {
        if ("openai".equalsIgnoreCase(provider)) {
            if (apiKey == null || apiKey.isBlank()) {
                throw new IllegalStateException("embedding.provider=openai requires openai.api-key");
            }
            log.info("[Embedding Config] Initializing OpenAI EmbeddingModel with model: {} ({} dims)",
                    openAiModel, dimension);
            return OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(openAiModel)
                    .dimensions(dimension)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .maxRetries(maxRetries)
                    .logRequests(false)
                    .logResponses(false)
                    .build();
        }
        if (!"local".equalsIgnoreCase(provider)) {
            throw new IllegalStateException("embedding.provider must be 'local' or 'openai', was: " + provider);
        }
        log.info("[Embedding Config] Initializing in-process all-MiniLM-L6-v2 EmbeddingModel");
        return new AllMiniLmL6V2EmbeddingModel();
    }

    @Bean
    public EmbeddingClient embeddingClient(EmbeddingModel embeddingModel) {
        return new EmbeddingClient(embeddingModel, dimension);
    }
}
