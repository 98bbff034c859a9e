package com.architecture.memory.recall.config;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Chat model that writes answers. Missing credentials fail startup, never a query.
 */
@Configuration
@Slf4j
public class LlmConfig {

    @Value("${llm.provider:openai}")
    private String provider;

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.model.chat:gpt-4o-mini}")
    private String chatModel;

    @Value("${openai.timeout:60}")
    private int timeoutSeconds;

    @Value("${openai.max-retries:3}")
    private int maxRetries;

    @Value("${ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${ollama.model:llama3}")
    private String ollamaModel;

    @Bean
    public ChatLanguageModel chatLanguageModel() {
        if ("ollama".equalsIgnoreCase(provider)) {
            log.info("[LLM Config] Initializing Ollama ChatLanguageModel {} at {}", ollamaModel, ollamaBaseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(ollamaBaseUrl)
                    .modelName(ollamaModel)
                    .temperature(0.2)
                    .timeout(Duration.ofSeconds(120))
                    .build();
        }
        if (!"openai".equalsIgnoreCase(provider)) {
            throw new IllegalStateException("llm.provider must be 'openai' or 'ollama', was: " + provider);
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("llm.provider=openai requires openai.api-key (OPENAI_API_KEY)");
        }

        log.info("[LLM Config] Initializing OpenAI ChatLanguageModel with model: {}", chatModel);
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(chatModel)
                .temperature(0.2)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(maxRetries)
                .maxTokens(2000)
                .logRequests(false)
                .logResponses(false)
                .build();
    }
}
