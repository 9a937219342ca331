package com.nevis.curation.config;

import com.nevis.curation.infra.InMemoryDualRateLimiter;
import com.nevis.curation.infra.IntervalRateLimiter;
import com.nevis.curation.infra.RateLimiter;
import com.nevis.curation.pipeline.PipelineProperties;
import com.nevis.curation.provider.EmbeddingProvider;
import com.nevis.curation.provider.LangChainEmbeddingProvider;
import com.nevis.curation.provider.LangChainTextGenerationProvider;
import com.nevis.curation.provider.SyntheticEmbeddingProvider;
import com.nevis.curation.provider.SyntheticTextGenerationProvider;
import com.nevis.curation.provider.TextGenerationProvider;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Chooses the provider implementations once, at startup. Nothing else in the application knows which mode runs.
 */
@Slf4j
@Configuration
public class ProviderConfig {

    public static final String MODE_PROPERTY = "app.providers.mode";

    @Configuration
    @ConditionalOnProperty(name = MODE_PROPERTY, havingValue = "gemini")
    static class GeminiProviders {

        @Value("${app.gemini.api-key}")
        private String apiKey;

        @Value("${app.gemini.chat-model:gemini-2.5-flash}")
        private String chatModelName;

        @Value("${app.gemini.embedding-model:gemini-embedding-001}")
        private String embeddingModelName;

        @Bean
        public ChatModel chatLanguageModel() {
            return GoogleAiGeminiChatModel.builder()
                .apiKey(apiKey)
                .modelName(chatModelName)
                .timeout(Duration.ofSeconds(60))
                .maxRetries(3)
                .logRequests(false)
                .logResponses(false)
                .build();
        }

        @Bean
        public EmbeddingModel embeddingModel(PipelineProperties pipelineProperties) {
            return GoogleAiEmbeddingModel.builder()
                .apiKey(apiKey)
                .modelName(embeddingModelName)
                .outputDimensionality(pipelineProperties.vectorDimension())
                .maxRetries(3)
                .build();
        }

        @Bean("chatLimiter")
        public RateLimiter chatLimiter(@Value("${app.limits.chat.min-interval:5s}") Duration minInterval) {
            return new IntervalRateLimiter(minInterval);
        }

        @Bean("embeddingLimiter")
        public RateLimiter embeddingLimiter(@Value("${app.limits.embedding.requests-per-minute:100}") int rpm,
                                            @Value("${app.limits.embedding.tokens-per-minute:500000}") int tpm) {
            return new InMemoryDualRateLimiter(rpm, tpm);
        }

        @Bean
        public EmbeddingProvider embeddingProvider(EmbeddingModel embeddingModel,
                                                   @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter,
                                                   PipelineProperties pipelineProperties) {
            log.info("Using Gemini embeddings ({}, {} dimensions)", embeddingModelName,
                pipelineProperties.vectorDimension());
            return new LangChainEmbeddingProvider(embeddingModel, embeddingLimiter,
                pipelineProperties.vectorDimension(), pipelineProperties.maxEmbeddingChars());
        }

        @Bean
        public TextGenerationProvider textGenerationProvider(ChatModel chatModel,
                                                             @Qualifier("chatLimiter") RateLimiter chatLimiter) {
            return new LangChainTextGenerationProvider(chatModel, chatLimiter);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = MODE_PROPERTY, havingValue = "synthetic", matchIfMissing = true)
    static class SyntheticProviders {

        @Bean
        public EmbeddingProvider embeddingProvider(PipelineProperties pipelineProperties) {
            log.info("Using synthetic embeddings ({} dimensions)", pipelineProperties.vectorDimension());
            return new SyntheticEmbeddingProvider(pipelineProperties.vectorDimension());
        }

        @Bean
        public TextGenerationProvider textGenerationProvider() {
            return new SyntheticTextGenerationProvider();
        }
    }
}
