package com.nevis.curation.provider;

import com.nevis.curation.exception.EmbeddingUnavailableException;
import com.nevis.curation.infra.RateLimiter;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;

@Slf4j
public class LangChainEmbeddingProvider implements EmbeddingProvider {

    public static final String EMBEDDING_LIMIT = "embedding_limit";

    private final EmbeddingModel embeddingModel;
    private final RateLimiter embeddingLimiter;
    private final int dimension;
    private final int maxInputChars;

    public LangChainEmbeddingProvider(EmbeddingModel embeddingModel, RateLimiter embeddingLimiter,
                                      int dimension, int maxInputChars) {
        this.embeddingModel = embeddingModel;
        this.embeddingLimiter = embeddingLimiter;
        this.dimension = dimension;
        this.maxInputChars = maxInputChars;
    }

    @Override
    @Retryable(retryFor = RetriableException.class, maxAttempts = 3, backoff = @Backoff(delay = 200, multiplier = 2))
    public float[] embed(String inputText) {
        if (inputText == null || inputText.isBlank()) {
            throw new IllegalArgumentException("Text to embed cannot be empty");
        }

        String text = inputText.trim();
        if (text.length() > maxInputChars) {
            text = text.substring(0, maxInputChars);
            log.debug("Embedding input truncated to {} characters", maxInputChars);
        }

        String input = text;
        int estimatedTokens = Math.max(1, input.length() / 4);
        float[] vector = embeddingLimiter.execute(EMBEDDING_LIMIT, estimatedTokens,
            () -> embeddingModel.embed(input).content().vector());

        if (vector == null || vector.length == 0) {
            throw new EmbeddingUnavailableException("Embedding model returned an empty vector");
        }
        return vector;
    }

    @Recover
    public float[] recover(RuntimeException e, String inputText) {
        if (e instanceof EmbeddingUnavailableException unavailable) {
            throw unavailable;
        }
        if (e instanceof IllegalArgumentException invalid) {
            throw invalid;
        }
        log.error("Embedding provider failed: {}", e.getMessage());
        throw new EmbeddingUnavailableException("Error during text vectorization", e);
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
