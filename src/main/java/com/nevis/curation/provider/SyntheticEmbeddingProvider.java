package com.nevis.curation.provider;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic CPU-only embedding based on feature hashing of word tokens. Texts sharing vocabulary get close
 * vectors, which is enough to exercise deduplication locally without a remote model.
 */
public class SyntheticEmbeddingProvider implements EmbeddingProvider {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int MIN_TOKEN_LENGTH = 2;

    private final int dimension;

    public SyntheticEmbeddingProvider(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text to embed cannot be empty");
        }

        float[] vector = new float[dimension];
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() < MIN_TOKEN_LENGTH) {
                continue;
            }
            int hash = token.hashCode();
            int slot = Math.floorMod(hash, dimension);
            vector[slot] += (hash & 0x4000_0000) == 0 ? 1.0f : -1.0f;
        }
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
