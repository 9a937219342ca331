package com.nevis.curation.provider;

/**
 * Turns text into a fixed-length vector. Implementations throw
 * {@link com.nevis.curation.exception.EmbeddingUnavailableException} when the vector cannot be produced.
 */
public interface EmbeddingProvider {

    float[] embed(String text);

    int dimension();
}
