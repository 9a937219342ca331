package com.nevis.curation.similarity;

import com.nevis.curation.exception.DimensionMismatchException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Holds one fixed-length vector per item for a single batch. Iteration follows insertion order so that
 * everything computed from the store is reproducible for identical input.
 * <p>
 * Not thread-safe: a batch is filled by one owner before similarity computation starts.
 */
public class VectorStore {

    private final Map<String, float[]> vectors = new LinkedHashMap<>();
    private Integer dimension;

    public VectorStore() {
    }

    public VectorStore(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Vector dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    public void put(String id, float[] vector) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Vector id cannot be blank");
        }
        if (vector == null || vector.length == 0) {
            throw new DimensionMismatchException(id, dimension == null ? 0 : dimension, 0);
        }
        if (dimension == null) {
            dimension = vector.length;
        } else if (vector.length != dimension) {
            throw new DimensionMismatchException(id, dimension, vector.length);
        }
        vectors.put(id, Arrays.copyOf(vector, vector.length));
    }

    public Optional<float[]> get(String id) {
        return Optional.ofNullable(vectors.get(id)).map(v -> Arrays.copyOf(v, v.length));
    }

    public boolean contains(String id) {
        return vectors.containsKey(id);
    }

    /**
     * Entries in insertion order. The arrays are the stored ones and must not be modified.
     */
    public Stream<Map.Entry<String, float[]>> all() {
        return vectors.entrySet().stream().map(e -> Map.entry(e.getKey(), e.getValue()));
    }

    public Optional<Integer> dimension() {
        return Optional.ofNullable(dimension);
    }

    public int size() {
        return vectors.size();
    }

    public boolean isEmpty() {
        return vectors.isEmpty();
    }
}
