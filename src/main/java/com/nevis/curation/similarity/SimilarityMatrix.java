package com.nevis.curation.similarity;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Symmetric pairwise similarity over a fixed, ordered set of ids.
 * <p>
 * Each unordered pair is computed once and stored for both orientations; the diagonal is exactly 1.0.
 * Pairs that were never computed are reported as absent rather than as zero.
 */
@Slf4j
public final class SimilarityMatrix {

    private final List<String> ids;
    private final Map<String, Integer> index;
    private final double[][] scores;

    private SimilarityMatrix(List<String> ids, double[][] scores) {
        this.ids = List.copyOf(ids);
        this.index = new HashMap<>();
        for (int i = 0; i < this.ids.size(); i++) {
            index.put(this.ids.get(i), i);
        }
        this.scores = scores;
    }

    public static SimilarityMatrix compute(VectorStore store) {
        return compute(store, null);
    }

    /**
     * Computes all pairwise cosine similarities. With an executor, rows are computed as independent tasks and
     * copied into the matrix only once each row has finished.
     */
    public static SimilarityMatrix compute(VectorStore store, Executor executor) {
        List<String> ids = new ArrayList<>();
        List<float[]> vectors = new ArrayList<>();
        store.all().forEach(e -> {
            ids.add(e.getKey());
            vectors.add(e.getValue());
        });

        int n = ids.size();
        double[] norms = new double[n];
        for (int i = 0; i < n; i++) {
            norms[i] = CosineSimilarity.norm(vectors.get(i));
        }

        double[][] scores = emptyScores(n);
        if (executor == null || n < 2) {
            for (int i = 0; i < n; i++) {
                writeRow(scores, i, computeRow(i, vectors, norms));
            }
        } else {
            List<CompletableFuture<double[]>> rows = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                final int row = i;
                rows.add(CompletableFuture.supplyAsync(() -> computeRow(row, vectors, norms), executor));
            }
            for (int i = 0; i < n; i++) {
                writeRow(scores, i, rows.get(i).join());
            }
        }

        log.debug("Computed similarity matrix for {} vectors ({} pairs)", n, (long) n * (n - 1) / 2);
        return new SimilarityMatrix(ids, scores);
    }

    public static Builder builder(List<String> ids) {
        return new Builder(ids);
    }

    public OptionalDouble get(String id1, String id2) {
        Integer i = index.get(id1);
        Integer j = index.get(id2);
        if (i == null || j == null) {
            return OptionalDouble.empty();
        }
        double score = scores[i][j];
        return Double.isNaN(score) ? OptionalDouble.empty() : OptionalDouble.of(score);
    }

    /**
     * Other ids whose similarity to {@code id} is at least {@code minThreshold}, highest first.
     * Equal scores keep insertion order.
     */
    public List<Neighbor> neighbors(String id, double minThreshold) {
        Integer i = index.get(id);
        if (i == null) {
            return List.of();
        }
        List<Neighbor> result = new ArrayList<>();
        for (int j = 0; j < ids.size(); j++) {
            double score = scores[i][j];
            if (j != i && !Double.isNaN(score) && score >= minThreshold) {
                result.add(new Neighbor(ids.get(j), score));
            }
        }
        result.sort(Comparator.comparingDouble(Neighbor::score).reversed());
        return result;
    }

    public List<String> ids() {
        return ids;
    }

    public boolean contains(String id) {
        return index.containsKey(id);
    }

    public int size() {
        return ids.size();
    }

    private static double[] computeRow(int i, List<float[]> vectors, double[] norms) {
        int n = vectors.size();
        double[] row = new double[n - i - 1];
        float[] a = vectors.get(i);
        for (int j = i + 1; j < n; j++) {
            row[j - i - 1] = CosineSimilarity.fromParts(CosineSimilarity.dot(a, vectors.get(j)), norms[i], norms[j]);
        }
        return row;
    }

    private static void writeRow(double[][] scores, int i, double[] row) {
        for (int k = 0; k < row.length; k++) {
            int j = i + 1 + k;
            scores[i][j] = row[k];
            scores[j][i] = row[k];
        }
    }

    private static double[][] emptyScores(int n) {
        double[][] scores = new double[n][n];
        for (int i = 0; i < n; i++) {
            Arrays.fill(scores[i], Double.NaN);
            scores[i][i] = 1.0;
        }
        return scores;
    }

    /**
     * Assembles a matrix from known pair scores, e.g. when similarities come from a previous run.
     */
    public static final class Builder {
        private final List<String> ids;
        private final Map<String, Integer> index = new HashMap<>();
        private final double[][] scores;

        private Builder(List<String> ids) {
            this.ids = List.copyOf(ids);
            for (int i = 0; i < this.ids.size(); i++) {
                if (index.put(this.ids.get(i), i) != null) {
                    throw new IllegalArgumentException("Duplicate id: " + this.ids.get(i));
                }
            }
            this.scores = emptyScores(this.ids.size());
        }

        public Builder set(String id1, String id2, double score) {
            Integer i = index.get(id1);
            Integer j = index.get(id2);
            if (i == null || j == null) {
                throw new IllegalArgumentException("Unknown id in pair " + id1 + "/" + id2);
            }
            if (i.equals(j)) {
                return this;
            }
            double clamped = Math.max(0.0, Math.min(1.0, score));
            scores[i][j] = clamped;
            scores[j][i] = clamped;
            return this;
        }

        public SimilarityMatrix build() {
            return new SimilarityMatrix(ids, Arrays.stream(scores).map(double[]::clone).toArray(double[][]::new));
        }
    }
}
