package com.nevis.curation.cluster;

import com.nevis.curation.similarity.SimilarityMatrix;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Pairwise similarity statistics over the members of one group. Pairs the matrix does not know are skipped;
 * a group without a single known pair is degenerate and reports zeros.
 */
public record ClusterStatistics(double average, double standardDeviation, int pairCount) {

    public static final ClusterStatistics DEGENERATE = new ClusterStatistics(0.0, 0.0, 0);

    public static ClusterStatistics over(List<String> members, SimilarityMatrix matrix) {
        double sum = 0.0;
        double sumSquares = 0.0;
        int count = 0;
        for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
                OptionalDouble score = matrix.get(members.get(i), members.get(j));
                if (score.isPresent()) {
                    double s = score.getAsDouble();
                    sum += s;
                    sumSquares += s * s;
                    count++;
                }
            }
        }
        if (count == 0) {
            return DEGENERATE;
        }
        double mean = sum / count;
        double variance = Math.max(0.0, sumSquares / count - mean * mean);
        return new ClusterStatistics(mean, Math.sqrt(variance), count);
    }

    /**
     * Mean similarity across every pair drawn from two different groups, 0.0 when no pair is known.
     */
    public static double between(List<String> first, List<String> second, SimilarityMatrix matrix) {
        double sum = 0.0;
        int count = 0;
        for (String a : first) {
            for (String b : second) {
                OptionalDouble score = matrix.get(a, b);
                if (score.isPresent()) {
                    sum += score.getAsDouble();
                    count++;
                }
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    public boolean isDegenerate() {
        return pairCount == 0;
    }

    public double confidence() {
        return average;
    }

    public double cohesion() {
        return isDegenerate() ? 0.0 : Math.max(0.0, average - standardDeviation);
    }
}
