package com.nevis.curation.scoring;

import com.nevis.curation.model.ScoringWeights;
import lombok.With;

/**
 * Everything the engine needs to turn sub-scores into a decision for one batch.
 */
@With
public record ScoringPolicy(
    ScoringWeights weights,
    double includeThreshold,
    double reviewThreshold,
    boolean requireTopicalEvidence,
    double minActionability
) {
    public static final ScoringPolicy DEFAULT = new ScoringPolicy(ScoringWeights.DEFAULT, 0.65, 0.55, false, 0.0);

    /**
     * Checks the structural configuration. Any violation invalidates every composite score of the batch.
     */
    public ScoringPolicy validate() {
        if (weights == null) {
            throw new IllegalArgumentException("Scoring weights are required");
        }
        weights.validate();
        if (!Double.isFinite(includeThreshold) || !Double.isFinite(reviewThreshold)) {
            throw new IllegalArgumentException("Thresholds must be finite numbers, got review=" + reviewThreshold
                + " include=" + includeThreshold);
        }
        if (!Double.isFinite(minActionability)) {
            throw new IllegalArgumentException("Minimum actionability must be a finite number");
        }
        if (reviewThreshold < 0 || includeThreshold > 1 || includeThreshold < reviewThreshold) {
            throw new IllegalArgumentException(
                "Thresholds must satisfy 0 <= review <= include <= 1, got review=" + reviewThreshold
                    + " include=" + includeThreshold);
        }
        return this;
    }

    public ScoringPolicy withOverrides(ScoringOverrides overrides) {
        if (overrides == null) {
            return this;
        }
        return new ScoringPolicy(
            overrides.weights() != null ? overrides.weights() : weights,
            overrides.includeThreshold() != null ? overrides.includeThreshold() : includeThreshold,
            overrides.reviewThreshold() != null ? overrides.reviewThreshold() : reviewThreshold,
            overrides.requireTopicalEvidence() != null ? overrides.requireTopicalEvidence() : requireTopicalEvidence,
            overrides.minActionability() != null ? overrides.minActionability() : minActionability
        );
    }
}
