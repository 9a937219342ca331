package com.nevis.curation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.curation.exception.InvalidWeightsException;

/**
 * Weights applied to the four sub-scores when computing the composite score.
 */
public record ScoringWeights(
    @JsonProperty("topical_alignment") double topicalAlignment,
    @JsonProperty("strategic_priority") double strategicPriority,
    @JsonProperty("content_quality") double contentQuality,
    @JsonProperty("temporal_relevance") double temporalRelevance
) {
    public static final double SUM_TOLERANCE = 1e-6;

    public static final ScoringWeights DEFAULT = new ScoringWeights(0.4, 0.3, 0.2, 0.1);

    public double sum() {
        return topicalAlignment + strategicPriority + contentQuality + temporalRelevance;
    }

    public ScoringWeights validate() {
        if (!Double.isFinite(topicalAlignment) || !Double.isFinite(strategicPriority)
            || !Double.isFinite(contentQuality) || !Double.isFinite(temporalRelevance)) {
            throw new InvalidWeightsException(this, "weights must be finite numbers");
        }
        if (topicalAlignment < 0 || strategicPriority < 0 || contentQuality < 0 || temporalRelevance < 0) {
            throw new InvalidWeightsException(this, "weights must not be negative");
        }
        if (Math.abs(sum() - 1.0) > SUM_TOLERANCE) {
            throw new InvalidWeightsException(this, "weights must sum to 1.0 but sum to " + sum());
        }
        return this;
    }
}
