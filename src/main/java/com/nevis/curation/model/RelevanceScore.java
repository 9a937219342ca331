package com.nevis.curation.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Four independent sub-scores in [0,1] together with the weights they are combined with.
 * The composite is always derived, never stored.
 */
@JsonIgnoreProperties(value = "composite_score", allowGetters = true)
public record RelevanceScore(
    @JsonProperty("topical_alignment") double topicalAlignment,
    @JsonProperty("strategic_priority") double strategicPriority,
    @JsonProperty("content_quality") double contentQuality,
    @JsonProperty("temporal_relevance") double temporalRelevance,
    ScoringWeights weights
) {
    public RelevanceScore {
        requireUnit("topical_alignment", topicalAlignment);
        requireUnit("strategic_priority", strategicPriority);
        requireUnit("content_quality", contentQuality);
        requireUnit("temporal_relevance", temporalRelevance);
        weights = weights == null ? ScoringWeights.DEFAULT : weights;
    }

    @JsonProperty("composite_score")
    public double compositeScore() {
        double composite = weights.topicalAlignment() * topicalAlignment
            + weights.strategicPriority() * strategicPriority
            + weights.contentQuality() * contentQuality
            + weights.temporalRelevance() * temporalRelevance;
        return Math.max(0.0, Math.min(1.0, composite));
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 1) {
            throw new IllegalArgumentException("Sub-score " + name + " out of range: " + value);
        }
    }
}
