package com.nevis.curation.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.curation.model.ScoringWeights;

/**
 * Per-request adjustments to the configured scoring policy. Absent fields keep the configured value.
 */
public record ScoringOverrides(
    ScoringWeights weights,
    @JsonProperty("include_threshold") Double includeThreshold,
    @JsonProperty("review_threshold") Double reviewThreshold,
    @JsonProperty("require_topical_evidence") Boolean requireTopicalEvidence,
    @JsonProperty("min_actionability") Double minActionability
) {}
