package com.nevis.curation.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QualityMetrics(
    @JsonProperty("factual_density") double factualDensity,
    @JsonProperty("source_authority") double sourceAuthority,
    double clarity,
    double completeness,
    @JsonProperty("verification_level") double verificationLevel
) {}
