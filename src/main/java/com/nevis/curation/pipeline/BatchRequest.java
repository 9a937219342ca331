package com.nevis.curation.pipeline;

import com.nevis.curation.scoring.ScoringOverrides;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record BatchRequest(
    @NotEmpty List<BatchItemRequest> items,
    ScoringOverrides scoring
) {}
