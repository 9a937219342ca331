package com.nevis.curation.exception;

import com.nevis.curation.model.ScoringWeights;
import lombok.Getter;

@Getter
public class InvalidWeightsException extends RuntimeException {
    private final ScoringWeights weights;

    public InvalidWeightsException(ScoringWeights weights, String reason) {
        super("Invalid scoring weights " + weights + ": " + reason);
        this.weights = weights;
    }
}
