package com.nevis.curation.scoring;

import com.nevis.curation.model.ContentItem;

public record ScoringRequest(ContentItem item, ScoringSignals signals) {

    public ScoringRequest {
        if (item == null) {
            throw new IllegalArgumentException("Item to score is required");
        }
        signals = signals == null ? ScoringSignals.none() : signals;
    }
}
