package com.nevis.curation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

public record DecisionCounts(
    int include,
    @JsonProperty("manual_review") int manualReview,
    int exclude
) {
    public static final DecisionCounts NONE = new DecisionCounts(0, 0, 0);

    public static DecisionCounts of(Collection<RelevanceDecision> decisions) {
        int include = 0;
        int review = 0;
        int exclude = 0;
        for (RelevanceDecision decision : decisions) {
            switch (decision) {
                case INCLUDE -> include++;
                case MANUAL_REVIEW -> review++;
                case EXCLUDE -> exclude++;
            }
        }
        return new DecisionCounts(include, review, exclude);
    }

    public int total() {
        return include + manualReview + exclude;
    }
}
