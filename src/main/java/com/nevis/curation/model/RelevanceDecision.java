package com.nevis.curation.model;

public enum RelevanceDecision {
    EXCLUDE(0),
    MANUAL_REVIEW(1),
    INCLUDE(2);

    private final int rank;

    RelevanceDecision(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * Returns the lower of the two decisions. Overrides go through here so they can only demote.
     */
    public RelevanceDecision atMost(RelevanceDecision ceiling) {
        return this.rank <= ceiling.rank ? this : ceiling;
    }
}
