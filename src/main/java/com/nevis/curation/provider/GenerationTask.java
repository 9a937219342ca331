package com.nevis.curation.provider;

public enum GenerationTask {
    CLUSTER_SUMMARY,
    SCORING_SIGNALS
}
