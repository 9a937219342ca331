package com.nevis.curation.retrieval;

public enum RetrievalMode {
    SIMILARITY,
    FILTER_ONLY
}
