package com.nevis.curation.model;

public enum WarningType {
    MALFORMED_ITEM,
    DIMENSION_MISMATCH,
    EMBEDDING_UNAVAILABLE,
    GENERATION_UNAVAILABLE,
    SCORING_DEFAULT
}
