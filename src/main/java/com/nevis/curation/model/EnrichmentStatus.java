package com.nevis.curation.model;

public enum EnrichmentStatus {
    PENDING,
    READY,
    FAILED
}
