package com.nevis.curation.model;

public enum BatchStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
