package com.nevis.curation.model;

public enum ContentKind {
    ITEM,
    CLUSTER
}
