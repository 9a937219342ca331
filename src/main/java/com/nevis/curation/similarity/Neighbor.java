package com.nevis.curation.similarity;

public record Neighbor(String id, double score) {}
