package com.nevis.curation.scoring;

/**
 * How well an item lines up with one tracked topic, in [0,1].
 */
public record AlignmentAssessment(String topic, double alignment) {}
