package com.nevis.curation.scoring;

public record TopicClassification(String topic, double confidence) {}
