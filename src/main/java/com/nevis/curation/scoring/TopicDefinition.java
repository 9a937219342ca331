package com.nevis.curation.scoring;

public record TopicDefinition(String id, String name, String description) {}
