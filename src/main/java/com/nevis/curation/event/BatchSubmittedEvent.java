package com.nevis.curation.event;

import com.nevis.curation.pipeline.BatchRequest;

import java.util.UUID;

public record BatchSubmittedEvent(UUID batchId, BatchRequest request) {}
