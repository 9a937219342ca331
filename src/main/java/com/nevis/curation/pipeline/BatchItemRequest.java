package com.nevis.curation.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.curation.scoring.ScoringSignals;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One submitted item as received. Nothing is validated on the way in: malformed items are rejected one by one
 * during processing so that the rest of the batch goes through.
 */
public record BatchItemRequest(
    String id,
    String title,
    String body,
    String summary,
    @JsonProperty("source_url") String sourceUrl,
    String domain,
    @JsonProperty("word_count") Integer wordCount,
    @JsonProperty("extraction_confidence") Double extractionConfidence,
    @JsonProperty("published_at") Instant publishedAt,
    @JsonProperty("extracted_at") Instant extractedAt,
    List<String> tags,
    Map<String, Object> attributes,
    ScoringSignals signals
) {}
