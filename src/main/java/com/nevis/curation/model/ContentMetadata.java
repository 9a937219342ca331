package com.nevis.curation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Structured metadata carried by a content item. Only {@code tags} and the timestamps are read by the
 * pipeline; {@code attributes} is passed through untouched.
 */
public record ContentMetadata(
    List<String> tags,
    @JsonProperty("extracted_at") Instant extractedAt,
    Map<String, Object> attributes
) {
    public ContentMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static ContentMetadata empty() {
        return new ContentMetadata(List.of(), null, Map.of());
    }
}
