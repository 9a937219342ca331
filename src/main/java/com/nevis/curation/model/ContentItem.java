package com.nevis.curation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.With;

import java.time.Instant;

@With
public record ContentItem(
    String id,
    String title,
    String body,
    String summary,
    @JsonProperty("source_url") String sourceUrl,
    String domain,
    @JsonProperty("word_count") int wordCount,
    @JsonProperty("extraction_confidence") double extractionConfidence,
    @JsonProperty("published_at") Instant publishedAt,
    ContentMetadata metadata,
    float[] embedding,
    @JsonProperty("enrichment_status") EnrichmentStatus enrichmentStatus,
    @JsonProperty("cluster_id") String clusterId,
    @JsonProperty("parent_id") String parentId,
    boolean representative,
    @JsonProperty("absorbed_count") int absorbedCount
) {
    public ContentItem {
        metadata = metadata == null ? ContentMetadata.empty() : metadata;
        enrichmentStatus = enrichmentStatus == null ? EnrichmentStatus.PENDING : enrichmentStatus;
    }

    @JsonIgnore
    public boolean isClustered() {
        return clusterId != null;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    /**
     * Text handed to the embedding provider: title followed by the summary, or the body when there is no summary.
     */
    public String embeddingText() {
        String lead = summary != null && !summary.isBlank() ? summary : body;
        return lead == null ? title : title + "\n\n" + lead;
    }
}
