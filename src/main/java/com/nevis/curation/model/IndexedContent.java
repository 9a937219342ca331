package com.nevis.curation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

/**
 * One entry of a batch's output: either a unique item or a finalized cluster, each carrying its score and decision.
 * This is the unit the retrieval layer selects and ranks.
 */
public record IndexedContent(
    String id,
    @JsonProperty("batch_id") UUID batchId,
    ContentKind kind,
    String title,
    String summary,
    @JsonProperty("source_url") String sourceUrl,
    String domain,
    List<String> tags,
    @JsonProperty("extraction_confidence") double extractionConfidence,
    float[] embedding,
    @JsonProperty("member_ids") List<String> memberIds,
    RelevanceScore score,
    RelevanceDecision decision
) {
    public IndexedContent {
        tags = tags == null ? List.of() : List.copyOf(tags);
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
