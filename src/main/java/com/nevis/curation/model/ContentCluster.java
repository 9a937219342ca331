package com.nevis.curation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.With;

import java.util.List;
import java.util.UUID;

@With
public record ContentCluster(
    String id,
    @JsonProperty("batch_id") UUID batchId,
    @JsonProperty("member_ids") List<String> memberIds,
    @JsonProperty("representative_id") String representativeId,
    String summary,
    @JsonProperty("summary_status") EnrichmentStatus summaryStatus,
    double confidence,
    double cohesion,
    @JsonProperty("average_similarity") double averageSimilarity,
    SimilarityTier tier,
    @JsonProperty("total_word_count") int totalWordCount,
    @JsonProperty("average_extraction_confidence") double averageExtractionConfidence,
    @JsonProperty("distinct_domains") int distinctDomains,
    boolean split
) {
    public ContentCluster {
        if (memberIds == null || memberIds.size() < 2) {
            throw new IllegalArgumentException("A cluster needs at least two members");
        }
        if (confidence < 0 || confidence > 1.000001) {
            throw new IllegalArgumentException("Invalid cluster confidence: " + confidence);
        }
        memberIds = List.copyOf(memberIds);
        summaryStatus = summaryStatus == null ? EnrichmentStatus.PENDING : summaryStatus;
    }

    public int size() {
        return memberIds.size();
    }

    public boolean hasSummary() {
        return summary != null && !summary.isBlank();
    }
}
