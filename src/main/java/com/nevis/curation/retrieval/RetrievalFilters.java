package com.nevis.curation.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.curation.model.ContentKind;
import com.nevis.curation.model.IndexedContent;
import com.nevis.curation.model.RelevanceDecision;

import java.util.List;
import java.util.UUID;

/**
 * Conjunctive candidate filters. Absent fields do not restrict.
 */
public record RetrievalFilters(
    @JsonProperty("batch_ids") List<UUID> batchIds,
    List<String> tags,
    @JsonProperty("min_extraction_confidence") Double minExtractionConfidence,
    @JsonProperty("high_quality_only") boolean highQualityOnly,
    List<RelevanceDecision> decisions,
    @JsonProperty("min_composite_score") Double minCompositeScore,
    ContentKind kind
) {
    public static final RetrievalFilters NONE = new RetrievalFilters(null, null, null, false, null, null, null);

    public RetrievalFilters {
        batchIds = batchIds == null ? List.of() : List.copyOf(batchIds);
        tags = tags == null ? List.of() : List.copyOf(tags);
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }

    public boolean matches(IndexedContent content, double highQualityThreshold) {
        if (!batchIds.isEmpty() && !batchIds.contains(content.batchId())) {
            return false;
        }
        if (!tags.isEmpty() && content.tags().stream().noneMatch(tags::contains)) {
            return false;
        }
        if (minExtractionConfidence != null && content.extractionConfidence() < minExtractionConfidence) {
            return false;
        }
        if (highQualityOnly && (content.score() == null || content.score().contentQuality() < highQualityThreshold)) {
            return false;
        }
        if (!decisions.isEmpty() && !decisions.contains(content.decision())) {
            return false;
        }
        if (minCompositeScore != null
            && (content.score() == null || content.score().compositeScore() < minCompositeScore)) {
            return false;
        }
        return kind == null || kind == content.kind();
    }
}
