package com.nevis.curation.retrieval;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.curation.model.ContentKind;
import com.nevis.curation.model.IndexedContent;
import com.nevis.curation.model.RelevanceDecision;
import com.nevis.curation.model.RelevanceScore;

import java.util.List;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetrievalResult(
    String id,
    @JsonProperty("batch_id") UUID batchId,
    ContentKind kind,
    String title,
    String summary,
    @JsonProperty("source_url") String sourceUrl,
    String domain,
    List<String> tags,
    @JsonProperty("extraction_confidence") double extractionConfidence,
    @JsonProperty("member_ids") List<String> memberIds,
    RelevanceScore score,
    RelevanceDecision decision,
    Double similarity
) {
    public static RetrievalResult of(IndexedContent content, Double similarity) {
        return new RetrievalResult(content.id(), content.batchId(), content.kind(), content.title(), content.summary(),
            content.sourceUrl(), content.domain(), content.tags(), content.extractionConfidence(), content.memberIds(),
            content.score(), content.decision(), similarity);
    }
}
