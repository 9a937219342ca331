package com.nevis.curation.scoring;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Evidence the scoring engine works from. Every field may be missing; missing evidence falls back to the
 * documented default of the sub-score it feeds.
 */
public record ScoringSignals(
    List<AlignmentAssessment> alignments,
    List<TopicClassification> classifications,
    Double actionability,
    Double risk,
    @JsonProperty("stakeholder_relevance") Double stakeholderRelevance,
    QualityMetrics quality
) {
    public ScoringSignals {
        alignments = alignments == null ? List.of() : List.copyOf(alignments);
        classifications = classifications == null ? List.of() : List.copyOf(classifications);
    }

    public static ScoringSignals none() {
        return new ScoringSignals(List.of(), List.of(), null, null, null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return alignments.isEmpty() && classifications.isEmpty() && actionability == null && risk == null
            && stakeholderRelevance == null && quality == null;
    }
}
