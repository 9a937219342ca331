package com.nevis.curation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.With;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one curation batch. Reported even when the batch fails part way, so that nothing is lost silently.
 */
@With
public record BatchReport(
    @JsonProperty("batch_id") UUID batchId,
    BatchStatus status,
    @JsonProperty("submitted_items") int submittedItems,
    @JsonProperty("accepted_items") int acceptedItems,
    @JsonProperty("skipped_items") int skippedItems,
    @JsonProperty("embedded_items") int embeddedItems,
    @JsonProperty("degraded_defaults") int degradedDefaults,
    @JsonProperty("cluster_count") int clusterCount,
    @JsonProperty("unique_item_count") int uniqueItemCount,
    DecisionCounts decisions,
    List<BatchWarning> warnings,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("created_at") OffsetDateTime createdAt,
    @JsonProperty("completed_at") OffsetDateTime completedAt
) {
    public BatchReport {
        decisions = decisions == null ? DecisionCounts.NONE : decisions;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static BatchReport pending(UUID batchId, int submittedItems) {
        return new BatchReport(batchId, BatchStatus.PENDING, submittedItems, 0, 0, 0, 0, 0, 0,
            DecisionCounts.NONE, List.of(), null, OffsetDateTime.now(), null);
    }
}
