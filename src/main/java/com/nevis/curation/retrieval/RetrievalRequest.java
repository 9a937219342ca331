package com.nevis.curation.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * A retrieval query. With a query vector or query text the results are ranked by similarity; without either
 * they are ranked by composite relevance score.
 */
public record RetrievalRequest(
    @Size(max = 500) String query,
    @JsonProperty("query_vector") float[] queryVector,
    @JsonProperty("number_of_results") @Min(1) Integer numberOfResults,
    @JsonProperty("min_relevance_score") @DecimalMin("0.0") @DecimalMax("1.0") Double minRelevanceScore,
    RetrievalFilters filters
) {
    public RetrievalRequest {
        filters = filters == null ? RetrievalFilters.NONE : filters;
    }

    public static RetrievalRequest filterOnly(RetrievalFilters filters, Integer numberOfResults) {
        return new RetrievalRequest(null, null, numberOfResults, null, filters);
    }

    @JsonIgnore
    public boolean isSimilarityRanked() {
        return (queryVector != null && queryVector.length > 0) || (query != null && !query.isBlank());
    }
}
