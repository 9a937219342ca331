package com.nevis.curation.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RetrievalResponse(
    RetrievalMode mode,
    @JsonProperty("total_candidates") int totalCandidates,
    List<RetrievalResult> results
) {}
