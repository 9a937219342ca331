package com.nevis.curation.retrieval;

public interface RetrievalService {

    /**
     * Selects and ranks indexed content. Never modifies stored state.
     */
    RetrievalResponse search(RetrievalRequest request);
}
