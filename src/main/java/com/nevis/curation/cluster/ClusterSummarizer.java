package com.nevis.curation.cluster;

import com.nevis.curation.model.ContentCluster;
import com.nevis.curation.model.ContentItem;

import java.util.List;

public interface ClusterSummarizer {

    /**
     * Attaches a consolidated summary to the cluster. Never throws for provider failures: the returned cluster
     * then has summary status {@code FAILED} and falls back to the representative's own summary.
     */
    ContentCluster summarize(ContentCluster cluster, List<ContentItem> members);
}
