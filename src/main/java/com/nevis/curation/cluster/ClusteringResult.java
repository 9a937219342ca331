package com.nevis.curation.cluster;

import com.nevis.curation.model.ContentCluster;
import com.nevis.curation.model.ContentItem;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Clusters found in a batch together with every item of the batch, carrying its cluster assignment.
 */
public record ClusteringResult(List<ContentCluster> clusters, List<ContentItem> items) {

    public ClusteringResult {
        clusters = List.copyOf(clusters);
        items = List.copyOf(items);
    }

    public List<ContentItem> uniqueItems() {
        return items.stream().filter(item -> !item.isClustered()).toList();
    }

    public List<ContentItem> membersOf(ContentCluster cluster) {
        Map<String, ContentItem> byId = items.stream()
            .collect(Collectors.toMap(ContentItem::id, Function.identity()));
        return cluster.memberIds().stream().map(byId::get).toList();
    }
}
