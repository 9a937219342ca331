package com.nevis.curation.cluster;

import com.nevis.curation.model.ContentCluster;
import com.nevis.curation.model.ContentItem;
import com.nevis.curation.model.EnrichmentStatus;
import com.nevis.curation.similarity.Neighbor;
import com.nevis.curation.similarity.SimilarityMatrix;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Groups the items of one batch into clusters of mutually similar content.
 * <p>
 * Items are graph nodes joined when their similarity reaches the same-story threshold; every connected
 * component of two or more items becomes a cluster. Oversized clusters are then split into fixed-size chunks,
 * and finally near-identical clusters are merged in a single greedy pass. Items that end up in no cluster stay
 * unique.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClusterBuilder {

    private static final Comparator<ContentItem> SPLIT_ORDER = Comparator
        .comparing(ContentItem::sourceUrl, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(ContentItem::id);

    private static final Comparator<ContentItem> REPRESENTATIVE_ORDER = Comparator
        .comparingDouble(ContentItem::extractionConfidence).reversed()
        .thenComparing(Comparator.comparingInt(ContentItem::wordCount).reversed())
        .thenComparing(ContentItem::id);

    private final ClusteringProperties properties;

    private record Draft(List<String> members, double confidence, double cohesion, boolean split) {}

    public ClusteringResult build(UUID batchId, List<ContentItem> items, SimilarityMatrix matrix) {
        Map<String, ContentItem> byId = new LinkedHashMap<>();
        Map<String, Integer> position = new HashMap<>();
        for (ContentItem item : items) {
            byId.put(item.id(), item);
            position.put(item.id(), position.size());
        }

        List<Draft> discovered = discover(items, matrix, position);
        List<Draft> split = split(discovered, byId, position);
        List<Draft> merged = merge(split, matrix, position);

        List<ContentCluster> clusters = new ArrayList<>(merged.size());
        Map<String, ContentItem> assigned = new HashMap<>();
        for (Draft draft : merged) {
            ContentCluster cluster = finalizeCluster(batchId, draft, byId, matrix);
            clusters.add(cluster);
            for (String memberId : cluster.memberIds()) {
                assigned.put(memberId, assign(byId.get(memberId), cluster));
            }
        }

        List<ContentItem> result = items.stream()
            .map(item -> assigned.getOrDefault(item.id(), unassign(item)))
            .toList();

        log.info("Batch {}: {} items grouped into {} clusters, {} unique",
            batchId, items.size(), clusters.size(), items.size() - assigned.size());
        return new ClusteringResult(clusters, result);
    }

    /**
     * Depth-first search over similarity edges. Components are emitted in order of their first item and members
     * are kept in batch order.
     */
    private List<Draft> discover(List<ContentItem> items, SimilarityMatrix matrix, Map<String, Integer> position) {
        Set<String> visited = new HashSet<>();
        List<Draft> drafts = new ArrayList<>();

        for (ContentItem item : items) {
            String start = item.id();
            if (!matrix.contains(start) || !visited.add(start)) {
                continue;
            }

            List<String> component = new ArrayList<>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                String current = stack.pop();
                component.add(current);
                for (Neighbor neighbor : matrix.neighbors(current, properties.sameStoryThreshold())) {
                    if (position.containsKey(neighbor.id()) && visited.add(neighbor.id())) {
                        stack.push(neighbor.id());
                    }
                }
            }

            if (component.size() >= ClusteringProperties.MIN_CLUSTER_SIZE) {
                component.sort(Comparator.comparing(position::get));
                ClusterStatistics stats = ClusterStatistics.over(component, matrix);
                drafts.add(new Draft(component, stats.confidence(), stats.cohesion(), false));
            }
        }
        return drafts;
    }

    private List<Draft> split(List<Draft> drafts, Map<String, ContentItem> byId, Map<String, Integer> position) {
        int max = properties.maxClusterSize();
        double discount = properties.splitConfidenceDiscount();
        List<Draft> result = new ArrayList<>();

        for (Draft draft : drafts) {
            if (draft.members().size() <= max) {
                result.add(draft);
                continue;
            }

            List<String> ordered = draft.members().stream()
                .map(byId::get)
                .sorted(SPLIT_ORDER)
                .map(ContentItem::id)
                .toList();

            for (int from = 0; from < ordered.size(); from += max) {
                List<String> chunk = new ArrayList<>(ordered.subList(from, Math.min(from + max, ordered.size())));
                if (chunk.size() < ClusteringProperties.MIN_CLUSTER_SIZE) {
                    log.debug("Split remainder {} returned to the unique pool", chunk);
                    continue;
                }
                chunk.sort(Comparator.comparing(position::get));
                result.add(new Draft(chunk, draft.confidence() * discount, draft.cohesion() * discount, true));
            }
            log.debug("Split cluster of {} members into chunks of at most {}", draft.members().size(), max);
        }
        return result;
    }

    /**
     * Single greedy pass: each cluster, in order, merges with the first later cluster it is close enough to.
     * A cluster takes part in at most one merge, and merges that would exceed the maximum size are skipped.
     */
    private List<Draft> merge(List<Draft> drafts, SimilarityMatrix matrix, Map<String, Integer> position) {
        boolean[] used = new boolean[drafts.size()];
        List<Draft> result = new ArrayList<>();

        for (int i = 0; i < drafts.size(); i++) {
            if (used[i]) {
                continue;
            }
            Draft current = drafts.get(i);
            Draft mergedDraft = null;

            for (int j = i + 1; j < drafts.size(); j++) {
                if (used[j]) {
                    continue;
                }
                Draft candidate = drafts.get(j);
                if (current.members().size() + candidate.members().size() > properties.maxClusterSize()) {
                    continue;
                }
                double similarity = ClusterStatistics.between(current.members(), candidate.members(), matrix);
                if (similarity > properties.mergeThreshold()) {
                    mergedDraft = combine(current, candidate, position);
                    used[i] = true;
                    used[j] = true;
                    log.debug("Merged clusters of {} and {} members (similarity {})",
                        current.members().size(), candidate.members().size(), similarity);
                    break;
                }
            }
            result.add(mergedDraft != null ? mergedDraft : current);
        }
        return result;
    }

    private Draft combine(Draft first, Draft second, Map<String, Integer> position) {
        int firstSize = first.members().size();
        int secondSize = second.members().size();
        int total = firstSize + secondSize;

        List<String> members = new ArrayList<>(total);
        members.addAll(first.members());
        members.addAll(second.members());
        members.sort(Comparator.comparing(position::get));

        double confidence = (first.confidence() * firstSize + second.confidence() * secondSize) / total;
        double cohesion = (first.cohesion() * firstSize + second.cohesion() * secondSize) / total;
        return new Draft(members, confidence, cohesion, first.split() || second.split());
    }

    private ContentCluster finalizeCluster(UUID batchId, Draft draft, Map<String, ContentItem> byId,
                                           SimilarityMatrix matrix) {
        List<ContentItem> members = draft.members().stream().map(byId::get).toList();
        ClusterStatistics stats = ClusterStatistics.over(draft.members(), matrix);
        ContentItem representative = members.stream().min(REPRESENTATIVE_ORDER).orElseThrow();

        int totalWords = members.stream().mapToInt(ContentItem::wordCount).sum();
        double averageConfidence = members.stream().mapToDouble(ContentItem::extractionConfidence).average().orElse(0.0);
        int distinctDomains = (int) members.stream().map(ContentItem::domain).filter(Objects::nonNull).distinct().count();

        return new ContentCluster(
            ClusterIds.forMembers(draft.members()),
            batchId,
            draft.members(),
            representative.id(),
            null,
            EnrichmentStatus.PENDING,
            clampUnit(draft.confidence()),
            clampUnit(draft.cohesion()),
            stats.average(),
            properties.classify(stats.average()),
            totalWords,
            averageConfidence,
            distinctDomains,
            draft.split()
        );
    }

    private ContentItem assign(ContentItem item, ContentCluster cluster) {
        boolean representative = item.id().equals(cluster.representativeId());
        return item
            .withClusterId(cluster.id())
            .withParentId(representative ? null : cluster.representativeId())
            .withRepresentative(representative)
            .withAbsorbedCount(representative ? cluster.size() - 1 : 0);
    }

    private ContentItem unassign(ContentItem item) {
        return item.withClusterId(null).withParentId(null).withRepresentative(false).withAbsorbedCount(0);
    }

    private static double clampUnit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
