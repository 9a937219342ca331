package com.nevis.curation.pipeline;

import com.nevis.curation.cluster.ClusterBuilder;
import com.nevis.curation.cluster.ClusterSummarizer;
import com.nevis.curation.cluster.ClusteringResult;
import com.nevis.curation.exception.DimensionMismatchException;
import com.nevis.curation.exception.InvalidWeightsException;
import com.nevis.curation.exception.MalformedItemException;
import com.nevis.curation.model.BatchReport;
import com.nevis.curation.model.BatchStatus;
import com.nevis.curation.model.BatchWarning;
import com.nevis.curation.model.ContentCluster;
import com.nevis.curation.model.ContentItem;
import com.nevis.curation.model.ContentKind;
import com.nevis.curation.model.EnrichmentStatus;
import com.nevis.curation.model.IndexedContent;
import com.nevis.curation.model.WarningType;
import com.nevis.curation.provider.EmbeddingProvider;
import com.nevis.curation.repository.RecordStore;
import com.nevis.curation.scoring.ScoredItem;
import com.nevis.curation.scoring.ScoringEngine;
import com.nevis.curation.scoring.ScoringPolicy;
import com.nevis.curation.scoring.ScoringProperties;
import com.nevis.curation.scoring.ScoringRequest;
import com.nevis.curation.scoring.ScoringResult;
import com.nevis.curation.scoring.ScoringSignals;
import com.nevis.curation.scoring.SignalExtractionService;
import com.nevis.curation.similarity.SimilarityMatrix;
import com.nevis.curation.similarity.VectorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one batch end to end: validation, embedding, similarity, clustering, summaries, scoring and indexing.
 * <p>
 * Problems with individual items are recorded as warnings on the report and never stop the batch. Only a
 * broken scoring policy or an unexpected fault ends the batch as {@link BatchStatus#FAILED}.
 */
@Slf4j
@Service
public class CurationPipelineService {

    private final EmbeddingProvider embeddingProvider;
    private final ClusterBuilder clusterBuilder;
    private final ClusterSummarizer clusterSummarizer;
    private final SignalExtractionService signalExtractionService;
    private final ScoringEngine scoringEngine;
    private final ScoringProperties scoringProperties;
    private final PipelineProperties pipelineProperties;
    private final RecordStore recordStore;
    private final AsyncTaskExecutor enrichmentExecutor;
    private final Executor similarityExecutor;

    public CurationPipelineService(EmbeddingProvider embeddingProvider,
                                   ClusterBuilder clusterBuilder,
                                   ClusterSummarizer clusterSummarizer,
                                   SignalExtractionService signalExtractionService,
                                   ScoringEngine scoringEngine,
                                   ScoringProperties scoringProperties,
                                   PipelineProperties pipelineProperties,
                                   RecordStore recordStore,
                                   @Qualifier("enrichmentTaskExecutor") AsyncTaskExecutor enrichmentExecutor,
                                   @Qualifier("similarityTaskExecutor") Executor similarityExecutor) {
        this.embeddingProvider = embeddingProvider;
        this.clusterBuilder = clusterBuilder;
        this.clusterSummarizer = clusterSummarizer;
        this.signalExtractionService = signalExtractionService;
        this.scoringEngine = scoringEngine;
        this.scoringProperties = scoringProperties;
        this.pipelineProperties = pipelineProperties;
        this.recordStore = recordStore;
        this.enrichmentExecutor = enrichmentExecutor;
        this.similarityExecutor = similarityExecutor;
    }

    public BatchReport process(UUID batchId, BatchRequest request) {
        BatchReport report = recordStore.get(RecordStore.BATCHES, batchId.toString(), BatchReport.class)
            .orElseGet(() -> BatchReport.pending(batchId, request.items().size()))
            .withStatus(BatchStatus.PROCESSING);
        recordStore.put(RecordStore.BATCHES, batchId.toString(), report);
        log.info("Processing batch {} with {} submitted items", batchId, request.items().size());

        List<BatchWarning> warnings = new ArrayList<>();
        try {
            BatchReport completed = run(batchId, request, report, warnings);
            log.info("Batch {} completed: {} clusters, {} unique items, decisions {}",
                batchId, completed.clusterCount(), completed.uniqueItemCount(), completed.decisions());
            return completed;
        } catch (InvalidWeightsException e) {
            log.error("Batch {} rejected by scoring policy: {}", batchId, e.getMessage());
            return fail(report, warnings, e);
        } catch (Exception e) {
            log.error("Batch {} failed", batchId, e);
            return fail(report, warnings, e);
        }
    }

    private BatchReport run(UUID batchId, BatchRequest request, BatchReport report, List<BatchWarning> warnings) {
        ScoringPolicy policy = scoringProperties.defaultPolicy().withOverrides(request.scoring()).validate();

        Map<String, ScoringSignals> suppliedSignals = new HashMap<>();
        List<ContentItem> accepted = accept(request.items(), suppliedSignals, warnings);
        int skipped = request.items().size() - accepted.size();

        List<ContentItem> enriched = enrich(accepted, warnings);

        VectorStore store = new VectorStore(embeddingProvider.dimension());
        List<ContentItem> indexed = new ArrayList<>(enriched.size());
        for (ContentItem item : enriched) {
            indexed.add(storeVector(store, item, warnings));
        }

        SimilarityMatrix matrix = SimilarityMatrix.compute(store, similarityExecutor);
        ClusteringResult clustering = clusterBuilder.build(batchId, indexed, matrix);

        List<ContentCluster> clusters = summarize(clustering, warnings);
        Map<String, ContentItem> byId = new HashMap<>();
        clustering.items().forEach(item -> byId.put(item.id(), item));

        List<ScoringRequest> requests = new ArrayList<>();
        for (ContentCluster cluster : clusters) {
            ContentItem representative = byId.get(cluster.representativeId());
            ContentItem scoredView = representative.withSummary(cluster.summary());
            requests.add(new ScoringRequest(scoredView, signalsFor(representative, suppliedSignals, warnings)));
        }
        for (ContentItem item : clustering.uniqueItems()) {
            requests.add(new ScoringRequest(item, signalsFor(item, suppliedSignals, warnings)));
        }

        ScoringResult scoring = scoringEngine.scoreBatch(requests, policy);
        for (ScoredItem scored : scoring.items()) {
            if (!scored.defaulted().isEmpty()) {
                warnings.add(new BatchWarning(scored.itemId(), WarningType.SCORING_DEFAULT,
                    "Defaults applied to " + String.join(", ", scored.defaulted())));
            }
        }

        int embedded = (int) indexed.stream().filter(item -> store.contains(item.id())).count();
        BatchReport completed = report
            .withStatus(BatchStatus.COMPLETED)
            .withAcceptedItems(accepted.size())
            .withSkippedItems(skipped)
            .withEmbeddedItems(embedded)
            .withDegradedDefaults(scoring.degradedDefaults() + (accepted.size() - embedded))
            .withClusterCount(clusters.size())
            .withUniqueItemCount(clustering.uniqueItems().size())
            .withDecisions(scoring.decisionCounts())
            .withWarnings(warnings)
            .withCompletedAt(OffsetDateTime.now());

        index(batchId, clusters, clustering, byId, scoring, completed);
        return completed;
    }

    private List<ContentItem> accept(List<BatchItemRequest> items, Map<String, ScoringSignals> suppliedSignals,
                                     List<BatchWarning> warnings) {
        Set<String> seenIds = new HashSet<>();
        List<ContentItem> accepted = new ArrayList<>(items.size());
        for (BatchItemRequest item : items) {
            if (item == null) {
                warnings.add(new BatchWarning(null, WarningType.MALFORMED_ITEM, "Empty item"));
                continue;
            }
            try {
                ContentItem contentItem = ItemValidator.toContentItem(item, seenIds);
                accepted.add(contentItem);
                if (item.signals() != null) {
                    suppliedSignals.put(contentItem.id(), item.signals());
                }
            } catch (MalformedItemException e) {
                log.warn("Skipping item: {}", e.getMessage());
                warnings.add(new BatchWarning(e.getItemId(), WarningType.MALFORMED_ITEM, e.getMessage()));
            }
        }
        return accepted;
    }

    /**
     * Embeds items in windows of at most {@code enrichment-concurrency} calls. Each call has its own deadline,
     * counted from its submission; a call that misses it is cancelled with an interrupt and the item continues
     * without an embedding.
     */
    private List<ContentItem> enrich(List<ContentItem> items, List<BatchWarning> warnings) {
        int window = pipelineProperties.enrichmentConcurrency();
        long timeoutNanos = pipelineProperties.enrichmentTimeout().toNanos();
        List<ContentItem> result = new ArrayList<>(items.size());

        for (int from = 0; from < items.size(); from += window) {
            List<ContentItem> slice = items.subList(from, Math.min(from + window, items.size()));
            List<Future<float[]>> calls = new ArrayList<>(slice.size());
            long[] deadlines = new long[slice.size()];
            for (int i = 0; i < slice.size(); i++) {
                ContentItem item = slice.get(i);
                deadlines[i] = System.nanoTime() + timeoutNanos;
                calls.add(enrichmentExecutor.submit(() -> embeddingProvider.embed(embeddingInput(item))));
            }

            for (int i = 0; i < slice.size(); i++) {
                result.add(awaitEmbedding(slice.get(i), calls.get(i), deadlines[i], warnings));
            }
        }
        log.info("Enrichment finished: {} of {} items embedded",
            result.stream().filter(ContentItem::hasEmbedding).count(), items.size());
        return result;
    }

    private ContentItem awaitEmbedding(ContentItem item, Future<float[]> call, long deadlineNanos,
                                       List<BatchWarning> warnings) {
        long timeoutMillis = pipelineProperties.enrichmentTimeout().toMillis();
        try {
            long remaining = Math.max(0, deadlineNanos - System.nanoTime());
            float[] vector = call.get(remaining, TimeUnit.NANOSECONDS);
            return item.withEmbedding(vector).withEnrichmentStatus(EnrichmentStatus.READY);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Embedding timed out for item {} after {} ms", item.id(), timeoutMillis);
            warnings.add(new BatchWarning(item.id(), WarningType.EMBEDDING_UNAVAILABLE,
                "Embedding timed out after " + timeoutMillis + " ms"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Embedding failed for item {}: {}", item.id(), cause.getMessage());
            warnings.add(new BatchWarning(item.id(), WarningType.EMBEDDING_UNAVAILABLE, cause.getMessage()));
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while embedding item " + item.id(), e);
        }
        return item.withEmbedding(null).withEnrichmentStatus(EnrichmentStatus.FAILED);
    }

    private String embeddingInput(ContentItem item) {
        String text = item.embeddingText();
        int max = pipelineProperties.maxEmbeddingChars();
        return text.length() > max ? text.substring(0, max) : text;
    }

    private ContentItem storeVector(VectorStore store, ContentItem item, List<BatchWarning> warnings) {
        if (!item.hasEmbedding()) {
            return item;
        }
        try {
            store.put(item.id(), item.embedding());
            return item;
        } catch (DimensionMismatchException e) {
            log.warn("Item {} left out of clustering: {}", item.id(), e.getMessage());
            warnings.add(new BatchWarning(item.id(), WarningType.DIMENSION_MISMATCH, e.getMessage()));
            return item.withEmbedding(null).withEnrichmentStatus(EnrichmentStatus.FAILED);
        }
    }

    private List<ContentCluster> summarize(ClusteringResult clustering, List<BatchWarning> warnings) {
        List<ContentCluster> summarized = new ArrayList<>(clustering.clusters().size());
        for (ContentCluster cluster : clustering.clusters()) {
            if (!pipelineProperties.summarizeClusters()) {
                summarized.add(cluster);
                continue;
            }
            ContentCluster result = clusterSummarizer.summarize(cluster, clustering.membersOf(cluster));
            if (result.summaryStatus() == EnrichmentStatus.FAILED) {
                warnings.add(new BatchWarning(cluster.id(), WarningType.GENERATION_UNAVAILABLE,
                    "Cluster summary unavailable, representative summary kept"));
            }
            summarized.add(result);
        }
        return summarized;
    }

    private ScoringSignals signalsFor(ContentItem item, Map<String, ScoringSignals> suppliedSignals,
                                      List<BatchWarning> warnings) {
        ScoringSignals supplied = suppliedSignals.get(item.id());
        if (supplied != null) {
            return supplied;
        }
        if (!scoringProperties.extractSignals()) {
            return ScoringSignals.none();
        }
        try {
            return signalExtractionService.extract(item);
        } catch (RuntimeException e) {
            log.warn("Signal extraction failed for item {}: {}", item.id(), e.getMessage());
            warnings.add(new BatchWarning(item.id(), WarningType.GENERATION_UNAVAILABLE, e.getMessage()));
            return ScoringSignals.none();
        }
    }

    /**
     * Writes the batch output and its completed report in one atomic call, so a failed write leaves no partial
     * output behind.
     */
    private void index(UUID batchId, List<ContentCluster> clusters, ClusteringResult clustering,
                       Map<String, ContentItem> byId, ScoringResult scoring, BatchReport completed) {
        Map<String, ScoredItem> scores = new HashMap<>();
        scoring.items().forEach(scored -> scores.put(scored.itemId(), scored));
        List<RecordStore.StoredRecord> records = new ArrayList<>();

        for (ContentCluster cluster : clusters) {
            ContentItem representative = byId.get(cluster.representativeId());
            ScoredItem scored = scores.get(representative.id());
            Set<String> tags = new LinkedHashSet<>();
            clustering.membersOf(cluster).forEach(member -> tags.addAll(member.metadata().tags()));

            records.add(new RecordStore.StoredRecord(RecordStore.CLUSTERS, key(batchId, cluster.id()), cluster));
            records.add(new RecordStore.StoredRecord(RecordStore.CONTENT, key(batchId, cluster.id()),
                new IndexedContent(cluster.id(), batchId, ContentKind.CLUSTER, representative.title(),
                    cluster.summary(), representative.sourceUrl(), representative.domain(), List.copyOf(tags),
                    cluster.averageExtractionConfidence(), representative.embedding(), cluster.memberIds(),
                    scored.score(), scored.decision())));
        }

        for (ContentItem item : clustering.uniqueItems()) {
            ScoredItem scored = scores.get(item.id());
            records.add(new RecordStore.StoredRecord(RecordStore.CONTENT, key(batchId, item.id()), new IndexedContent(
                item.id(), batchId, ContentKind.ITEM, item.title(), item.summary(), item.sourceUrl(), item.domain(),
                item.metadata().tags(), item.extractionConfidence(), item.embedding(), List.of(),
                scored.score(), scored.decision())));
        }

        records.add(new RecordStore.StoredRecord(RecordStore.BATCHES, batchId.toString(), completed));
        recordStore.putAll(records);
        log.debug("Indexed {} clusters and {} unique items for batch {}",
            clusters.size(), clustering.uniqueItems().size(), batchId);
    }

    private BatchReport fail(BatchReport report, List<BatchWarning> warnings, Exception e) {
        BatchReport failed = report
            .withStatus(BatchStatus.FAILED)
            .withWarnings(warnings)
            .withErrorMessage(e.getMessage())
            .withCompletedAt(OffsetDateTime.now());
        recordStore.put(RecordStore.BATCHES, report.batchId().toString(), failed);
        return failed;
    }

    static String key(UUID batchId, String id) {
        return batchId + "/" + id;
    }
}
