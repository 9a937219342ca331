package com.nevis.curation.pipeline;

import com.nevis.curation.InMemoryRecordStore;
import com.nevis.curation.cluster.ClusterBuilder;
import com.nevis.curation.cluster.ClusterSummarizer;
import com.nevis.curation.cluster.ClusteringProperties;
import com.nevis.curation.config.AsyncConfig;
import com.nevis.curation.exception.EmbeddingUnavailableException;
import com.nevis.curation.exception.GenerationUnavailableException;
import com.nevis.curation.model.BatchReport;
import com.nevis.curation.model.BatchStatus;
import com.nevis.curation.model.BatchWarning;
import com.nevis.curation.model.ContentCluster;
import com.nevis.curation.model.ContentKind;
import com.nevis.curation.model.EnrichmentStatus;
import com.nevis.curation.model.IndexedContent;
import com.nevis.curation.model.ScoringWeights;
import com.nevis.curation.model.WarningType;
import com.nevis.curation.provider.EmbeddingProvider;
import com.nevis.curation.repository.RecordStore;
import com.nevis.curation.scoring.AlignmentAssessment;
import com.nevis.curation.scoring.QualityMetrics;
import com.nevis.curation.scoring.ScoringEngine;
import com.nevis.curation.scoring.ScoringOverrides;
import com.nevis.curation.scoring.ScoringProperties;
import com.nevis.curation.scoring.ScoringSignals;
import com.nevis.curation.scoring.SignalExtractionService;
import com.nevis.curation.scoring.TopicClassification;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.nevis.curation.TestItems.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CurationPipelineServiceTest {

    private static final float[] ROCKET = {1, 0, 0};
    private static final float[] BANK = {0, 1, 0};

    private static final ScoringSignals STRONG = new ScoringSignals(
        List.of(new AlignmentAssessment("ai", 0.9)),
        List.of(new TopicClassification("ai", 0.9)),
        0.5, 0.5, 0.5, new QualityMetrics(0.8, 0.8, 0.8, 0.8, 0.8));

    @Mock
    private EmbeddingProvider embeddingProvider;

    @Mock
    private ClusterSummarizer clusterSummarizer;

    @Mock
    private SignalExtractionService signalExtractionService;

    private final InMemoryRecordStore recordStore = new InMemoryRecordStore();
    private final AsyncTaskExecutor enrichmentExecutor = new AsyncConfig().enrichmentTaskExecutor();
    private final ExecutorService similarityExecutor = Executors.newFixedThreadPool(4);
    private final CountDownLatch stuckCalls = new CountDownLatch(1);
    private final UUID batchId = UUID.randomUUID();

    private CurationPipelineService pipeline;

    @BeforeEach
    void setUp() {
        pipeline = pipeline(Duration.ofSeconds(5));

        lenient().when(embeddingProvider.dimension()).thenReturn(3);
        lenient().when(embeddingProvider.embed(anyString()))
            .thenAnswer(invocation -> ((String) invocation.getArgument(0)).contains("Rocket") ? ROCKET : BANK);
        lenient().when(clusterSummarizer.summarize(any(), any()))
            .thenAnswer(invocation -> ((ContentCluster) invocation.getArgument(0))
                .withSummary("Consolidated rocket story").withSummaryStatus(EnrichmentStatus.READY));
        lenient().when(signalExtractionService.extract(any())).thenReturn(STRONG);
    }

    @AfterEach
    void tearDown() {
        stuckCalls.countDown();
        similarityExecutor.shutdownNow();
    }

    private CurationPipelineService pipeline(Duration timeout) {
        ScoringProperties scoringProperties = new ScoringProperties(ScoringWeights.DEFAULT, 0.65, 0.55, false, 0.0,
            List.of(), true, List.of());
        return new CurationPipelineService(
            embeddingProvider,
            new ClusterBuilder(ClusteringProperties.defaults()),
            clusterSummarizer,
            signalExtractionService,
            new ScoringEngine(scoringProperties, Clock.systemUTC()),
            scoringProperties,
            new PipelineProperties(3, 2, timeout, 8000, true, 1000),
            recordStore,
            enrichmentExecutor,
            similarityExecutor);
    }

    private static List<WarningType> warningTypes(BatchReport report) {
        return report.warnings().stream().map(BatchWarning::type).toList();
    }

    @Test
    @DisplayName("Should cluster duplicates, keep unique items and index both with scores")
    void shouldProcessBatch() {
        BatchRequest request = new BatchRequest(List.of(
            request("r1", "Rocket lands", "The booster landed."),
            request("r2", "Rocket lands again", "The booster landed on the barge."),
            request("b1", "Bank merger", "Two banks merged.")), null);

        BatchReport report = pipeline.process(batchId, request);

        assertThat(report.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(report.acceptedItems()).isEqualTo(3);
        assertThat(report.skippedItems()).isZero();
        assertThat(report.embeddedItems()).isEqualTo(3);
        assertThat(report.clusterCount()).isEqualTo(1);
        assertThat(report.uniqueItemCount()).isEqualTo(1);
        assertThat(report.decisions().total()).isEqualTo(2);
        assertThat(report.completedAt()).isNotNull();

        List<IndexedContent> indexed = recordStore.all(RecordStore.CONTENT, IndexedContent.class);
        assertThat(indexed).extracting(IndexedContent::kind).containsExactly(ContentKind.CLUSTER, ContentKind.ITEM);
        IndexedContent cluster = indexed.get(0);
        assertThat(cluster.memberIds()).containsExactly("r1", "r2");
        assertThat(cluster.summary()).isEqualTo("Consolidated rocket story");
        assertThat(cluster.batchId()).isEqualTo(batchId);
        assertThat(indexed.get(1).id()).isEqualTo("b1");

        assertThat(recordStore.get(RecordStore.BATCHES, batchId.toString(), BatchReport.class))
            .hasValueSatisfying(stored -> assertThat(stored.status()).isEqualTo(BatchStatus.COMPLETED));
        assertThat(recordStore.size(RecordStore.CLUSTERS)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should skip malformed and duplicate items individually")
    void shouldSkipMalformedItems() {
        List<BatchItemRequest> items = new ArrayList<>();
        items.add(request("ok", "Bank merger", "Two banks merged."));
        items.add(request("ok", "Bank merger repeat", "Duplicate id."));
        items.add(request("no-body", "Rocket", " "));
        items.add(new BatchItemRequest("bad-confidence", "Title", "Body", null, "https://x/y", null, null, 1.5,
            null, null, null, null, null));
        items.add(new BatchItemRequest(null, "Title", "Body", null, "https://x/y", null, null, 0.5,
            null, null, null, null, null));

        BatchReport report = pipeline.process(batchId, new BatchRequest(items, null));

        assertThat(report.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(report.acceptedItems()).isEqualTo(1);
        assertThat(report.skippedItems()).isEqualTo(4);
        assertThat(report.warnings()).filteredOn(w -> w.type() == WarningType.MALFORMED_ITEM).hasSize(4);
        assertThat(recordStore.all(RecordStore.CONTENT, IndexedContent.class)).singleElement()
            .satisfies(content -> assertThat(content.title()).isEqualTo("Bank merger"));
    }

    @Test
    @DisplayName("Should continue without an embedding when the provider fails")
    void shouldContinueWhenEmbeddingFails() {
        when(embeddingProvider.embed(anyString())).thenAnswer(invocation -> {
            String text = invocation.getArgument(0);
            if (text.contains("Broken")) {
                throw new EmbeddingUnavailableException("quota exceeded");
            }
            return BANK;
        });

        BatchReport report = pipeline.process(batchId, new BatchRequest(List.of(
            request("good", "Bank merger", "Two banks merged."),
            request("broken", "Broken item", "Cannot be embedded.")), null));

        assertThat(report.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(report.embeddedItems()).isEqualTo(1);
        assertThat(report.uniqueItemCount()).isEqualTo(2);
        assertThat(report.warnings()).anySatisfy(warning -> {
            assertThat(warning.itemId()).isEqualTo("broken");
            assertThat(warning.type()).isEqualTo(WarningType.EMBEDDING_UNAVAILABLE);
        });
        assertThat(recordStore.get(RecordStore.CONTENT, batchId + "/broken", IndexedContent.class))
            .hasValueSatisfying(content -> assertThat(content.hasEmbedding()).isFalse());
    }

    @Test
    @DisplayName("Should count an item that lost its embedding as a degraded default")
    void shouldCountMissingEmbeddingAsDegradedDefault() {
        BatchReport healthy = pipeline.process(UUID.randomUUID(), new BatchRequest(List.of(
            request("good", "Bank merger", "Two banks merged."),
            request("other", "Rocket lands", "Landing.")), null));

        when(embeddingProvider.embed(anyString())).thenAnswer(invocation -> {
            String text = invocation.getArgument(0);
            if (text.contains("Broken")) {
                throw new EmbeddingUnavailableException("quota exceeded");
            }
            return BANK;
        });
        BatchReport degraded = pipeline.process(batchId, new BatchRequest(List.of(
            request("good", "Bank merger", "Two banks merged."),
            request("broken", "Broken item", "Cannot be embedded.")), null));

        assertThat(degraded.embeddedItems()).isEqualTo(1);
        assertThat(degraded.degradedDefaults()).isEqualTo(healthy.degradedDefaults() + 1);
    }

    @Test
    @DisplayName("Should skip an item whose id is too long to be stored and index the rest")
    void shouldSkipOversizedIds() {
        String longId = "x".repeat(600);

        BatchReport report = pipeline.process(batchId, new BatchRequest(List.of(
            request(longId, "Rocket lands", "Landing."),
            request("bank", "Bank merger", "Two banks merged.")), null));

        assertThat(report.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(report.skippedItems()).isEqualTo(1);
        assertThat(report.warnings()).anySatisfy(warning -> {
            assertThat(warning.type()).isEqualTo(WarningType.MALFORMED_ITEM);
            assertThat(warning.message()).contains("must not be longer than");
        });
        assertThat(recordStore.all(RecordStore.CONTENT, IndexedContent.class))
            .extracting(IndexedContent::id)
            .containsExactly("bank");
    }

    @Test
    @DisplayName("Should give up on an embedding call after the timeout")
    void shouldTimeOutSlowEmbeddings() {
        pipeline = pipeline(Duration.ofMillis(200));
        when(embeddingProvider.embed(anyString())).thenAnswer(invocation -> {
            String text = invocation.getArgument(0);
            if (text.contains("Slow")) {
                Thread.sleep(5_000);
            }
            return BANK;
        });

        BatchReport report = pipeline.process(batchId, new BatchRequest(List.of(
            request("fast", "Bank merger", "Two banks merged."),
            request("slow", "Slow item", "Takes forever.")), null));

        assertThat(report.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(report.embeddedItems()).isEqualTo(1);
        assertThat(report.warnings()).anySatisfy(warning -> {
            assertThat(warning.itemId()).isEqualTo("slow");
            assertThat(warning.type()).isEqualTo(WarningType.EMBEDDING_UNAVAILABLE);
            assertThat(warning.message()).contains("timed out");
        });
    }

    @Test
    @DisplayName("Calls that ignore cancellation do not make later calls time out")
    void shouldNotStarveLaterCallsBehindStuckOnes() {
        pipeline = pipeline(Duration.ofMillis(200));
        when(embeddingProvider.embed(anyString())).thenAnswer(invocation -> {
            String text = invocation.getArgument(0);
            if (text.contains("Stuck")) {
                awaitIgnoringInterrupts(stuckCalls);
            }
            return text.contains("Rocket") ? ROCKET : BANK;
        });

        BatchReport report = pipeline.process(batchId, new BatchRequest(List.of(
            request("s1", "Stuck one", "Never answers."),
            request("s2", "Stuck two", "Never answers."),
            request("f1", "Rocket lands", "Landing."),
            request("f2", "Bank merger", "Two banks merged.")), null));

        assertThat(report.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(report.embeddedItems()).isEqualTo(2);
        assertThat(report.warnings())
            .filteredOn(warning -> warning.type() == WarningType.EMBEDDING_UNAVAILABLE)
            .extracting(BatchWarning::itemId)
            .containsExactlyInAnyOrder("s1", "s2");
        assertThat(recordStore.get(RecordStore.CONTENT, CurationPipelineService.key(batchId, "f1"),
            IndexedContent.class)).hasValueSatisfying(content -> assertThat(content.embedding()).isNotNull());
        assertThat(recordStore.get(RecordStore.CONTENT, CurationPipelineService.key(batchId, "f2"),
            IndexedContent.class)).hasValueSatisfying(content -> assertThat(content.embedding()).isNotNull());
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        while (latch.getCount() > 0) {
            try {
                latch.await();
            } catch (InterruptedException ignored) {
                // keep hanging like a provider that does not honour cancellation
            }
        }
    }

    @Test
    @DisplayName("Should leave items with a wrong vector length out of clustering")
    void shouldReportDimensionMismatch() {
        when(embeddingProvider.embed(anyString())).thenAnswer(invocation ->
            ((String) invocation.getArgument(0)).contains("Odd") ? new float[]{1, 0} : ROCKET);

        BatchReport report = pipeline.process(batchId, new BatchRequest(List.of(
            request("r1", "Rocket lands", "Landing."),
            request("r2", "Rocket lands", "Landing."),
            request("odd", "Odd vector", "Too short.")), null));

        assertThat(report.clusterCount()).isEqualTo(1);
        assertThat(report.uniqueItemCount()).isEqualTo(1);
        assertThat(report.embeddedItems()).isEqualTo(2);
        assertThat(warningTypes(report)).contains(WarningType.DIMENSION_MISMATCH);
    }

    @Test
    @DisplayName("Should degrade to default signals when extraction fails and use supplied signals as is")
    void shouldHandleSignalSources() {
        when(signalExtractionService.extract(any())).thenThrow(new GenerationUnavailableException("model down"));
        BatchItemRequest supplied = new BatchItemRequest("sig", "Bank merger", "Two banks merged.", null,
            "https://x/sig", null, null, 0.9, Instant.now(), null, List.of(), Map.of(), STRONG);

        BatchReport report = pipeline.process(batchId, new BatchRequest(List.of(
            supplied,
            request("plain", "Rocket lands", "Landing.")), null));

        assertThat(report.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(report.warnings()).anySatisfy(warning -> {
            assertThat(warning.itemId()).isEqualTo("plain");
            assertThat(warning.type()).isEqualTo(WarningType.GENERATION_UNAVAILABLE);
        });
        assertThat(report.warnings()).noneSatisfy(warning -> assertThat(warning.itemId()).isEqualTo("sig"));
        assertThat(report.degradedDefaults()).isEqualTo(3);
        assertThat(report.decisions().include()).isEqualTo(1);
        assertThat(report.decisions().exclude()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should record a warning when the cluster summary falls back")
    void shouldWarnOnSummaryFallback() {
        doAnswer(invocation -> ((ContentCluster) invocation.getArgument(0))
            .withSummary("Rocket lands").withSummaryStatus(EnrichmentStatus.FAILED))
            .when(clusterSummarizer).summarize(any(), any());

        BatchReport report = pipeline.process(batchId, new BatchRequest(List.of(
            request("r1", "Rocket lands", "Landing."),
            request("r2", "Rocket lands", "Landing.")), null));

        assertThat(report.clusterCount()).isEqualTo(1);
        assertThat(warningTypes(report)).contains(WarningType.GENERATION_UNAVAILABLE);
    }

    @Test
    @DisplayName("Should fail the batch when override weights do not sum to one")
    void shouldFailOnInvalidWeights() {
        ScoringOverrides overrides = new ScoringOverrides(new ScoringWeights(0.5, 0.5, 0.5, 0.5), null, null, null, null);

        BatchReport report = pipeline.process(batchId, new BatchRequest(List.of(
            request("r1", "Rocket lands", "Landing.")), overrides));

        assertThat(report.status()).isEqualTo(BatchStatus.FAILED);
        assertThat(report.errorMessage()).contains("sum to 1.0");
        assertThat(recordStore.size(RecordStore.CONTENT)).isZero();
        verify(embeddingProvider, never()).embed(anyString());
    }
}
