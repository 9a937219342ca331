package com.nevis.curation;

import com.nevis.curation.model.BatchReport;
import com.nevis.curation.model.BatchStatus;
import com.nevis.curation.model.ContentCluster;
import com.nevis.curation.model.ContentKind;
import com.nevis.curation.repository.BaseIntegrationTest;
import com.nevis.curation.retrieval.RetrievalMode;
import com.nevis.curation.retrieval.RetrievalResponse;
import com.nevis.curation.retrieval.RetrievalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class CurationE2ETest extends BaseIntegrationTest {

    private static final String STORY = "The central bank raised interest rates by half a point on Tuesday, "
        + "citing persistent inflation and a tight labour market across the region.";

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private JdbcClient jdbcClient;

    private TestRestTemplate curator;

    @BeforeEach
    void setUp() {
        jdbcClient.sql("DELETE FROM curation_records").update();
        curator = restTemplate.withBasicAuth("curator", "curator");
    }

    @Test
    @DisplayName("E2E: duplicates collapse into one cluster and the batch becomes retrievable")
    void shouldCurateAndRetrieveBatch() {
        String publishedAt = Instant.now().toString();
        Map<String, Object> batch = Map.of("items", List.of(
            item("wire-1", "Central bank raises rates", STORY, "https://wire.example.com/1", publishedAt),
            item("wire-2", "Central bank raises rates", STORY, "https://mirror.example.org/2", publishedAt),
            item("sport-1", "Local club wins derby",
                "A late header settled the derby as the home side climbed to third place in the league table.",
                "https://sport.example.com/3", publishedAt)));

        ResponseEntity<BatchReport> submitted = curator.postForEntity("/batches", batch, BatchReport.class);
        assertThat(submitted.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        UUID batchId = submitted.getBody().batchId();

        BatchReport report = waitForCompletion(batchId);
        assertThat(report.acceptedItems()).isEqualTo(3);
        assertThat(report.clusterCount()).isEqualTo(1);
        assertThat(report.uniqueItemCount()).isEqualTo(1);
        assertThat(report.decisions().total()).isEqualTo(2);

        ContentCluster[] clusters = curator.getForObject("/batches/" + batchId + "/clusters", ContentCluster[].class);
        assertThat(clusters).hasSize(1);
        assertThat(clusters[0].memberIds()).containsExactly("wire-1", "wire-2");
        assertThat(clusters[0].hasSummary()).isTrue();

        RetrievalResponse filtered = curator.postForObject("/retrieval/search",
            Map.of("filters", Map.of("batch_ids", List.of(batchId), "kind", "CLUSTER")), RetrievalResponse.class);
        assertThat(filtered.mode()).isEqualTo(RetrievalMode.FILTER_ONLY);
        assertThat(filtered.results()).extracting(RetrievalResult::kind).containsExactly(ContentKind.CLUSTER);

        RetrievalResponse ranked = curator.postForObject("/retrieval/search",
            Map.of("query", "central bank interest rates inflation",
                "filters", Map.of("batch_ids", List.of(batchId))), RetrievalResponse.class);
        assertThat(ranked.mode()).isEqualTo(RetrievalMode.SIMILARITY);
        assertThat(ranked.results()).isNotEmpty().hasSizeLessThanOrEqualTo(2);
        assertThat(ranked.results().get(0).kind()).isEqualTo(ContentKind.CLUSTER);
        assertThat(ranked.results())
            .extracting(RetrievalResult::similarity)
            .isSortedAccordingTo(Comparator.reverseOrder());
    }

    @Test
    @DisplayName("E2E: unknown batches return 404 and anonymous calls 401")
    void shouldRejectUnknownAndAnonymous() {
        assertThat(curator.getForEntity("/batches/" + UUID.randomUUID(), String.class).getStatusCode())
            .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(restTemplate.getForEntity("/batches/" + UUID.randomUUID(), String.class).getStatusCode())
            .isEqualTo(HttpStatus.UNAUTHORIZED);
    }

    private static Map<String, Object> item(String id, String title, String body, String url, String publishedAt) {
        return Map.of(
            "id", id,
            "title", title,
            "body", body,
            "source_url", url,
            "extraction_confidence", 0.9,
            "published_at", publishedAt,
            "tags", List.of("news"));
    }

    private BatchReport waitForCompletion(UUID batchId) {
        await().atMost(30, TimeUnit.SECONDS).pollInterval(200, TimeUnit.MILLISECONDS).untilAsserted(() -> {
            BatchReport report = curator.getForObject("/batches/" + batchId, BatchReport.class);
            assertThat(report.status()).isEqualTo(BatchStatus.COMPLETED);
        });
        return curator.getForObject("/batches/" + batchId, BatchReport.class);
    }
}
