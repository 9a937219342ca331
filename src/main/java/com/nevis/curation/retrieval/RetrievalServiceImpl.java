package com.nevis.curation.retrieval;

import com.nevis.curation.exception.WrongQueryException;
import com.nevis.curation.model.IndexedContent;
import com.nevis.curation.provider.EmbeddingProvider;
import com.nevis.curation.repository.RecordStore;
import com.nevis.curation.similarity.CosineSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalServiceImpl implements RetrievalService {

    private static final int MIN_QUERY_LENGTH = 3;

    // Ids are unique per batch only, so the batch id completes the order.
    private static final Comparator<IndexedContent> BY_ID = Comparator
        .comparing(IndexedContent::id)
        .thenComparing(IndexedContent::batchId);

    private static final Comparator<IndexedContent> BY_COMPOSITE = Comparator
        .comparingDouble(RetrievalServiceImpl::composite).reversed()
        .thenComparing(BY_ID);

    private static final Comparator<Ranked> BY_SIMILARITY = Comparator
        .comparingDouble(Ranked::similarity).reversed()
        .thenComparing(Ranked::content, BY_ID);

    private final RecordStore recordStore;
    private final EmbeddingProvider embeddingProvider;
    private final RetrievalProperties properties;

    private record Ranked(IndexedContent content, double similarity) {}

    @Override
    public RetrievalResponse search(RetrievalRequest request) {
        int limit = resolveLimit(request.numberOfResults());
        RetrievalFilters filters = request.filters();

        List<IndexedContent> candidates = recordStore.query(RecordStore.CONTENT, IndexedContent.class,
            content -> filters.matches(content, properties.highQualityThreshold()));

        if (!request.isSimilarityRanked()) {
            log.debug("Filter-only retrieval over {} candidates, limit {}", candidates.size(), limit);
            List<RetrievalResult> results = candidates.stream()
                .sorted(BY_COMPOSITE)
                .limit(limit)
                .map(content -> RetrievalResult.of(content, null))
                .toList();
            return new RetrievalResponse(RetrievalMode.FILTER_ONLY, candidates.size(), results);
        }

        float[] queryVector = resolveQueryVector(request);
        double minScore = request.minRelevanceScore() == null ? 0.0 : request.minRelevanceScore();
        log.debug("Similarity retrieval over {} candidates, min score {}, limit {}", candidates.size(), minScore, limit);

        List<RetrievalResult> results = candidates.stream()
            .filter(IndexedContent::hasEmbedding)
            .filter(content -> comparable(content, queryVector))
            .map(content -> new Ranked(content, CosineSimilarity.of(queryVector, content.embedding())))
            .filter(ranked -> ranked.similarity() >= minScore)
            .sorted(BY_SIMILARITY)
            .limit(limit)
            .map(ranked -> RetrievalResult.of(ranked.content(), ranked.similarity()))
            .toList();
        return new RetrievalResponse(RetrievalMode.SIMILARITY, candidates.size(), results);
    }

    private int resolveLimit(Integer requested) {
        if (requested == null) {
            return properties.defaultResults();
        }
        if (requested < 1) {
            throw new WrongQueryException("number_of_results must be positive");
        }
        return Math.min(requested, properties.maxResults());
    }

    private float[] resolveQueryVector(RetrievalRequest request) {
        if (request.queryVector() != null && request.queryVector().length > 0) {
            return request.queryVector();
        }
        String query = request.query().trim();
        if (query.length() < MIN_QUERY_LENGTH) {
            throw new WrongQueryException("Query too short");
        }
        return embeddingProvider.embed(query);
    }

    private boolean comparable(IndexedContent content, float[] queryVector) {
        if (content.embedding().length != queryVector.length) {
            log.debug("Skipping {}: vector dimension {} differs from query dimension {}",
                content.id(), content.embedding().length, queryVector.length);
            return false;
        }
        return true;
    }

    private static double composite(IndexedContent content) {
        return content.score() == null ? 0.0 : content.score().compositeScore();
    }
}
