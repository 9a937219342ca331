package com.nevis.curation.scoring;

import com.nevis.curation.model.ContentItem;
import com.nevis.curation.model.RelevanceDecision;
import com.nevis.curation.model.RelevanceScore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Scores content on four independent dimensions and turns the weighted composite into a relevance decision.
 * <p>
 * Each sub-score is computed on its own; a sub-score that cannot be computed falls back to its default and is
 * reported as degraded, so one broken item never aborts the batch. Only a broken policy (weights or thresholds)
 * aborts, and it does so before any item is scored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScoringEngine {

    public static final String TOPICAL = "topical_alignment";
    public static final String STRATEGIC = "strategic_priority";
    public static final String QUALITY = "content_quality";
    public static final String TEMPORAL = "temporal_relevance";

    static final double[] TOPICAL_SLOT_WEIGHTS = {0.5, 0.3, 0.2};
    static final double DEFAULT_QUALITY = 0.5;
    static final double DEFAULT_TEMPORAL = 0.5;
    static final double MAX_TREND_BONUS = 0.3;
    static final double TREND_BONUS_PER_TERM = 0.1;

    private final ScoringProperties properties;
    private final Clock clock;

    private record SubScore(double value, boolean defaulted) {
        static SubScore of(double value) {
            return new SubScore(clampUnit(value), false);
        }

        static SubScore fallback(double value) {
            return new SubScore(value, true);
        }
    }

    public ScoringResult scoreBatch(List<ScoringRequest> requests, ScoringPolicy policy) {
        return scoreBatch(requests, policy, Runnable::run);
    }

    /**
     * Scores every request. Items may be scored concurrently on the given executor; results keep request order.
     *
     * @throws com.nevis.curation.exception.InvalidWeightsException when the policy weights are unusable
     */
    public ScoringResult scoreBatch(List<ScoringRequest> requests, ScoringPolicy policy, Executor executor) {
        policy.validate();

        List<CompletableFuture<ScoredItem>> futures = requests.stream()
            .map(request -> CompletableFuture.supplyAsync(() -> score(request, policy), executor))
            .toList();
        List<ScoredItem> scored = futures.stream().map(CompletableFuture::join).toList();

        ScoringResult result = new ScoringResult(scored);
        log.info("Scored {} items: {} ({} degraded sub-scores)",
            scored.size(), result.decisionCounts(), result.degradedDefaults());
        return result;
    }

    /**
     * Scores one item against an already validated policy.
     */
    public ScoredItem score(ScoringRequest request, ScoringPolicy policy) {
        ContentItem item = request.item();
        ScoringSignals signals = request.signals();
        List<String> defaulted = new ArrayList<>();

        double topical = resolve(TOPICAL, item, () -> topical(signals), 0.0, defaulted);
        double strategic = resolve(STRATEGIC, item, () -> strategic(signals), 0.0, defaulted);
        double quality = resolve(QUALITY, item, () -> quality(signals.quality()), DEFAULT_QUALITY, defaulted);
        double temporal = resolve(TEMPORAL, item, () -> temporal(item), DEFAULT_TEMPORAL, defaulted);

        RelevanceScore score = new RelevanceScore(topical, strategic, quality, temporal, policy.weights());
        RelevanceDecision decision = decide(score.compositeScore(), signals, policy);

        log.debug("Item {} scored {} -> {}", item.id(), score.compositeScore(), decision);
        return new ScoredItem(item.id(), score, decision, defaulted);
    }

    public RelevanceDecision decide(double composite, ScoringSignals signals, ScoringPolicy policy) {
        RelevanceDecision decision;
        if (composite >= policy.includeThreshold()) {
            decision = RelevanceDecision.INCLUDE;
        } else if (composite >= policy.reviewThreshold()) {
            decision = RelevanceDecision.MANUAL_REVIEW;
        } else {
            decision = RelevanceDecision.EXCLUDE;
        }

        if (policy.requireTopicalEvidence() && signals.alignments().isEmpty()) {
            decision = decision.atMost(RelevanceDecision.EXCLUDE);
        }
        double actionability = signals.actionability() == null ? 0.0 : signals.actionability();
        if (policy.minActionability() > 0 && actionability < policy.minActionability()) {
            decision = decision.atMost(RelevanceDecision.MANUAL_REVIEW);
        }
        return decision;
    }

    private double resolve(String name, ContentItem item, Supplier<SubScore> computation, double fallback,
                           List<String> defaulted) {
        SubScore component;
        try {
            component = computation.get();
        } catch (RuntimeException e) {
            log.warn("Could not compute {} for item {}, using default {}: {}", name, item.id(), fallback, e.getMessage());
            component = SubScore.fallback(fallback);
        }
        if (component.defaulted()) {
            defaulted.add(name);
        }
        return component.value();
    }

    private SubScore topical(ScoringSignals signals) {
        List<Double> top = signals.alignments().stream()
            .filter(Objects::nonNull)
            .map(AlignmentAssessment::alignment)
            .filter(value -> !Double.isNaN(value))
            .map(ScoringEngine::clampUnit)
            .sorted(Comparator.reverseOrder())
            .limit(TOPICAL_SLOT_WEIGHTS.length)
            .toList();
        if (top.isEmpty()) {
            return SubScore.fallback(0.0);
        }

        double weighted = 0.0;
        double weightSum = 0.0;
        for (int slot = 0; slot < top.size(); slot++) {
            weighted += TOPICAL_SLOT_WEIGHTS[slot] * top.get(slot);
            weightSum += TOPICAL_SLOT_WEIGHTS[slot];
        }
        return SubScore.of(weighted / weightSum);
    }

    private SubScore strategic(ScoringSignals signals) {
        double maxConfidence = signals.classifications().stream()
            .filter(Objects::nonNull)
            .mapToDouble(TopicClassification::confidence)
            .filter(value -> !Double.isNaN(value))
            .map(ScoringEngine::clampUnit)
            .max()
            .orElse(-1);
        if (maxConfidence < 0) {
            return SubScore.fallback(0.0);
        }

        double multiplier = 1.0
            + 0.3 * unitOrZero(signals.actionability())
            + 0.2 * unitOrZero(signals.risk())
            + 0.2 * unitOrZero(signals.stakeholderRelevance());
        return SubScore.of(maxConfidence * multiplier);
    }

    private SubScore quality(QualityMetrics metrics) {
        if (metrics == null) {
            return SubScore.fallback(DEFAULT_QUALITY);
        }
        return SubScore.of(
            0.25 * clampUnit(metrics.factualDensity())
                + 0.25 * clampUnit(metrics.sourceAuthority())
                + 0.20 * clampUnit(metrics.clarity())
                + 0.20 * clampUnit(metrics.completeness())
                + 0.10 * clampUnit(metrics.verificationLevel()));
    }

    private SubScore temporal(ContentItem item) {
        if (item.publishedAt() == null) {
            return SubScore.fallback(DEFAULT_TEMPORAL);
        }
        double recency = recency(Duration.between(item.publishedAt(), Instant.now(clock)));
        return SubScore.of(0.8 * recency + 0.2 * trendBonus(item));
    }

    /**
     * Step curve over content age. Timestamps in the future count as brand new.
     */
    static double recency(Duration age) {
        long hours = Math.max(0, age.toHours());
        if (hours <= 24) {
            return 1.0;
        } else if (hours <= 7 * 24) {
            return 0.9;
        } else if (hours <= 30 * 24) {
            return 0.7;
        } else if (hours <= 90 * 24) {
            return 0.5;
        } else if (hours <= 180 * 24) {
            return 0.3;
        }
        return 0.1;
    }

    double trendBonus(ContentItem item) {
        String text = String.join(" ",
                Objects.toString(item.title(), ""),
                Objects.toString(item.summary(), ""),
                Objects.toString(item.body(), ""))
            .toLowerCase(Locale.ROOT);
        long present = properties.trendTerms().stream()
            .map(term -> term.toLowerCase(Locale.ROOT).trim())
            .filter(term -> !term.isEmpty())
            .distinct()
            .filter(text::contains)
            .count();
        return Math.min(MAX_TREND_BONUS, TREND_BONUS_PER_TERM * present);
    }

    private static double unitOrZero(Double value) {
        return value == null || value.isNaN() ? 0.0 : clampUnit(value);
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
