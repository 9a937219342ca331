package com.nevis.curation.scoring;

import com.nevis.curation.model.RelevanceDecision;
import com.nevis.curation.model.RelevanceScore;

import java.util.List;

/**
 * Score and decision for one item. {@code defaulted} names the sub-scores that fell back to their default.
 */
public record ScoredItem(String itemId, RelevanceScore score, RelevanceDecision decision, List<String> defaulted) {

    public ScoredItem {
        defaulted = defaulted == null ? List.of() : List.copyOf(defaulted);
    }

    public double compositeScore() {
        return score.compositeScore();
    }
}
