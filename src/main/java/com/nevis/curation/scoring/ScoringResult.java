package com.nevis.curation.scoring;

import com.nevis.curation.model.DecisionCounts;

import java.util.List;

public record ScoringResult(List<ScoredItem> items) {

    public ScoringResult {
        items = List.copyOf(items);
    }

    public DecisionCounts decisionCounts() {
        return DecisionCounts.of(items.stream().map(ScoredItem::decision).toList());
    }

    public int degradedDefaults() {
        return items.stream().mapToInt(item -> item.defaulted().size()).sum();
    }
}
