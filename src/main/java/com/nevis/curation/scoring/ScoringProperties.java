package com.nevis.curation.scoring;

import com.nevis.curation.model.ScoringWeights;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app.scoring")
public record ScoringProperties(
    ScoringWeights weights,
    @DefaultValue("0.65") @DecimalMin("0.0") @DecimalMax("1.0") double includeThreshold,
    @DefaultValue("0.55") @DecimalMin("0.0") @DecimalMax("1.0") double reviewThreshold,
    @DefaultValue("false") boolean requireTopicalEvidence,
    @DefaultValue("0.0") @DecimalMin("0.0") @DecimalMax("1.0") double minActionability,
    List<String> trendTerms,
    @DefaultValue("true") boolean extractSignals,
    List<TopicDefinition> topics
) {
    public ScoringProperties {
        weights = weights == null ? ScoringWeights.DEFAULT : weights;
        trendTerms = trendTerms == null ? List.of() : List.copyOf(trendTerms);
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    public static ScoringProperties defaults() {
        return new ScoringProperties(ScoringWeights.DEFAULT, 0.65, 0.55, false, 0.0,
            List.of("emerging", "growing", "rising", "accelerating", "surge", "breakthrough", "launch", "trend"),
            true, List.of());
    }

    public ScoringPolicy defaultPolicy() {
        return new ScoringPolicy(weights, includeThreshold, reviewThreshold, requireTopicalEvidence, minActionability);
    }
}
