package com.nevis.curation.cluster;

import com.nevis.curation.model.SimilarityTier;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.clustering")
public record ClusteringProperties(
    @DefaultValue("0.85") @DecimalMin("0.0") @DecimalMax("1.0") double sameStoryThreshold,
    @DefaultValue("0.95") @DecimalMin("0.0") @DecimalMax("1.0") double exactDuplicateThreshold,
    @DefaultValue("0.70") @DecimalMin("0.0") @DecimalMax("1.0") double relatedContentThreshold,
    @DefaultValue("0.9") @DecimalMin("0.0") @DecimalMax("1.0") double mergeThreshold,
    @DefaultValue("10") @Min(2) int maxClusterSize,
    @DefaultValue("0.9") @DecimalMin("0.0") @DecimalMax("1.0") double splitConfidenceDiscount
) {
    public static final int MIN_CLUSTER_SIZE = 2;

    public static ClusteringProperties defaults() {
        return new ClusteringProperties(0.85, 0.95, 0.70, 0.9, 10, 0.9);
    }

    public SimilarityTier classify(double similarity) {
        if (similarity >= exactDuplicateThreshold) {
            return SimilarityTier.EXACT_DUPLICATE;
        }
        if (similarity >= sameStoryThreshold) {
            return SimilarityTier.SAME_STORY;
        }
        if (similarity >= relatedContentThreshold) {
            return SimilarityTier.RELATED_CONTENT;
        }
        return SimilarityTier.UNIQUE_CONTENT;
    }
}
