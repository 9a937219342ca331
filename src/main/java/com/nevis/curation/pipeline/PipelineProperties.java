package com.nevis.curation.pipeline;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public record PipelineProperties(
    @DefaultValue("768") @Min(1) @Max(8192) int vectorDimension,
    @DefaultValue("4") @Min(1) @Max(64) int enrichmentConcurrency,
    @DefaultValue("30s") @NotNull Duration enrichmentTimeout,
    @DefaultValue("8000") @Min(100) int maxEmbeddingChars,
    @DefaultValue("true") boolean summarizeClusters,
    @DefaultValue("1000") @Min(1) int maxBatchSize
) {
    public static PipelineProperties defaults() {
        return new PipelineProperties(768, 4, Duration.ofSeconds(30), 8000, true, 1000);
    }
}
