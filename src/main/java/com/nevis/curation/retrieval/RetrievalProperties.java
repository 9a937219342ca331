package com.nevis.curation.retrieval;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.retrieval")
public record RetrievalProperties(
    @DefaultValue("20") @Min(1) @Max(1000) int defaultResults,
    @DefaultValue("200") @Min(1) @Max(10000) int maxResults,
    @DefaultValue("0.7") @DecimalMin("0.0") @DecimalMax("1.0") double highQualityThreshold
) {
    public static RetrievalProperties defaults() {
        return new RetrievalProperties(20, 200, 0.7);
    }
}
