package org.carball.gantry.model.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Similarity of a generated set to the benchmark pool. A component that cannot be computed,
 * e.g. correlation without a vehicle category common to both sets, is null and left out of
 * {@code overall}.
 */
public record BenchmarkScore(
        @JsonProperty("distribution_similarity") Double distributionSimilarity,
        @JsonProperty("statistical_similarity") Double statisticalSimilarity,
        @JsonProperty("hourly_pattern_similarity") Double hourlyPatternSimilarity,
        @JsonProperty("correlation_similarity") Double correlationSimilarity,
        @JsonProperty("overall") double overall
) {

    public static BenchmarkScore unavailable() {
        return new BenchmarkScore(null, null, null, null, 0.0);
    }
}
