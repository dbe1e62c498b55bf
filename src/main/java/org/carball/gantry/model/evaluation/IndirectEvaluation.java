package org.carball.gantry.model.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record IndirectEvaluation(
        @JsonProperty("benchmark_similarity") double benchmarkSimilarity,
        @JsonProperty("open_evaluation") Map<String, Double> openEvaluation,
        @JsonProperty("overall") double overall,
        @JsonProperty("empty") boolean empty
) {

    public static IndirectEvaluation emptyResult() {
        return new IndirectEvaluation(0.0, Map.of(), 0.0, true);
    }
}
