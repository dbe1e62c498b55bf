package org.carball.gantry.model.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.carball.gantry.model.evaluation.EvaluationResult;
import org.carball.gantry.model.record.TransactionRecord;

import java.util.List;

/**
 * Everything a generation run produces. {@code samples} keeps acceptance order;
 * {@code weightedSamples} holds the same records sorted by descending quality weight.
 */
public record GenerationBundle(
        @JsonProperty("samples") List<TransactionRecord> samples,
        @JsonProperty("weighted_samples") List<TransactionRecord> weightedSamples,
        @JsonProperty("quality_tiers") QualityTiers qualityTiers,
        @JsonProperty("evaluation") EvaluationResult evaluation,
        @JsonProperty("statistics") RunStatistics statistics
) {

    public int size() {
        return samples.size();
    }
}
