package org.carball.gantry.model.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.carball.gantry.curation.QualityTier;
import org.carball.gantry.model.record.TransactionRecord;

import java.util.List;
import java.util.Map;

public record QualityTiers(
        @JsonProperty("high") List<TransactionRecord> high,
        @JsonProperty("medium") List<TransactionRecord> medium,
        @JsonProperty("low") List<TransactionRecord> low
) {

    public static QualityTiers from(Map<QualityTier, List<TransactionRecord>> tiers) {
        return new QualityTiers(
                List.copyOf(tiers.getOrDefault(QualityTier.HIGH, List.of())),
                List.copyOf(tiers.getOrDefault(QualityTier.MEDIUM, List.of())),
                List.copyOf(tiers.getOrDefault(QualityTier.LOW, List.of())));
    }

    public static QualityTiers empty() {
        return new QualityTiers(List.of(), List.of(), List.of());
    }

    public int size() {
        return high.size() + medium.size() + low.size();
    }
}
