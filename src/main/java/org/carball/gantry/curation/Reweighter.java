package org.carball.gantry.curation;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.model.stats.FieldStatistics;
import org.carball.gantry.model.stats.LearnedStatistics;
import org.carball.gantry.reference.VehicleClassifier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Quality weights from filter score and closeness to the learned category statistics.
 *
 * <p>weight = 2 x quality_score x similarity, where similarity is the mean over pay_fee,
 * fee_mileage and total_weight of 1 / (1 + z). A record that exactly matches the category means
 * with a perfect score weighs 2.0.
 */
@Slf4j
public class Reweighter {

    static final double UNKNOWN_SIMILARITY = 0.5;
    static final double DEFAULT_QUALITY = 1.0;

    private final VehicleClassifier classifier;

    public Reweighter(VehicleClassifier classifier) {
        this.classifier = classifier;
    }

    public List<Double> weight(List<TransactionRecord> records, LearnedStatistics statistics) {
        List<Double> weights = new ArrayList<>(records.size());
        for (TransactionRecord record : records) {
            Double score = record.getMetadata().getQualityScore();
            double quality = score == null ? DEFAULT_QUALITY : Math.max(0.0, score);
            weights.add(2.0 * quality * similarity(record, statistics));
        }
        return weights;
    }

    double similarity(TransactionRecord record, LearnedStatistics statistics) {
        VehicleCategory category = classifier.category(record);
        if (statistics == null || !statistics.hasCategory(category)) {
            return UNKNOWN_SIMILARITY;
        }
        double total = 0;
        int counted = 0;
        for (String field : GantryFields.WEIGHTED_FIELDS) {
            FieldStatistics stats = statistics.get(category, field);
            Long value = record.getLong(field);
            if (stats == null || value == null) {
                continue;
            }
            total += closeness(value, stats);
            counted++;
        }
        return counted == 0 ? UNKNOWN_SIMILARITY : total / counted;
    }

    private static double closeness(double value, FieldStatistics stats) {
        double distance = Math.abs(value - stats.mean());
        if (stats.std() == 0) {
            return distance == 0 ? 1.0 : 0.0;
        }
        return 1.0 / (1.0 + distance / stats.std());
    }

    /**
     * Stores each weight in its record's metadata and returns the records by descending weight,
     * keeping generation order among equal weights.
     */
    public List<TransactionRecord> rank(List<TransactionRecord> records, List<Double> weights) {
        if (records.size() != weights.size()) {
            throw new IllegalArgumentException("Expected one weight per record");
        }
        for (int i = 0; i < records.size(); i++) {
            records.get(i).getMetadata().setQualityWeight(weights.get(i));
        }
        List<TransactionRecord> ranked = new ArrayList<>(records);
        ranked.sort(Comparator.comparingDouble((TransactionRecord r) -> r.getMetadata().getQualityWeight()).reversed());
        return ranked;
    }

    public Map<QualityTier, List<TransactionRecord>> tiers(List<TransactionRecord> ranked) {
        Map<QualityTier, List<TransactionRecord>> tiers = new EnumMap<>(QualityTier.class);
        for (QualityTier tier : QualityTier.values()) {
            tiers.put(tier, new ArrayList<>());
        }
        for (TransactionRecord record : ranked) {
            Double weight = record.getMetadata().getQualityWeight();
            tiers.get(QualityTier.fromWeight(weight == null ? 0.0 : weight)).add(record);
        }
        log.info("Quality tiers: high={}, medium={}, low={}", tiers.get(QualityTier.HIGH).size(),
                tiers.get(QualityTier.MEDIUM).size(), tiers.get(QualityTier.LOW).size());
        return tiers;
    }
}
