package org.carball.gantry.reference;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.model.stats.FieldStatistics;
import org.carball.gantry.model.stats.LearnedStatistics;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Learns per-category numeric summaries from a reference pool.
 */
@Slf4j
public class StatisticsLearner {

    private final VehicleClassifier classifier;

    public StatisticsLearner(VehicleClassifier classifier) {
        this.classifier = classifier;
    }

    public LearnedStatistics learn(List<TransactionRecord> pool) {
        Map<VehicleCategory, List<TransactionRecord>> byCategory = new EnumMap<>(VehicleCategory.class);
        for (TransactionRecord record : pool) {
            VehicleCategory category = classifier.category(record);
            if (category != null) {
                byCategory.computeIfAbsent(category, c -> new ArrayList<>()).add(record);
            }
        }

        Map<VehicleCategory, Map<String, FieldStatistics>> stats = new EnumMap<>(VehicleCategory.class);
        Map<VehicleCategory, Double> correlations = new EnumMap<>(VehicleCategory.class);
        byCategory.forEach((category, records) -> {
            Map<String, FieldStatistics> fields = new LinkedHashMap<>();
            for (String field : GantryFields.NUMERIC_STATISTIC_FIELDS) {
                List<Long> values = values(records, field);
                if (!values.isEmpty()) {
                    fields.put(field, FieldStatistics.of(values));
                }
            }
            stats.put(category, fields);
            correlations.put(category, feeMileageCorrelation(records));
            log.debug("Learned {} statistics from {} records: {}", category.getWireName(), records.size(), fields.keySet());
        });

        log.info("Learned statistics for {} vehicle categories from {} reference records", stats.size(), pool.size());
        return new LearnedStatistics(stats, correlations);
    }

    static List<Long> values(List<TransactionRecord> records, String field) {
        List<Long> values = new ArrayList<>();
        for (TransactionRecord record : records) {
            Long value = record.getLong(field);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    /**
     * Pearson correlation of pay_fee against fee_mileage over records carrying both.
     */
    public static double feeMileageCorrelation(List<TransactionRecord> records) {
        List<double[]> pairs = new ArrayList<>();
        for (TransactionRecord record : records) {
            Long fee = record.getLong(GantryFields.PAY_FEE);
            Long mileage = record.getLong(GantryFields.FEE_MILEAGE);
            if (fee != null && mileage != null) {
                pairs.add(new double[]{mileage, fee});
            }
        }
        return pearson(pairs);
    }

    public static double pearson(List<double[]> pairs) {
        int n = pairs.size();
        if (n < 2) {
            return 0.0;
        }
        double meanX = 0;
        double meanY = 0;
        for (double[] pair : pairs) {
            meanX += pair[0];
            meanY += pair[1];
        }
        meanX /= n;
        meanY /= n;
        double covariance = 0;
        double varX = 0;
        double varY = 0;
        for (double[] pair : pairs) {
            double dx = pair[0] - meanX;
            double dy = pair[1] - meanY;
            covariance += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0 || varY == 0) {
            return 0.0;
        }
        return covariance / Math.sqrt(varX * varY);
    }
}
