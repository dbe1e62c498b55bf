package org.carball.gantry.evaluation;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.evaluation.BenchmarkScore;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.model.stats.FieldStatistics;
import org.carball.gantry.reference.StatisticsLearner;
import org.carball.gantry.reference.VehicleClassifier;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compares a generated set against the benchmark pool: categorical distributions, numeric
 * moments, hour-of-day pattern and per-category fee/mileage correlation. Reference-side figures
 * are computed once.
 */
@Slf4j
public class BenchmarkEvaluator {

    static final List<String> CATEGORICAL_FIELDS = List.of(
            GantryFields.VEHICLE_TYPE, GantryFields.SECTION_ID, GantryFields.MEDIA_TYPE, GantryFields.VEHICLE_CATEGORY);

    private final VehicleClassifier classifier;
    private final boolean available;
    private final Map<String, Map<String, Integer>> referenceCounts = new LinkedHashMap<>();
    private final Map<String, FieldStatistics> referenceMoments = new LinkedHashMap<>();
    private final int[] referenceHours;
    private final Map<VehicleCategory, Double> referenceCorrelations;

    public BenchmarkEvaluator(List<TransactionRecord> benchmarkPool, VehicleClassifier classifier) {
        this.classifier = classifier;
        List<TransactionRecord> pool = benchmarkPool == null ? List.of() : benchmarkPool;
        this.available = !pool.isEmpty();
        for (String field : CATEGORICAL_FIELDS) {
            referenceCounts.put(field, counts(pool, field));
        }
        for (String field : GantryFields.NUMERIC_STATISTIC_FIELDS) {
            referenceMoments.put(field, FieldStatistics.of(values(pool, field)));
        }
        this.referenceHours = hours(pool);
        this.referenceCorrelations = correlations(pool);
        log.debug("Benchmark evaluator prepared from {} records", pool.size());
    }

    public boolean isAvailable() {
        return available;
    }

    public BenchmarkScore score(List<TransactionRecord> generated) {
        if (!available || generated.isEmpty()) {
            return BenchmarkScore.unavailable();
        }
        Double distribution = distributionSimilarity(generated);
        Double statistical = statisticalSimilarity(generated);
        Double hourly = 1.0 - DistributionMath.totalVariation(hours(generated), referenceHours);
        Double correlation = correlationSimilarity(generated);

        List<Double> parts = new ArrayList<>();
        for (Double part : new Double[]{distribution, statistical, hourly, correlation}) {
            if (part != null) {
                parts.add(part);
            }
        }
        double overall = parts.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return new BenchmarkScore(distribution, statistical, hourly, correlation, DistributionMath.clamp01(overall));
    }

    private Double distributionSimilarity(List<TransactionRecord> generated) {
        double total = 0;
        int fields = 0;
        for (String field : CATEGORICAL_FIELDS) {
            Map<String, Integer> reference = referenceCounts.get(field);
            Map<String, Integer> produced = counts(generated, field);
            if (reference.isEmpty() && produced.isEmpty()) {
                continue;
            }
            total += DistributionMath.similarity(produced, reference);
            fields++;
        }
        return fields == 0 ? null : total / fields;
    }

    private Double statisticalSimilarity(List<TransactionRecord> generated) {
        double total = 0;
        int fields = 0;
        for (String field : GantryFields.NUMERIC_STATISTIC_FIELDS) {
            FieldStatistics reference = referenceMoments.get(field);
            List<Long> values = values(generated, field);
            if (reference.count() == 0 || values.isEmpty()) {
                continue;
            }
            FieldStatistics produced = FieldStatistics.of(values);
            double meanTerm = momentTerm(produced.mean() - reference.mean(), reference.std());
            double stdTerm = momentTerm(produced.std() - reference.std(), reference.std());
            total += (meanTerm + stdTerm) / 2;
            fields++;
        }
        return fields == 0 ? null : total / fields;
    }

    private static double momentTerm(double delta, double referenceStd) {
        if (referenceStd == 0) {
            return delta == 0 ? 1.0 : 0.0;
        }
        return Math.max(0.0, 1.0 - Math.abs(delta) / referenceStd);
    }

    private Double correlationSimilarity(List<TransactionRecord> generated) {
        Map<VehicleCategory, Double> produced = correlations(generated);
        double total = 0;
        int categories = 0;
        for (Map.Entry<VehicleCategory, Double> entry : produced.entrySet()) {
            Double reference = referenceCorrelations.get(entry.getKey());
            if (reference == null) {
                continue;
            }
            total += Math.max(0.0, 1.0 - Math.abs(entry.getValue() - reference));
            categories++;
        }
        return categories == 0 ? null : total / categories;
    }

    private Map<String, Integer> counts(List<TransactionRecord> records, String field) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (TransactionRecord record : records) {
            String value = categoricalValue(record, field);
            if (value != null) {
                counts.merge(value, 1, Integer::sum);
            }
        }
        return counts;
    }

    private String categoricalValue(TransactionRecord record, String field) {
        if (GantryFields.VEHICLE_CATEGORY.equals(field) && !record.has(field)) {
            VehicleCategory category = classifier.category(record);
            return category == null ? null : category.getWireName();
        }
        Object value = record.get(field);
        return value == null ? null : String.valueOf(value);
    }

    private Map<VehicleCategory, Double> correlations(List<TransactionRecord> records) {
        Map<VehicleCategory, List<TransactionRecord>> byCategory = new EnumMap<>(VehicleCategory.class);
        for (TransactionRecord record : records) {
            VehicleCategory category = classifier.category(record);
            if (category != null) {
                byCategory.computeIfAbsent(category, c -> new ArrayList<>()).add(record);
            }
        }
        Map<VehicleCategory, Double> correlations = new EnumMap<>(VehicleCategory.class);
        byCategory.forEach((category, members) -> {
            if (members.size() >= 2) {
                correlations.put(category, StatisticsLearner.feeMileageCorrelation(members));
            }
        });
        return correlations;
    }

    static int[] hours(List<TransactionRecord> records) {
        int[] histogram = new int[24];
        records.stream()
                .map(r -> r.getTime(GantryFields.TRANSACTION_TIME))
                .filter(Objects::nonNull)
                .mapToInt(LocalDateTime::getHour)
                .forEach(hour -> histogram[hour]++);
        return histogram;
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
}
