package org.carball.gantry.evaluation;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.curation.FilterResult;
import org.carball.gantry.curation.SampleFilter;
import org.carball.gantry.generation.SectionDateMapper;
import org.carball.gantry.model.condition.Scenario;
import org.carball.gantry.model.condition.TimePeriod;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.evaluation.BenchmarkScore;
import org.carball.gantry.model.evaluation.DirectEvaluation;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.FieldGroupSchema;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.model.stats.TargetDistribution;
import org.carball.gantry.reference.VehicleClassifier;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Faithfulness and diversity of a generated set.
 *
 * <p>Faithfulness averages the constraint pass rate, recomputed here rather than read from cached
 * filter scores, with the benchmark similarity. Diversity averages the unique-value ratio,
 * pairwise dissimilarity of sampled pairs and coverage of the target distribution's support.
 */
@Slf4j
public class DirectEvaluator {

    private final FieldGroupSchema schema;
    private final SampleFilter filter;
    private final SectionDateMapper dateMapper;
    private final BenchmarkEvaluator benchmark;
    private final VehicleClassifier classifier;
    private final TargetDistribution target;
    private final double faithfulnessWeight;
    private final int maxPairs;
    private final long seed;

    public DirectEvaluator(FieldGroupSchema schema, SampleFilter filter, SectionDateMapper dateMapper,
                           BenchmarkEvaluator benchmark, VehicleClassifier classifier, TargetDistribution target,
                           double faithfulnessWeight, int maxPairs, long seed) {
        this.schema = schema;
        this.filter = filter;
        this.dateMapper = dateMapper;
        this.benchmark = benchmark;
        this.classifier = classifier;
        this.target = target;
        this.faithfulnessWeight = faithfulnessWeight;
        this.maxPairs = maxPairs;
        this.seed = seed;
    }

    public DirectEvaluation evaluate(List<TransactionRecord> records) {
        if (records == null || records.isEmpty()) {
            log.info("Direct evaluation skipped: no records");
            return DirectEvaluation.emptyResult();
        }

        double passRate = passRate(records);
        BenchmarkScore benchmarkScore = benchmark.score(records);
        double faithfulness = benchmark.isAvailable()
                ? (passRate + benchmarkScore.overall()) / 2
                : passRate;

        double uniqueness = uniqueValueRatio(records);
        double dissimilarity = pairwiseDissimilarity(records);
        double coverage = coverage(records);
        double diversity = (uniqueness + dissimilarity + coverage) / 3;

        double overall = faithfulnessWeight * faithfulness + (1 - faithfulnessWeight) * diversity;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("constraint_pass_rate", passRate);
        details.put("benchmark", benchmarkScore);
        details.put("unique_value_ratio", uniqueness);
        details.put("pairwise_dissimilarity", dissimilarity);
        details.put("target_coverage", coverage);
        details.put("record_count", records.size());

        log.info("Direct evaluation: faithfulness={}, diversity={}, overall={}",
                String.format("%.3f", faithfulness), String.format("%.3f", diversity), String.format("%.3f", overall));
        return new DirectEvaluation(DistributionMath.clamp01(faithfulness), DistributionMath.clamp01(diversity),
                DistributionMath.clamp01(overall), details, false);
    }

    double passRate(List<TransactionRecord> records) {
        int passed = 0;
        for (TransactionRecord record : records) {
            FilterResult result = filter.evaluate(record);
            if (result.passes(filter.getThreshold()) && isSectionDatePlausible(record)) {
                passed++;
            }
        }
        return passed / (double) records.size();
    }

    private boolean isSectionDatePlausible(TransactionRecord record) {
        LocalDateTime time = record.getTime(GantryFields.TRANSACTION_TIME);
        return dateMapper.isPlausible(record.getString(GantryFields.SECTION_ID), time == null ? null : time.toLocalDate());
    }

    double uniqueValueRatio(List<TransactionRecord> records) {
        List<String> fields = schema.getAllFields();
        double total = 0;
        for (String field : fields) {
            Set<Object> distinct = new HashSet<>();
            for (TransactionRecord record : records) {
                distinct.add(record.get(field));
            }
            total += distinct.size() / (double) records.size();
        }
        return total / fields.size();
    }

    double pairwiseDissimilarity(List<TransactionRecord> records) {
        int n = records.size();
        if (n < 2) {
            return 0.0;
        }
        List<String> fields = schema.getAllFields();
        long allPairs = (long) n * (n - 1) / 2;
        double total = 0;
        int pairs = 0;
        if (allPairs <= maxPairs) {
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    total += dissimilarity(records.get(i), records.get(j), fields);
                    pairs++;
                }
            }
        } else {
            Random random = new Random(seed);
            while (pairs < maxPairs) {
                int i = random.nextInt(n);
                int j = random.nextInt(n);
                if (i == j) {
                    continue;
                }
                total += dissimilarity(records.get(i), records.get(j), fields);
                pairs++;
            }
        }
        return total / pairs;
    }

    private static double dissimilarity(TransactionRecord a, TransactionRecord b, List<String> fields) {
        int differing = 0;
        for (String field : fields) {
            if (!Objects.equals(a.get(field), b.get(field))) {
                differing++;
            }
        }
        return differing / (double) fields.size();
    }

    double coverage(List<TransactionRecord> records) {
        Set<VehicleCategory> vehicles = new HashSet<>();
        Set<TimePeriod> periods = new HashSet<>();
        Set<Scenario> scenarios = new HashSet<>();
        for (TransactionRecord record : records) {
            VehicleCategory category = classifier.category(record);
            if (category != null) {
                vehicles.add(category);
            }
            TimePeriod period = classifier.timePeriod(record);
            if (period != null) {
                periods.add(period);
            }
            scenarios.add(classifier.scenario(record));
        }
        int support = target.supportSize();
        if (support == 0) {
            return 0.0;
        }
        long covered = vehicles.stream().filter(v -> target.getVehicle().get(v) > 0).count()
                + periods.stream().filter(p -> target.getTime().get(p) > 0).count()
                + scenarios.stream().filter(s -> target.getScenario().get(s) > 0).count();
        return covered / (double) support;
    }
}
