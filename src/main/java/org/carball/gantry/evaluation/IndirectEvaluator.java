package org.carball.gantry.evaluation;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.condition.Scenario;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.evaluation.IndirectEvaluation;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.reference.FeeCalculator;
import org.carball.gantry.reference.ReferenceTables;
import org.carball.gantry.reference.VehicleClassifier;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility of a generated set: benchmark similarity plus four rule-based proxy tasks run on it.
 */
@Slf4j
public class IndirectEvaluator {

    public static final String ANOMALY_DETECTION = "anomaly_detection";
    public static final String FEE_PREDICTION = "fee_prediction";
    public static final String VEHICLE_CLASSIFICATION = "vehicle_classification";
    public static final String TIME_CONSISTENCY = "time_consistency";

    private final BenchmarkEvaluator benchmark;
    private final VehicleClassifier classifier;
    private final FeeCalculator feeCalculator;
    private final Duration maxTravel;

    public IndirectEvaluator(BenchmarkEvaluator benchmark, VehicleClassifier classifier,
                             FeeCalculator feeCalculator, Duration maxTravel) {
        this.benchmark = benchmark;
        this.classifier = classifier;
        this.feeCalculator = feeCalculator;
        this.maxTravel = maxTravel;
    }

    public IndirectEvaluation evaluate(List<TransactionRecord> records) {
        if (records == null || records.isEmpty()) {
            log.info("Indirect evaluation skipped: no records");
            return IndirectEvaluation.emptyResult();
        }

        Map<String, Double> tasks = new LinkedHashMap<>();
        tasks.put(ANOMALY_DETECTION, anomalyDetection(records));
        tasks.put(FEE_PREDICTION, feePrediction(records));
        tasks.put(VEHICLE_CLASSIFICATION, vehicleClassification(records));
        tasks.put(TIME_CONSISTENCY, timeConsistency(records));

        double overall = tasks.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double similarity = benchmark.score(records).overall();

        log.info("Indirect evaluation: benchmark={}, tasks={}", String.format("%.3f", similarity), tasks);
        return new IndirectEvaluation(similarity, tasks, overall, false);
    }

    /**
     * Precision of the overload detector against scenario labels (overloaded or anomalous).
     */
    double anomalyDetection(List<TransactionRecord> records) {
        int predicted = 0;
        int truePositives = 0;
        int positives = 0;
        for (TransactionRecord record : records) {
            boolean positive = scenarioOf(record).isIrregular();
            boolean flagged = classifier.isOverloaded(record);
            if (positive) {
                positives++;
            }
            if (flagged) {
                predicted++;
                if (positive) {
                    truePositives++;
                }
            }
        }
        if (predicted == 0) {
            return positives == 0 ? 1.0 : 0.0;
        }
        return truePositives / (double) predicted;
    }

    private Scenario scenarioOf(TransactionRecord record) {
        String label = record.getString(GantryFields.SCENARIO);
        if (label != null) {
            try {
                return Scenario.fromWireName(label);
            } catch (IllegalArgumentException e) {
                log.debug("Unknown scenario label '{}', reclassifying", label);
            }
        }
        return classifier.scenario(record);
    }

    double feePrediction(List<TransactionRecord> records) {
        double errorSum = 0;
        int counted = 0;
        for (TransactionRecord record : records) {
            Long vehicleType = record.getLong(GantryFields.VEHICLE_TYPE);
            Long payFee = record.getLong(GantryFields.PAY_FEE);
            Long mileage = record.getLong(GantryFields.FEE_MILEAGE);
            if (vehicleType == null || payFee == null || mileage == null) {
                continue;
            }
            long expected = feeCalculator.expectedFee(vehicleType, mileage);
            errorSum += Math.abs(payFee - expected) / (double) Math.max(expected, 1);
            counted++;
        }
        if (counted == 0) {
            return 0.0;
        }
        return Math.max(0.0, 1.0 - errorSum / counted);
    }

    double vehicleClassification(List<TransactionRecord> records) {
        int agreeing = 0;
        for (TransactionRecord record : records) {
            if (agreesWithVehicleType(record)) {
                agreeing++;
            }
        }
        return agreeing / (double) records.size();
    }

    private boolean agreesWithVehicleType(TransactionRecord record) {
        Long vehicleType = record.getLong(GantryFields.VEHICLE_TYPE);
        Long axles = record.getLong(GantryFields.AXLE_COUNT);
        Long weight = record.getLong(GantryFields.TOTAL_WEIGHT);
        VehicleCategory category = classifier.category(record);
        if (vehicleType == null || axles == null || weight == null || category == null) {
            return false;
        }
        Integer expected = classifier.expectedAxles(vehicleType);
        if (expected != null && expected.longValue() != axles) {
            return false;
        }
        if (category == VehicleCategory.PASSENGER) {
            ReferenceTables.WeightRange range = classifier.passengerWeight();
            return weight >= range.getMin() && weight <= range.getMax();
        }
        return weight <= classifier.axleLimit(axles) * 1.5;
    }

    double timeConsistency(List<TransactionRecord> records) {
        int consistent = 0;
        for (TransactionRecord record : records) {
            LocalDateTime transaction = record.getTime(GantryFields.TRANSACTION_TIME);
            LocalDateTime entrance = record.getTime(GantryFields.ENTRANCE_TIME);
            if (transaction != null && entrance != null && entrance.isBefore(transaction)
                    && Duration.between(entrance, transaction).compareTo(maxTravel) <= 0) {
                consistent++;
            }
        }
        return consistent / (double) records.size();
    }
}
