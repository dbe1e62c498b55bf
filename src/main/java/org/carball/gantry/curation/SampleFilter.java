package org.carball.gantry.curation;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.FieldGroupSchema;
import org.carball.gantry.model.schema.FieldSpec;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.model.stats.FieldStatistics;
import org.carball.gantry.model.stats.LearnedStatistics;
import org.carball.gantry.reference.FeeCalculator;
import org.carball.gantry.reference.VehicleClassifier;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores records with five independent checks and partitions them at a fixed threshold.
 * Sub-scores are averaged, so one minor infraction lowers a record's score without rejecting it.
 */
@Slf4j
public class SampleFilter {

    public static final String COMPLETENESS = "completeness";
    public static final String FORMAT = "format";
    public static final String TEMPORAL = "temporal";
    public static final String FEE = "fee";
    public static final String AXLE_WEIGHT = "axle_weight";

    static final double TIME_ORDER_PENALTY = 0.3;
    static final double TOO_LONG_PENALTY = 0.8;
    static final double UNPARSEABLE_TIME_PENALTY = 0.5;
    static final double DISCOUNT_EXCEEDS_PAY_PENALTY = 0.4;
    static final double FEE_RATE_PENALTY = 0.7;
    static final double MISSING_FEE_PENALTY = 0.5;
    static final double PASSENGER_AXLE_PENALTY = 0.6;
    static final double GROSS_OVERWEIGHT_PENALTY = 0.3;
    static final double AXLE_MISMATCH_PENALTY = 0.8;
    static final double UNKNOWN_VEHICLE_PENALTY = 0.5;

    static final double MIN_RATE_BAND = 0.3;
    static final double MAX_RATE_BAND = 1.0;
    static final double TARIFF_BAND = 0.3;
    static final double GROSS_OVERWEIGHT_FACTOR = 1.5;

    private final FieldGroupSchema schema;
    private final VehicleClassifier classifier;
    private final FeeCalculator feeCalculator;
    private final LearnedStatistics statistics;
    private final double threshold;
    private final Duration maxTravel;

    public SampleFilter(FieldGroupSchema schema, VehicleClassifier classifier, FeeCalculator feeCalculator,
                        LearnedStatistics statistics, double threshold, Duration maxTravel) {
        this.schema = schema;
        this.classifier = classifier;
        this.feeCalculator = feeCalculator;
        this.statistics = statistics == null ? LearnedStatistics.empty() : statistics;
        this.threshold = threshold;
        this.maxTravel = maxTravel;
    }

    public FilterResult evaluate(TransactionRecord record) {
        List<String> issues = new ArrayList<>();
        Map<String, Double> subScores = new LinkedHashMap<>();
        subScores.put(COMPLETENESS, completeness(record, issues));
        subScores.put(FORMAT, format(record, issues));
        subScores.put(TEMPORAL, temporal(record, issues));
        subScores.put(FEE, fee(record, issues));
        subScores.put(AXLE_WEIGHT, axleWeight(record, issues));

        double score = subScores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return new FilterResult(score, subScores, issues);
    }

    /**
     * Scores each record, stores score and issues in its metadata and partitions by the threshold.
     */
    public FilterOutcome filter(List<TransactionRecord> records) {
        List<TransactionRecord> accepted = new ArrayList<>();
        List<TransactionRecord> rejected = new ArrayList<>();
        for (TransactionRecord record : records) {
            if (apply(record)) {
                accepted.add(record);
            } else {
                rejected.add(record);
            }
        }
        log.debug("Filter accepted {} of {} records", accepted.size(), records.size());
        return new FilterOutcome(accepted, rejected);
    }

    /**
     * Scores one record in place; returns whether it passes.
     */
    public boolean apply(TransactionRecord record) {
        FilterResult result = evaluate(record);
        record.getMetadata().setQualityScore(result.score());
        record.getMetadata().getValidationIssues().clear();
        record.getMetadata().getValidationIssues().addAll(result.issues());
        return result.passes(threshold);
    }

    public double getThreshold() {
        return threshold;
    }

    private double completeness(TransactionRecord record, List<String> issues) {
        List<String> fields = schema.getAllFields();
        List<String> missing = new ArrayList<>();
        for (String field : fields) {
            if (!record.has(field)) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            issues.add("missing fields: " + missing);
        }
        return (fields.size() - missing.size()) / (double) fields.size();
    }

    private double format(TransactionRecord record, List<String> issues) {
        int present = 0;
        int valid = 0;
        for (String field : schema.getAllFields()) {
            if (!record.has(field)) {
                continue;
            }
            present++;
            FieldSpec spec = schema.getSpec(field);
            String problem = spec.check(record.get(field));
            if (problem == null) {
                valid++;
            } else {
                issues.add(problem);
            }
        }
        return present == 0 ? 0.0 : valid / (double) present;
    }

    private double temporal(TransactionRecord record, List<String> issues) {
        LocalDateTime transaction = record.getTime(GantryFields.TRANSACTION_TIME);
        LocalDateTime entrance = record.getTime(GantryFields.ENTRANCE_TIME);
        if (transaction == null || entrance == null) {
            issues.add("transaction_time or entrance_time missing or unparseable");
            return UNPARSEABLE_TIME_PENALTY;
        }
        if (!entrance.isBefore(transaction)) {
            issues.add("entrance_time " + entrance + " is not before transaction_time " + transaction);
            return TIME_ORDER_PENALTY;
        }
        Duration travel = Duration.between(entrance, transaction);
        if (travel.compareTo(maxTravel) > 0) {
            issues.add("travel time " + travel.toMinutes() + " min exceeds " + maxTravel.toMinutes() + " min");
            return TOO_LONG_PENALTY;
        }
        return 1.0;
    }

    private double fee(TransactionRecord record, List<String> issues) {
        Long payFee = record.getLong(GantryFields.PAY_FEE);
        Long discount = record.getLong(GantryFields.DISCOUNT_FEE);
        Long mileage = record.getLong(GantryFields.FEE_MILEAGE);
        if (payFee == null || discount == null || mileage == null) {
            issues.add("fee fields missing");
            return MISSING_FEE_PENALTY;
        }
        if (payFee < 0 || discount < 0) {
            issues.add("negative fee: pay_fee=" + payFee + ", discount_fee=" + discount);
            return 0.0;
        }
        if (discount > payFee) {
            issues.add("discount_fee " + discount + " exceeds pay_fee " + payFee);
            return DISCOUNT_EXCEEDS_PAY_PENALTY;
        }
        if (mileage <= 0 || !isFeeProportional(record, payFee, mileage)) {
            issues.add("pay_fee " + payFee + " out of proportion to fee_mileage " + mileage);
            return FEE_RATE_PENALTY;
        }
        return 1.0;
    }

    private boolean isFeeProportional(TransactionRecord record, long payFee, long mileage) {
        VehicleCategory category = classifier.category(record);
        double learnedRate = statistics.feeRate(category);
        if (!Double.isNaN(learnedRate) && learnedRate > 0) {
            FieldStatistics feeStats = statistics.get(category, GantryFields.PAY_FEE);
            double band = Math.max(MIN_RATE_BAND, Math.min(MAX_RATE_BAND, feeStats.variation()));
            double rate = payFee / (double) mileage;
            return Math.abs(rate - learnedRate) / learnedRate <= band;
        }
        Long vehicleType = record.getLong(GantryFields.VEHICLE_TYPE);
        if (vehicleType == null) {
            return true;
        }
        long expected = feeCalculator.expectedFee(vehicleType, mileage);
        if (expected <= 0) {
            return payFee == 0;
        }
        return Math.abs(payFee - expected) / (double) expected <= TARIFF_BAND;
    }

    private double axleWeight(TransactionRecord record, List<String> issues) {
        Long vehicleType = record.getLong(GantryFields.VEHICLE_TYPE);
        Long axles = record.getLong(GantryFields.AXLE_COUNT);
        Long weight = record.getLong(GantryFields.TOTAL_WEIGHT);
        VehicleCategory category = vehicleType == null ? null : VehicleCategory.fromCode(vehicleType);
        if (category == null || axles == null || weight == null) {
            issues.add("vehicle type, axle count or weight unavailable");
            return UNKNOWN_VEHICLE_PENALTY;
        }
        if (category == VehicleCategory.PASSENGER) {
            if (axles != 2) {
                issues.add("passenger vehicle with " + axles + " axles");
                return PASSENGER_AXLE_PENALTY;
            }
            return 1.0;
        }
        long limit = classifier.axleLimit(axles);
        if (weight > limit * GROSS_OVERWEIGHT_FACTOR) {
            issues.add("total_weight " + weight + " kg above 1.5x the " + axles + "-axle limit " + limit);
            return GROSS_OVERWEIGHT_PENALTY;
        }
        Integer expected = classifier.expectedAxles(vehicleType);
        if (expected != null && expected.longValue() != axles) {
            issues.add("vehicle_type " + vehicleType + " expects " + expected + " axles, got " + axles);
            return AXLE_MISMATCH_PENALTY;
        }
        return 1.0;
    }
}
