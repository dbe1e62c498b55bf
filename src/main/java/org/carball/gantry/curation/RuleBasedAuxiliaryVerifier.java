package org.carball.gantry.curation;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.reference.FeeCalculator;
import org.carball.gantry.reference.VehicleClassifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based verifier: aligns axle counts with the vehicle class and flags fees far from tariff.
 */
@Slf4j
public class RuleBasedAuxiliaryVerifier implements AuxiliaryVerifier {

    static final double FEE_DEVIATION_LIMIT = 0.5;

    private final VehicleClassifier classifier;
    private final FeeCalculator feeCalculator;

    public RuleBasedAuxiliaryVerifier(VehicleClassifier classifier, FeeCalculator feeCalculator) {
        this.classifier = classifier;
        this.feeCalculator = feeCalculator;
    }

    @Override
    public List<TransactionRecord> verify(List<TransactionRecord> records) {
        List<TransactionRecord> verified = new ArrayList<>(records.size());
        int corrected = 0;
        for (TransactionRecord source : records) {
            TransactionRecord record = source.copy();
            int before = record.getMetadata().getCorrectionLog().size();
            alignAxles(record);
            flagFee(record);
            if (record.getMetadata().getCorrectionLog().size() > before) {
                corrected++;
            }
            verified.add(record);
        }
        log.info("Auxiliary verification corrected {} of {} records", corrected, records.size());
        return verified;
    }

    private void alignAxles(TransactionRecord record) {
        Long vehicleType = record.getLong(GantryFields.VEHICLE_TYPE);
        Long axles = record.getLong(GantryFields.AXLE_COUNT);
        VehicleCategory category = classifier.category(record);
        if (vehicleType == null || category == null) {
            return;
        }
        if (category == VehicleCategory.PASSENGER) {
            if (axles == null || axles != 2) {
                record.replace(GantryFields.AXLE_COUNT, 2L, "verifier: passenger vehicles have 2 axles");
            }
            return;
        }
        Integer expected = classifier.expectedAxles(vehicleType);
        if (category == VehicleCategory.TRUCK && expected != null && (axles == null || axles != expected.longValue())) {
            record.replace(GantryFields.AXLE_COUNT, expected.longValue(),
                    "verifier: axle count aligned with vehicle_type " + vehicleType);
        }
    }

    private void flagFee(TransactionRecord record) {
        Long vehicleType = record.getLong(GantryFields.VEHICLE_TYPE);
        Long payFee = record.getLong(GantryFields.PAY_FEE);
        Long mileage = record.getLong(GantryFields.FEE_MILEAGE);
        if (vehicleType == null || payFee == null || mileage == null) {
            return;
        }
        long expected = feeCalculator.expectedFee(vehicleType, mileage);
        if (expected > 0 && Math.abs(payFee - expected) / (double) expected > FEE_DEVIATION_LIMIT) {
            record.addIssue(String.format("verifier: pay_fee %d deviates more than 50%% from tariff %d", payFee, expected));
        }
    }
}
