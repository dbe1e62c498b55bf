package org.carball.gantry.reference;

import org.carball.gantry.model.condition.Scenario;
import org.carball.gantry.model.condition.TimePeriod;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;

import java.time.LocalDateTime;

/**
 * Fixed-boundary classification of records into scheduling categories.
 */
public class VehicleClassifier {

    private final ReferenceTables tables;

    public VehicleClassifier(ReferenceTables tables) {
        this.tables = tables;
    }

    public VehicleCategory category(TransactionRecord record) {
        Long vehicleType = record.getLong(GantryFields.VEHICLE_TYPE);
        return vehicleType == null ? null : VehicleCategory.fromCode(vehicleType);
    }

    public TimePeriod timePeriod(TransactionRecord record) {
        LocalDateTime time = record.getTime(GantryFields.TRANSACTION_TIME);
        return time == null ? null : TimePeriod.fromHour(time.getHour());
    }

    /**
     * Overloaded wins over anomalous. Records without a vehicle class are judged on status only.
     */
    public Scenario scenario(TransactionRecord record) {
        if (isOverloaded(record)) {
            return Scenario.OVERLOADED;
        }
        if (GantryFields.PASS_STATE_NO_ENTRY.equals(record.getString(GantryFields.PASS_STATE))
                || GantryFields.TRANSACTION_TYPE_COMPOSITE.equals(record.getString(GantryFields.TRANSACTION_TYPE))) {
            return Scenario.ANOMALOUS;
        }
        return Scenario.NORMAL;
    }

    /**
     * Heavy vehicle whose gross weight exceeds the limit for its axle count.
     */
    public boolean isOverloaded(TransactionRecord record) {
        VehicleCategory category = category(record);
        Long weight = record.getLong(GantryFields.TOTAL_WEIGHT);
        Long axles = record.getLong(GantryFields.AXLE_COUNT);
        if (category == null || !category.isHeavy() || weight == null || axles == null) {
            return false;
        }
        return weight > tables.axleLimit(axles);
    }

    public long axleLimit(long axleCount) {
        return tables.axleLimit(axleCount);
    }

    public Integer expectedAxles(long vehicleType) {
        return tables.expectedAxles(vehicleType);
    }

    public ReferenceTables.WeightRange passengerWeight() {
        return tables.getPassengerWeight();
    }
}
