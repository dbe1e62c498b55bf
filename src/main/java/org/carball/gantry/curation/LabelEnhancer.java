package org.carball.gantry.curation;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.condition.Scenario;
import org.carball.gantry.model.condition.TimePeriod;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.reference.ReferenceTables;
import org.carball.gantry.reference.VehicleClassifier;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Adds derived labels and applies two deterministic repairs: time ordering and gantry-to-section
 * consistency. Works on a copy; every repair is written to the correction log.
 */
@Slf4j
public class LabelEnhancer {

    private final VehicleClassifier classifier;
    private final ReferenceTables tables;
    private final Duration minTravel;
    private final Duration maxTravel;

    public LabelEnhancer(VehicleClassifier classifier, ReferenceTables tables, Duration minTravel, Duration maxTravel) {
        this.classifier = classifier;
        this.tables = tables;
        this.minTravel = minTravel;
        this.maxTravel = maxTravel;
    }

    public TransactionRecord enhance(TransactionRecord source) {
        TransactionRecord record = source.copy();
        repairTimeOrder(record);
        repairSection(record);
        label(record);
        return record;
    }

    public List<TransactionRecord> enhanceAll(List<TransactionRecord> records) {
        return records.stream().map(this::enhance).toList();
    }

    /**
     * Recomputes the derived labels of a copy without repairing any field. Used after a
     * verifier has changed fields the labels depend on.
     */
    public TransactionRecord relabel(TransactionRecord source) {
        TransactionRecord record = source.copy();
        label(record);
        return record;
    }

    public List<TransactionRecord> relabelAll(List<TransactionRecord> records) {
        return records.stream().map(this::relabel).toList();
    }

    private void repairTimeOrder(TransactionRecord record) {
        LocalDateTime transaction = record.getTime(GantryFields.TRANSACTION_TIME);
        LocalDateTime entrance = record.getTime(GantryFields.ENTRANCE_TIME);
        if (transaction == null || entrance == null) {
            return;
        }
        if (!entrance.isBefore(transaction)) {
            Duration reversed = Duration.between(transaction, entrance);
            if (reversed.compareTo(minTravel) >= 0 && reversed.compareTo(maxTravel) <= 0) {
                record.replace(GantryFields.TRANSACTION_TIME, entrance, "time order: swapped reversed timestamps");
                record.replace(GantryFields.ENTRANCE_TIME, transaction, "time order: swapped reversed timestamps");
            } else {
                record.replace(GantryFields.ENTRANCE_TIME, transaction.minus(minTravel),
                        "time order: entrance clamped to minimum travel time");
            }
        } else if (Duration.between(entrance, transaction).compareTo(maxTravel) > 0) {
            record.replace(GantryFields.ENTRANCE_TIME, transaction.minus(maxTravel),
                    "time order: entrance clamped to maximum travel time");
        }
    }

    private void repairSection(TransactionRecord record) {
        ReferenceTables.Section section = tables.sectionOfGantry(record.getString(GantryFields.GANTRY_ID));
        if (section == null) {
            return;
        }
        if (!Objects.equals(section.getId(), record.getString(GantryFields.SECTION_ID))) {
            record.replace(GantryFields.SECTION_ID, section.getId(), "section does not own gantry");
        }
        if (!Objects.equals(section.getName(), record.getString(GantryFields.SECTION_NAME))) {
            record.replace(GantryFields.SECTION_NAME, section.getName(), "section name does not match section");
        }
    }

    private void label(TransactionRecord record) {
        VehicleCategory category = classifier.category(record);
        if (category != null) {
            record.putLabel(GantryFields.VEHICLE_CATEGORY, category.getWireName());
        }
        TimePeriod period = classifier.timePeriod(record);
        if (period != null) {
            record.putLabel(GantryFields.TIME_PERIOD, period.getWireName());
        }
        Scenario scenario = classifier.scenario(record);
        record.putLabel(GantryFields.SCENARIO, scenario.getWireName());
        log.trace("Labelled record {}: {}/{}/{}", record.getId(), category, period, scenario);
    }
}
