package org.carball.gantry.reference;

import org.carball.gantry.GantryFixtures;
import org.carball.gantry.model.condition.Scenario;
import org.carball.gantry.model.condition.TimePeriod;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class VehicleClassifierTest {

    private final VehicleClassifier classifier = new VehicleClassifier(GantryFixtures.tables());

    @Test
    void shouldClassifyByVehicleTypeCode() {
        assertThat(classifier.category(GantryFixtures.truck())).isEqualTo(VehicleCategory.TRUCK);
        assertThat(classifier.category(GantryFixtures.passenger())).isEqualTo(VehicleCategory.PASSENGER);
        assertThat(classifier.category(GantryFixtures.truck(Map.of(GantryFields.VEHICLE_TYPE, 24))))
                .isEqualTo(VehicleCategory.SPECIAL);
    }

    @Test
    void shouldReturnSameCategoriesOnRepeatedCalls() {
        TransactionRecord record = GantryFixtures.truck();

        assertThat(classifier.category(record)).isEqualTo(classifier.category(record));
        assertThat(classifier.timePeriod(record)).isEqualTo(classifier.timePeriod(record));
        assertThat(classifier.scenario(record)).isEqualTo(classifier.scenario(record));
    }

    @Test
    void shouldClassifyTimePeriodBoundaries() {
        assertThat(classifier.timePeriod(at("2023-01-03T07:00:00"))).isEqualTo(TimePeriod.MORNING_PEAK);
        assertThat(classifier.timePeriod(at("2023-01-03T08:59:59"))).isEqualTo(TimePeriod.MORNING_PEAK);
        assertThat(classifier.timePeriod(at("2023-01-03T09:00:00"))).isEqualTo(TimePeriod.OFF_PEAK);
        assertThat(classifier.timePeriod(at("2023-01-03T17:30:00"))).isEqualTo(TimePeriod.EVENING_PEAK);
        assertThat(classifier.timePeriod(at("2023-01-03T23:00:00"))).isEqualTo(TimePeriod.NIGHT);
        assertThat(classifier.timePeriod(at("2023-01-03T04:59:00"))).isEqualTo(TimePeriod.NIGHT);
        assertThat(classifier.timePeriod(at("2023-01-03T05:00:00"))).isEqualTo(TimePeriod.OFF_PEAK);
    }

    @Test
    void shouldPreferOverloadedOverAnomalous() {
        // Given
        TransactionRecord record = GantryFixtures.truck(Map.of(
                GantryFields.TOTAL_WEIGHT, 26_000,
                GantryFields.PASS_STATE, "2"));

        // When/Then
        assertThat(classifier.isOverloaded(record)).isTrue();
        assertThat(classifier.scenario(record)).isEqualTo(Scenario.OVERLOADED);
    }

    @Test
    void shouldFlagMissingEntryOrCompositeTransactionAsAnomalous() {
        assertThat(classifier.scenario(GantryFixtures.truck(Map.of(GantryFields.PASS_STATE, "2"))))
                .isEqualTo(Scenario.ANOMALOUS);
        assertThat(classifier.scenario(GantryFixtures.passenger(Map.of(GantryFields.TRANSACTION_TYPE, "09"))))
                .isEqualTo(Scenario.ANOMALOUS);
        assertThat(classifier.scenario(GantryFixtures.truck())).isEqualTo(Scenario.NORMAL);
    }

    @Test
    void shouldNeverConsiderPassengerCarsOverloaded() {
        TransactionRecord heavyCar = GantryFixtures.passenger(Map.of(GantryFields.TOTAL_WEIGHT, 40_000));

        assertThat(classifier.isOverloaded(heavyCar)).isFalse();
    }

    private static TransactionRecord at(String time) {
        return GantryFixtures.truck(Map.of(GantryFields.TRANSACTION_TIME, time));
    }
}
