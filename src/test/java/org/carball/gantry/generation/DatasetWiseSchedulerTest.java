package org.carball.gantry.generation;

import org.carball.gantry.GantryFixtures;
import org.carball.gantry.model.condition.GenerationCondition;
import org.carball.gantry.model.condition.Scenario;
import org.carball.gantry.model.condition.TimePeriod;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.stats.TargetDistribution;
import org.carball.gantry.reference.VehicleClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class DatasetWiseSchedulerTest {

    private VehicleClassifier classifier;
    private SectionDateMapper dateMapper;

    @BeforeEach
    void setUp() {
        classifier = new VehicleClassifier(GantryFixtures.tables());
        dateMapper = new SectionDateMapper(GantryFixtures.tables());
    }

    @Test
    void shouldPickValueWithLargestGapFirst() {
        // Given
        DatasetWiseScheduler scheduler = new DatasetWiseScheduler(truckHeavyTarget(), classifier, dateMapper, 1L);

        // When
        GenerationCondition condition = scheduler.nextCondition();

        // Then
        assertThat(condition.vehicleCategory()).isEqualTo(VehicleCategory.TRUCK);
        assertThat(condition.timePeriod()).isEqualTo(TimePeriod.OFF_PEAK);
        assertThat(condition.scenario()).isEqualTo(Scenario.NORMAL);
    }

    @Test
    void shouldSwitchToUnderrepresentedValueAfterAcceptance() {
        // Given
        DatasetWiseScheduler scheduler = new DatasetWiseScheduler(truckHeavyTarget(), classifier, dateMapper, 1L);

        // When
        scheduler.update(GantryFixtures.truck(), true);
        GenerationCondition next = scheduler.nextCondition();

        // Then
        assertThat(next.vehicleCategory()).isEqualTo(VehicleCategory.PASSENGER);
    }

    @Test
    void shouldOnlyCountAcceptedRecordsTowardsShares() {
        // Given
        DatasetWiseScheduler scheduler = new DatasetWiseScheduler(truckHeavyTarget(), classifier, dateMapper, 1L);

        // When
        scheduler.update(GantryFixtures.truck(), false);
        scheduler.update(GantryFixtures.truck(), false);

        // Then
        assertThat(scheduler.nextCondition().vehicleCategory()).isEqualTo(VehicleCategory.TRUCK);
        Map<String, Number> truck = scheduler.snapshot().get("vehicle").get("truck");
        assertThat(truck.get("attempted")).isEqualTo(2);
        assertThat(truck.get("accepted")).isEqualTo(0);
        assertThat(truck.get("target").doubleValue()).isEqualTo(0.7);
    }

    @Test
    void shouldTrackRejectionsPerCondition() {
        // Given
        DatasetWiseScheduler scheduler = new DatasetWiseScheduler(TargetDistribution.defaults(), classifier, dateMapper, 3L);
        GenerationCondition condition = new GenerationCondition(
                VehicleCategory.TRUCK, TimePeriod.OFF_PEAK, Scenario.NORMAL, LocalDateTime.of(2023, 1, 3, 0, 0));
        TransactionRecord record = GantryFixtures.truck();
        record.getMetadata().setCondition(condition);

        // When
        scheduler.update(record, false);
        scheduler.update(record, false);

        // Then
        assertThat(scheduler.rejectedCount(condition)).isEqualTo(2);
    }

    @Test
    void shouldCountRecoveryWithoutNewAttempt() {
        // Given
        DatasetWiseScheduler scheduler = new DatasetWiseScheduler(truckHeavyTarget(), classifier, dateMapper, 1L);
        TransactionRecord record = GantryFixtures.truck();
        scheduler.update(record, false);

        // When
        scheduler.recordRecovery(record);

        // Then
        Map<String, Number> truck = scheduler.snapshot().get("vehicle").get("truck");
        assertThat(truck.get("attempted")).isEqualTo(1);
        assertThat(truck.get("accepted")).isEqualTo(1);
    }

    @Test
    void shouldAvoidExhaustedConditionWhenAlternativesExist() {
        // Given
        DatasetWiseScheduler scheduler = new DatasetWiseScheduler(TargetDistribution.defaults(), classifier, dateMapper, 11L);
        String favourite = scheduler.nextCondition().key();

        // When
        GenerationCondition next = scheduler.nextCondition(Set.of(favourite));

        // Then
        assertThat(next.key()).isNotEqualTo(favourite);
    }

    @Test
    void shouldDrawBaseTimeFromKnownSamplingDates() {
        DatasetWiseScheduler scheduler = new DatasetWiseScheduler(TargetDistribution.defaults(), classifier, dateMapper, 5L);

        LocalDateTime base = scheduler.nextCondition().baseTime();

        assertThat(base.toLocalTime()).isEqualTo(java.time.LocalTime.MIDNIGHT);
        assertThat(base.getYear()).isEqualTo(2023);
    }

    private static TargetDistribution truckHeavyTarget() {
        return TargetDistribution.fromWire(Map.of("vehicle", Map.of("truck", 0.7, "passenger", 0.3)));
    }
}
