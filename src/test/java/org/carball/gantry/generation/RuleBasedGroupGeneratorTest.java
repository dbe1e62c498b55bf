package org.carball.gantry.generation;

import org.carball.gantry.GantryFixtures;
import org.carball.gantry.model.condition.GenerationCondition;
import org.carball.gantry.model.condition.Scenario;
import org.carball.gantry.model.condition.TimePeriod;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.FieldGroupSchema;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.reference.FeeCalculator;
import org.carball.gantry.reference.ReferenceTables;
import org.carball.gantry.reference.StatisticsLearner;
import org.carball.gantry.reference.VehicleClassifier;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

public class RuleBasedGroupGeneratorTest {

    private final FieldGroupSchema schema = GantryFixtures.schema();
    private final ReferenceTables tables = GantryFixtures.tables();
    private final VehicleClassifier classifier = new VehicleClassifier(tables);
    private final SectionDateMapper dateMapper = new SectionDateMapper(tables);

    @Test
    void shouldProduceOverloadedTruckForOverloadedCondition() {
        // Given
        RuleBasedGroupGenerator generator = generator(false);
        GenerationCondition condition = condition(VehicleCategory.PASSENGER, TimePeriod.OFF_PEAK, Scenario.OVERLOADED);

        // When
        TransactionRecord record = build(generator, condition, 1L);

        // Then
        assertThat(classifier.category(record)).isEqualTo(VehicleCategory.TRUCK);
        assertThat(classifier.isOverloaded(record)).isTrue();
        assertThat(record.getString(GantryFields.PASS_STATE)).isEqualTo("2");
    }

    @Test
    void shouldPlaceTransactionInRequestedPeriodOnSectionDate() {
        RuleBasedGroupGenerator generator = generator(false);
        for (TimePeriod period : TimePeriod.values()) {
            for (long seed = 0; seed < 20; seed++) {
                TransactionRecord record = build(generator, condition(VehicleCategory.TRUCK, period, Scenario.NORMAL), seed);

                assertThat(classifier.timePeriod(record)).isEqualTo(period);
                assertThat(dateMapper.isPlausible(record.getString(GantryFields.SECTION_ID),
                        record.getTime(GantryFields.TRANSACTION_TIME).toLocalDate())).isTrue();
            }
        }
    }

    @Test
    void shouldProduceValuesPassingFieldSpecs() {
        // Given
        RuleBasedGroupGenerator generator = generator(true);

        // When
        TransactionRecord record = build(generator, condition(VehicleCategory.SPECIAL, TimePeriod.NIGHT, Scenario.ANOMALOUS), 3L);

        // Then
        for (String field : schema.getAllFields()) {
            assertThat(schema.getSpec(field).check(record.get(field))).as(field).isNull();
        }
        assertThat(record.getLong(GantryFields.DISCOUNT_FEE)).isLessThanOrEqualTo(record.getLong(GantryFields.PAY_FEE));
    }

    @Test
    void shouldFollowTariffWithoutLearnedStatistics() {
        // Given
        RuleBasedGroupGenerator generator = generator(false);

        // When
        TransactionRecord record = build(generator, condition(VehicleCategory.TRUCK, TimePeriod.OFF_PEAK, Scenario.NORMAL), 8L);

        // Then
        long expected = new FeeCalculator(tables).expectedFee(record.getLong(GantryFields.VEHICLE_TYPE),
                record.getLong(GantryFields.FEE_MILEAGE));
        assertThat(record.getLong(GantryFields.PAY_FEE)).isEqualTo(expected);
    }

    @Test
    void shouldStayWithinPeriodHours() {
        Random random = new Random(17L);
        for (int i = 0; i < 200; i++) {
            assertThat(TimePeriod.fromHour(RuleBasedGroupGenerator.hourIn(TimePeriod.NIGHT, random))).isEqualTo(TimePeriod.NIGHT);
            assertThat(TimePeriod.fromHour(RuleBasedGroupGenerator.hourIn(TimePeriod.OFF_PEAK, random))).isEqualTo(TimePeriod.OFF_PEAK);
        }
    }

    private RuleBasedGroupGenerator generator(boolean learned) {
        return new RuleBasedGroupGenerator(tables, new FeeCalculator(tables), dateMapper,
                learned ? new StatisticsLearner(classifier).learn(GantryFixtures.pool(60, 4L)) : null);
    }

    private TransactionRecord build(RuleBasedGroupGenerator generator, GenerationCondition condition, long seed) {
        TransactionRecord record = new TransactionRecord();
        Random random = new Random(seed);
        schema.getGenerationOrder().forEach(group -> {
            Map<String, Object> values = generator.generate(new GroupRequest(group, condition, record, seed, random));
            values.forEach(record::assign);
        });
        return record;
    }

    private static GenerationCondition condition(VehicleCategory category, TimePeriod period, Scenario scenario) {
        return new GenerationCondition(category, period, scenario, LocalDateTime.of(2023, 2, 1, 0, 0));
    }
}
