package org.carball.gantry.curation;

import org.carball.gantry.GantryFixtures;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.model.stats.LearnedStatistics;
import org.carball.gantry.reference.FeeCalculator;
import org.carball.gantry.reference.StatisticsLearner;
import org.carball.gantry.reference.VehicleClassifier;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class SampleFilterTest {

    private final VehicleClassifier classifier = new VehicleClassifier(GantryFixtures.tables());

    @Test
    void shouldGiveCleanRecordFullScore() {
        // When
        FilterResult result = filter(null).evaluate(GantryFixtures.truck());

        // Then
        assertThat(result.score()).isEqualTo(1.0);
        assertThat(result.issues()).isEmpty();
        assertThat(result.subScores()).containsOnlyKeys(
                SampleFilter.COMPLETENESS, SampleFilter.FORMAT, SampleFilter.TEMPORAL, SampleFilter.FEE, SampleFilter.AXLE_WEIGHT);
    }

    @Test
    void shouldPenalizeReversedTimesWithoutRejecting() {
        // Given
        TransactionRecord record = GantryFixtures.truck(Map.of(GantryFields.ENTRANCE_TIME, "2023-01-03T11:00:00"));

        // When
        FilterResult result = filter(null).evaluate(record);

        // Then
        assertThat(result.subScores().get(SampleFilter.TEMPORAL)).isEqualTo(SampleFilter.TIME_ORDER_PENALTY);
        assertThat(result.score()).isCloseTo(4.3 / 5, within(1e-9));
        assertThat(result.passes(0.8)).isTrue();
        assertThat(result.issues()).singleElement().asString().contains("is not before transaction_time");
    }

    @Test
    void shouldPenalizeTravelLongerThanMaximum() {
        TransactionRecord record = GantryFixtures.truck(Map.of(GantryFields.ENTRANCE_TIME, "2023-01-03T02:00:00"));

        FilterResult result = filter(null).evaluate(record);

        assertThat(result.subScores().get(SampleFilter.TEMPORAL)).isEqualTo(SampleFilter.TOO_LONG_PENALTY);
    }

    @Test
    void shouldScoreFeeChecks() {
        SampleFilter filter = filter(null);

        assertThat(filter.evaluate(GantryFixtures.truck(Map.of(GantryFields.DISCOUNT_FEE, 6000))).subScores()
                .get(SampleFilter.FEE)).isEqualTo(SampleFilter.DISCOUNT_EXCEEDS_PAY_PENALTY);
        assertThat(filter.evaluate(GantryFixtures.truck(Map.of(GantryFields.PAY_FEE, 20000))).subScores()
                .get(SampleFilter.FEE)).isEqualTo(SampleFilter.FEE_RATE_PENALTY);
    }

    @Test
    void shouldScoreAxleAndWeightChecks() {
        SampleFilter filter = filter(null);

        assertThat(filter.evaluate(GantryFixtures.passenger(Map.of(GantryFields.AXLE_COUNT, 3))).subScores()
                .get(SampleFilter.AXLE_WEIGHT)).isEqualTo(SampleFilter.PASSENGER_AXLE_PENALTY);
        assertThat(filter.evaluate(GantryFixtures.truck(Map.of(GantryFields.TOTAL_WEIGHT, 40000))).subScores()
                .get(SampleFilter.AXLE_WEIGHT)).isEqualTo(SampleFilter.GROSS_OVERWEIGHT_PENALTY);
        assertThat(filter.evaluate(GantryFixtures.truck(Map.of(GantryFields.AXLE_COUNT, 4))).subScores()
                .get(SampleFilter.AXLE_WEIGHT)).isEqualTo(SampleFilter.AXLE_MISMATCH_PENALTY);
    }

    @Test
    void shouldScoreIncompleteRecordByMissingShare() {
        // Given
        TransactionRecord record = new TransactionRecord();
        record.assign(GantryFields.TRANSACTION_ID, "X1");

        // When
        FilterResult result = filter(null).evaluate(record);

        // Then
        assertThat(result.subScores().get(SampleFilter.COMPLETENESS)).isCloseTo(1 / 19.0, within(1e-9));
        assertThat(result.passes(0.8)).isFalse();
        assertThat(result.issues().get(0)).startsWith("missing fields:");
    }

    @Test
    void shouldPartitionAndRecordScores() {
        // Given
        TransactionRecord clean = GantryFixtures.truck();
        TransactionRecord broken = GantryFixtures.truck(Map.of(
                GantryFields.ENTRANCE_TIME, "2023-01-03T11:00:00",
                GantryFields.PAY_FEE, 20000,
                GantryFields.AXLE_COUNT, 4));

        // When
        FilterOutcome outcome = filter(null).filter(List.of(clean, broken));

        // Then
        assertThat(outcome.accepted()).containsExactly(clean);
        assertThat(outcome.rejected()).containsExactly(broken);
        assertThat(clean.getMetadata().getQualityScore()).isEqualTo(1.0);
        assertThat(broken.getMetadata().getQualityScore()).isLessThan(0.8);
        assertThat(broken.getMetadata().getValidationIssues()).hasSize(3);
    }

    @Test
    void shouldCompareFeeRateWithLearnedStatistics() {
        // Given
        LearnedStatistics stats = new StatisticsLearner(classifier).learn(GantryFixtures.pool(60, 2L));
        SampleFilter filter = filter(stats);

        // When/Then
        assertThat(filter.evaluate(GantryFixtures.truck()).subScores().get(SampleFilter.FEE)).isEqualTo(1.0);
        assertThat(filter.evaluate(GantryFixtures.truck(Map.of(GantryFields.PAY_FEE, 20000))).subScores()
                .get(SampleFilter.FEE)).isEqualTo(SampleFilter.FEE_RATE_PENALTY);
    }

    private SampleFilter filter(LearnedStatistics stats) {
        return new SampleFilter(GantryFixtures.schema(), classifier, new FeeCalculator(GantryFixtures.tables()),
                stats, 0.8, Duration.ofHours(6));
    }
}
