package org.carball.gantry.model.record;

import org.carball.gantry.GantryFixtures;
import org.carball.gantry.model.schema.GantryFields;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TransactionRecordTest {

    @Test
    void shouldDropInvalidValuesWhenReadingRawRecord() {
        // When
        TransactionRecord record = GantryFixtures.truck(Map.of(
                GantryFields.AXLE_COUNT, 9,
                "unexpected_column", "ignored",
                GantryFields.SCENARIO, "normal"));

        // Then
        assertThat(record.has(GantryFields.AXLE_COUNT)).isFalse();
        assertThat(record.get(GantryFields.VEHICLE_TYPE)).isEqualTo(13L);
        assertThat(record.getTime(GantryFields.TRANSACTION_TIME)).isEqualTo(LocalDateTime.of(2023, 1, 3, 10, 15));
        assertThat(record.getString(GantryFields.SCENARIO)).isEqualTo("normal");
        assertThat(record.getFields()).doesNotContainKey("unexpected_column");
    }

    @Test
    void shouldRefuseToReassignField() {
        // Given
        TransactionRecord record = new TransactionRecord();
        record.assign(GantryFields.PAY_FEE, 100L);

        // When/Then
        assertThatThrownBy(() -> record.assign(GantryFields.PAY_FEE, 200L))
                .isInstanceOf(IllegalStateException.class);
        assertThat(record.get(GantryFields.PAY_FEE)).isEqualTo(100L);
    }

    @Test
    void shouldLogReplacements() {
        // Given
        TransactionRecord record = GantryFixtures.truck();

        // When
        record.replace(GantryFields.AXLE_COUNT, 4L, "test repair");

        // Then
        assertThat(record.get(GantryFields.AXLE_COUNT)).isEqualTo(4L);
        assertThat(record.getMetadata().getCorrectionLog())
                .containsExactly(new CorrectionEntry(GantryFields.AXLE_COUNT, 3L, 4L, "test repair"));
    }

    @Test
    void shouldNeverChangeTransactionId() {
        TransactionRecord record = GantryFixtures.truck();

        assertThatThrownBy(() -> record.replace(GantryFields.TRANSACTION_ID, "other", "rename"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldCopyMetadataIndependently() {
        // Given
        TransactionRecord record = GantryFixtures.truck();
        record.addIssue("original issue");

        // When
        TransactionRecord copy = record.copy();
        copy.addIssue("copy issue");
        copy.replace(GantryFields.TOTAL_WEIGHT, 21_000L, "copy change");

        // Then
        assertThat(record.getMetadata().getValidationIssues()).containsExactly("original issue");
        assertThat(record.get(GantryFields.TOTAL_WEIGHT)).isEqualTo(20_000L);
        assertThat(copy.getId()).isEqualTo(record.getId());
    }

    @Test
    void shouldOnlyAcceptKnownLabels() {
        TransactionRecord record = GantryFixtures.truck();

        assertThatThrownBy(() -> record.putLabel(GantryFields.PAY_FEE, "1"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
