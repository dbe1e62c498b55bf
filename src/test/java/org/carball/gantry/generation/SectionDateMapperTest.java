package org.carball.gantry.generation;

import org.carball.gantry.GantryFixtures;
import org.carball.gantry.model.schema.GantryFields;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

public class SectionDateMapperTest {

    @Test
    void shouldAcceptOnlyKnownSamplingDatesForKnownSection() {
        SectionDateMapper mapper = new SectionDateMapper(GantryFixtures.tables());

        assertThat(mapper.isPlausible("G5615530120", LocalDate.of(2023, 1, 3))).isTrue();
        assertThat(mapper.isPlausible("G5615530120", LocalDate.of(2023, 1, 4))).isFalse();
        assertThat(mapper.isPlausible("G5615530120", null)).isFalse();
    }

    @Test
    void shouldPassUnknownSections() {
        SectionDateMapper mapper = new SectionDateMapper(GantryFixtures.tables());

        assertThat(mapper.isPlausible("X0000000000", LocalDate.of(1999, 1, 1))).isTrue();
    }

    @Test
    void shouldLearnDatesFromReferenceRecords() {
        // Given
        SectionDateMapper mapper = new SectionDateMapper(GantryFixtures.tables());

        // When
        mapper.learnFromSamples(List.of(GantryFixtures.truck(Map.of(GantryFields.TRANSACTION_TIME, "2023-01-09T11:00:00"))));

        // Then
        assertThat(mapper.isPlausible("G5615530120", LocalDate.of(2023, 1, 9))).isTrue();
        assertThat(mapper.snapshot().get("G5615530120")).contains(LocalDate.of(2023, 1, 3), LocalDate.of(2023, 1, 9));
    }

    @Test
    void shouldDrawSectionDateFromItsOwnDates() {
        SectionDateMapper mapper = new SectionDateMapper(GantryFixtures.tables());

        assertThat(mapper.dateFor("G5615530120", new Random(1L))).isEqualTo(LocalDate.of(2023, 1, 3));
    }
}
