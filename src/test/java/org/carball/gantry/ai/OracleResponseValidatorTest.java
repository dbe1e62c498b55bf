package org.carball.gantry.ai;

import org.carball.gantry.GantryFixtures;
import org.carball.gantry.model.schema.FieldGroupSchema;
import org.carball.gantry.model.schema.GantryFields;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OracleResponseValidatorTest {

    private final FieldGroupSchema schema = GantryFixtures.schema();
    private final OracleResponseValidator validator = new OracleResponseValidator(schema);

    @Test
    void shouldTypeValuesAndDropExtraKeys() throws Exception {
        // When
        Map<String, Object> typed = validator.validate(schema.getGroup(GantryFields.GROUP_TIME), Map.of(
                GantryFields.TRANSACTION_TIME, "2023-01-03 10:15:00",
                GantryFields.ENTRANCE_TIME, "2023-01-03T09:00:00",
                "comment", "extra"));

        // Then
        assertThat(typed).containsOnlyKeys(GantryFields.TRANSACTION_TIME, GantryFields.ENTRANCE_TIME);
        assertThat(typed.get(GantryFields.TRANSACTION_TIME)).isEqualTo(LocalDateTime.of(2023, 1, 3, 10, 15));
    }

    @Test
    void shouldRejectMissingKey() {
        assertThatThrownBy(() -> validator.validate(schema.getGroup(GantryFields.GROUP_TIME),
                Map.of(GantryFields.TRANSACTION_TIME, "2023-01-03T10:15:00")))
                .isInstanceOf(InvalidOracleResponseException.class)
                .hasMessageContaining("Missing field 'entrance_time'");
    }

    @Test
    void shouldRejectOutOfRangeValue() {
        assertThatThrownBy(() -> validator.validate(schema.getGroup(GantryFields.GROUP_FEE), Map.of(
                GantryFields.PAY_FEE, 100, GantryFields.DISCOUNT_FEE, 0, GantryFields.FEE_MILEAGE, 0)))
                .isInstanceOf(InvalidOracleResponseException.class)
                .hasMessageContaining("fee_mileage");
    }

    @Test
    void shouldRejectNullResponse() {
        assertThatThrownBy(() -> validator.validate(schema.getGroup(GantryFields.GROUP_FEE), null))
                .isInstanceOf(InvalidOracleResponseException.class);
    }
}
