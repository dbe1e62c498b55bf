package org.carball.gantry.model.schema;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FieldSpecTest {

    private final FieldGroupSchema schema = FieldGroupSchema.gantryDefault();

    @Test
    void shouldCoerceExportStyleValues() {
        assertThat(schema.getSpec(GantryFields.TRANSACTION_TIME).coerce("2023-03-15 08:12:30"))
                .isEqualTo(LocalDateTime.of(2023, 3, 15, 8, 12, 30));
        assertThat(schema.getSpec(GantryFields.PAY_FEE).coerce("1250")).isEqualTo(1250L);
        assertThat(schema.getSpec(GantryFields.PAY_FEE).coerce(1250.4)).isEqualTo(1250L);
        assertThat(schema.getSpec(GantryFields.GANTRY_TYPE).coerce(1)).isEqualTo("1");
    }

    @Test
    void shouldRejectValuesOutsideRangeOrCodeList() {
        assertThatThrownBy(() -> schema.getSpec(GantryFields.AXLE_COUNT).coerce(7))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("above maximum");
        assertThatThrownBy(() -> schema.getSpec(GantryFields.VEHICLE_TYPE).coerce(8))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unexpected value");
        assertThatThrownBy(() -> schema.getSpec(GantryFields.ENTRANCE_TIME).coerce("yesterday"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReportProblemForWronglyTypedValue() {
        assertThat(schema.getSpec(GantryFields.PAY_FEE).check("100")).contains("must be an integer");
        assertThat(schema.getSpec(GantryFields.PAY_FEE).check(100L)).isNull();
    }
}
