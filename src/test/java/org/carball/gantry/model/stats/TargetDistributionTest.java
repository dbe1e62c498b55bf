package org.carball.gantry.model.stats;

import org.carball.gantry.PipelineException;
import org.carball.gantry.model.condition.Scenario;
import org.carball.gantry.model.condition.TimePeriod;
import org.carball.gantry.model.condition.VehicleCategory;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class TargetDistributionTest {

    @Test
    void shouldNormalizeSharesAndFillMissingValues() {
        // When
        TargetDistribution target = TargetDistribution.fromWire(Map.of(
                "vehicle", Map.of("truck", 7, "passenger", 3),
                "scenario", Map.of("normal", 1.0)));

        // Then
        assertThat(target.getVehicle().get(VehicleCategory.TRUCK)).isCloseTo(0.7, within(1e-9));
        assertThat(target.getVehicle().get(VehicleCategory.SPECIAL)).isZero();
        assertThat(target.getScenario().get(Scenario.OVERLOADED)).isZero();
        assertThat(target.getTime().get(TimePeriod.OFF_PEAK)).isCloseTo(0.4, within(1e-9));
        assertThat(target.supportSize()).isEqualTo(2 + 4 + 1);
    }

    @Test
    void shouldRejectNegativeShare() {
        assertThatThrownBy(() -> TargetDistribution.fromWire(Map.of("vehicle", Map.of("truck", -0.1, "passenger", 1.0))))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("non-negative");
    }

    @Test
    void shouldRejectUnknownDimensionOrValue() {
        assertThatThrownBy(() -> TargetDistribution.fromWire(Map.of("weather", Map.of("rain", 1.0))))
                .isInstanceOf(PipelineException.class);
        assertThatThrownBy(() -> TargetDistribution.fromWire(Map.of("vehicle", Map.of("bicycle", 1.0))))
                .isInstanceOf(PipelineException.class);
    }

    @Test
    void shouldRejectAllZeroShares() {
        assertThatThrownBy(() -> TargetDistribution.fromWire(Map.of("scenario", Map.of("normal", 0.0))))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("sums to zero");
    }
}
