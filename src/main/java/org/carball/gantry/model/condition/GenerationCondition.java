package org.carball.gantry.model.condition;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * What the scheduler asks the decomposer to produce next.
 */
public record GenerationCondition(
        VehicleCategory vehicleCategory,
        TimePeriod timePeriod,
        Scenario scenario,
        LocalDateTime baseTime
) {

    public GenerationCondition {
        Objects.requireNonNull(vehicleCategory, "vehicleCategory");
        Objects.requireNonNull(timePeriod, "timePeriod");
        Objects.requireNonNull(scenario, "scenario");
        Objects.requireNonNull(baseTime, "baseTime");
    }

    /**
     * Key identifying the condition regardless of base time; used for per-condition retry accounting.
     */
    public String key() {
        return vehicleCategory.getWireName() + "/" + timePeriod.getWireName() + "/" + scenario.getWireName();
    }

    public String describe() {
        return String.format("vehicle=%s, period=%s (%s), scenario=%s, base=%s",
                vehicleCategory.getWireName(), timePeriod.getWireName(), timePeriod.getWindow(),
                scenario.getWireName(), baseTime.toLocalDate());
    }
}
