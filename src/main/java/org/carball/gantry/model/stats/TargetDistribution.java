package org.carball.gantry.model.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.carball.gantry.PipelineException;
import org.carball.gantry.model.condition.Scenario;
import org.carball.gantry.model.condition.TimePeriod;
import org.carball.gantry.model.condition.VehicleCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Desired share of each category value, per scheduling dimension. Shares are rescaled to sum to 1.
 */
public final class TargetDistribution {

    private final Map<VehicleCategory, Double> vehicle;
    private final Map<TimePeriod, Double> time;
    private final Map<Scenario, Double> scenario;

    public TargetDistribution(Map<VehicleCategory, Double> vehicle,
                              Map<TimePeriod, Double> time,
                              Map<Scenario, Double> scenario) {
        this.vehicle = normalize("vehicle", vehicle, VehicleCategory.class);
        this.time = normalize("time", time, TimePeriod.class);
        this.scenario = normalize("scenario", scenario, Scenario.class);
    }

    public static TargetDistribution defaults() {
        return new TargetDistribution(
                Map.of(VehicleCategory.TRUCK, 0.6, VehicleCategory.PASSENGER, 0.4),
                Map.of(TimePeriod.MORNING_PEAK, 0.25, TimePeriod.EVENING_PEAK, 0.25,
                        TimePeriod.OFF_PEAK, 0.40, TimePeriod.NIGHT, 0.10),
                Map.of(Scenario.NORMAL, 0.90, Scenario.OVERLOADED, 0.06, Scenario.ANOMALOUS, 0.04));
    }

    /**
     * Builds a distribution from wire names, e.g. {@code {vehicle: {truck: 0.7, passenger: 0.3}}}.
     * Missing dimensions keep their defaults.
     */
    public static TargetDistribution fromWire(Map<String, ? extends Map<String, ? extends Number>> raw) {
        TargetDistribution defaults = defaults();
        if (raw == null) {
            return defaults;
        }
        for (String dimension : raw.keySet()) {
            if (!"vehicle".equals(dimension) && !"time".equals(dimension) && !"scenario".equals(dimension)) {
                throw PipelineException.configuration("Unknown target distribution dimension: " + dimension);
            }
        }
        return new TargetDistribution(
                parse(raw.get("vehicle"), VehicleCategory::fromWireName, defaults.vehicle, VehicleCategory.class),
                parse(raw.get("time"), TimePeriod::fromWireName, defaults.time, TimePeriod.class),
                parse(raw.get("scenario"), Scenario::fromWireName, defaults.scenario, Scenario.class));
    }

    @JsonProperty("vehicle")
    public Map<VehicleCategory, Double> getVehicle() {
        return vehicle;
    }

    @JsonProperty("time")
    public Map<TimePeriod, Double> getTime() {
        return time;
    }

    @JsonProperty("scenario")
    public Map<Scenario, Double> getScenario() {
        return scenario;
    }

    /**
     * Number of category values with a positive target share, across all dimensions.
     */
    public int supportSize() {
        return (int) (vehicle.values().stream().filter(v -> v > 0).count()
                + time.values().stream().filter(v -> v > 0).count()
                + scenario.values().stream().filter(v -> v > 0).count());
    }

    private static <E extends Enum<E>> Map<E, Double> parse(Map<String, ? extends Number> raw,
                                                            Function<String, E> lookup,
                                                            Map<E, Double> fallback,
                                                            Class<E> type) {
        if (raw == null) {
            return fallback;
        }
        Map<E, Double> parsed = new EnumMap<>(type);
        raw.forEach((name, share) -> {
            try {
                parsed.put(lookup.apply(name), share.doubleValue());
            } catch (IllegalArgumentException e) {
                throw PipelineException.configuration(e.getMessage());
            }
        });
        return parsed;
    }

    private static <E extends Enum<E>> Map<E, Double> normalize(String dimension, Map<E, Double> shares, Class<E> type) {
        if (shares == null || shares.isEmpty()) {
            throw PipelineException.configuration("Target distribution for '" + dimension + "' is empty");
        }
        double total = 0;
        for (Map.Entry<E, Double> entry : shares.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw PipelineException.configuration(String.format(
                        "Target share for %s/%s must be non-negative", dimension, entry.getKey()));
            }
            total += entry.getValue();
        }
        if (total <= 0) {
            throw PipelineException.configuration("Target distribution for '" + dimension + "' sums to zero");
        }
        Map<E, Double> normalized = new EnumMap<>(type);
        for (E value : type.getEnumConstants()) {
            normalized.put(value, shares.getOrDefault(value, 0.0) / total);
        }
        return Collections.unmodifiableMap(normalized);
    }
}
