package org.carball.gantry.model.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Summary of one numeric field: population standard deviation, as used throughout scoring.
 */
public record FieldStatistics(
        @JsonProperty("mean") double mean,
        @JsonProperty("std") double std,
        @JsonProperty("min") double min,
        @JsonProperty("max") double max,
        @JsonProperty("count") int count
) {

    public static FieldStatistics of(List<? extends Number> values) {
        if (values.isEmpty()) {
            return new FieldStatistics(0, 0, 0, 0, 0);
        }
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Number value : values) {
            double v = value.doubleValue();
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / values.size();
        double squares = 0;
        for (Number value : values) {
            double delta = value.doubleValue() - mean;
            squares += delta * delta;
        }
        return new FieldStatistics(mean, Math.sqrt(squares / values.size()), min, max, values.size());
    }

    /**
     * Coefficient of variation, or 0 for a zero mean.
     */
    public double variation() {
        return mean == 0 ? 0 : std / Math.abs(mean);
    }
}
