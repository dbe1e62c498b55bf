package org.carball.gantry.model.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.carball.gantry.model.condition.VehicleCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per vehicle category numeric summaries and fee-vs-mileage correlation, learned once from the
 * training pool and read-only afterwards.
 */
public final class LearnedStatistics {

    private static final LearnedStatistics EMPTY = new LearnedStatistics(Map.of(), Map.of());

    private final Map<VehicleCategory, Map<String, FieldStatistics>> byCategory;
    private final Map<VehicleCategory, Double> feeMileageCorrelation;

    public LearnedStatistics(Map<VehicleCategory, Map<String, FieldStatistics>> byCategory,
                             Map<VehicleCategory, Double> feeMileageCorrelation) {
        Map<VehicleCategory, Map<String, FieldStatistics>> copy = new EnumMap<>(VehicleCategory.class);
        byCategory.forEach((category, fields) ->
                copy.put(category, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
        this.byCategory = Collections.unmodifiableMap(copy);
        Map<VehicleCategory, Double> correlations = new EnumMap<>(VehicleCategory.class);
        correlations.putAll(feeMileageCorrelation);
        this.feeMileageCorrelation = Collections.unmodifiableMap(correlations);
    }

    public static LearnedStatistics empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return byCategory.isEmpty();
    }

    public boolean hasCategory(VehicleCategory category) {
        return category != null && byCategory.containsKey(category);
    }

    /**
     * Returns the summary of a field for a category, or null when it was not learned.
     */
    public FieldStatistics get(VehicleCategory category, String field) {
        if (category == null) {
            return null;
        }
        Map<String, FieldStatistics> fields = byCategory.get(category);
        return fields == null ? null : fields.get(field);
    }

    public double correlation(VehicleCategory category) {
        return feeMileageCorrelation.getOrDefault(category, 0.0);
    }

    /**
     * Learned fee per meter (pay_fee mean over fee_mileage mean), or NaN when unknown.
     */
    public double feeRate(VehicleCategory category) {
        FieldStatistics fee = get(category, "pay_fee");
        FieldStatistics mileage = get(category, "fee_mileage");
        if (fee == null || mileage == null || mileage.mean() <= 0) {
            return Double.NaN;
        }
        return fee.mean() / mileage.mean();
    }

    @JsonProperty("by_category")
    public Map<VehicleCategory, Map<String, FieldStatistics>> getByCategory() {
        return byCategory;
    }

    @JsonProperty("fee_mileage_correlation")
    public Map<VehicleCategory, Double> getFeeMileageCorrelation() {
        return feeMileageCorrelation;
    }
}
