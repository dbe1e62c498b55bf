package org.carball.gantry.model.condition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse vehicle class derived from the numeric vehicle_type code.
 * Declaration order is the scheduler's tie-break order.
 */
public enum VehicleCategory {
    TRUCK("truck", 11, 16),
    PASSENGER("passenger", 1, 4),
    SPECIAL("special", 21, 26);

    private final String wireName;
    private final int minCode;
    private final int maxCode;

    VehicleCategory(String wireName, int minCode, int maxCode) {
        this.wireName = wireName;
        this.minCode = minCode;
        this.maxCode = maxCode;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public int getMinCode() {
        return minCode;
    }

    public int getMaxCode() {
        return maxCode;
    }

    public boolean contains(long vehicleTypeCode) {
        return vehicleTypeCode >= minCode && vehicleTypeCode <= maxCode;
    }

    public boolean isHeavy() {
        return this != PASSENGER;
    }

    /**
     * Classifies a vehicle_type code, or returns null when the code is outside every range.
     */
    public static VehicleCategory fromCode(long vehicleTypeCode) {
        for (VehicleCategory category : values()) {
            if (category.contains(vehicleTypeCode)) {
                return category;
            }
        }
        return null;
    }

    @JsonCreator
    public static VehicleCategory fromWireName(String name) {
        for (VehicleCategory category : values()) {
            if (category.wireName.equalsIgnoreCase(name) || category.name().equalsIgnoreCase(name)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown vehicle category: " + name);
    }
}
