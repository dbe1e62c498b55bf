package org.carball.gantry.curation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QualityTier {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    static final double HIGH_ABOVE = 1.2;
    static final double LOW_BELOW = 0.8;

    private final String wireName;

    QualityTier(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Both boundaries, 0.8 and 1.2, belong to the medium tier.
     */
    public static QualityTier fromWeight(double weight) {
        if (weight > HIGH_ABOVE) {
            return HIGH;
        } else if (weight >= LOW_BELOW) {
            return MEDIUM;
        } else {
            return LOW;
        }
    }
}
