package org.carball.gantry.model.condition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Scenario {
    NORMAL("normal"),
    OVERLOADED("overloaded"),
    ANOMALOUS("anomalous");

    private final String wireName;

    Scenario(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isIrregular() {
        return this != NORMAL;
    }

    @JsonCreator
    public static Scenario fromWireName(String name) {
        for (Scenario scenario : values()) {
            if (scenario.wireName.equalsIgnoreCase(name) || scenario.name().equalsIgnoreCase(name)) {
                return scenario;
            }
        }
        throw new IllegalArgumentException("Unknown scenario: " + name);
    }
}
