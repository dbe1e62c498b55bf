package org.carball.gantry.model.condition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TimePeriod {
    MORNING_PEAK("morning_peak", "07:00-09:00"),
    EVENING_PEAK("evening_peak", "17:00-19:00"),
    OFF_PEAK("off_peak", "09:00-17:00"),
    NIGHT("night", "23:00-05:00");

    private static final int MORNING_START = 7;
    private static final int MORNING_END = 9;
    private static final int EVENING_START = 17;
    private static final int EVENING_END = 19;
    private static final int NIGHT_START = 23;
    private static final int NIGHT_END = 5;

    private final String wireName;
    private final String window;

    TimePeriod(String wireName, String window) {
        this.wireName = wireName;
        this.window = window;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Human readable clock window, used in prompts.
     */
    public String getWindow() {
        return window;
    }

    public static TimePeriod fromHour(int hour) {
        if (hour >= MORNING_START && hour < MORNING_END) {
            return MORNING_PEAK;
        } else if (hour >= EVENING_START && hour < EVENING_END) {
            return EVENING_PEAK;
        } else if (hour >= NIGHT_START || hour < NIGHT_END) {
            return NIGHT;
        } else {
            return OFF_PEAK;
        }
    }

    @JsonCreator
    public static TimePeriod fromWireName(String name) {
        for (TimePeriod period : values()) {
            if (period.wireName.equalsIgnoreCase(name) || period.name().equalsIgnoreCase(name)) {
                return period;
            }
        }
        throw new IllegalArgumentException("Unknown time period: " + name);
    }
}
