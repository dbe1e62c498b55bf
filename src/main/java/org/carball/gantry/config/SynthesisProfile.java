package org.carball.gantry.config;

import lombok.Getter;

@Getter
public enum SynthesisProfile {

    BALANCED("balanced", "Balanced quality and throughput - default settings",
            0.8, 3, 1, 0.5),

    STRICT("strict", "Higher acceptance bar and more demonstrations, slower",
            0.9, 5, 3, 0.7) {
        @Override
        public SynthesisSettings buildSettings() {
            return super.buildSettings().toBuilder()
                    .maxAttemptsPerCondition(8)
                    .feedbackThreshold(0.98)
                    .build();
        }
    },

    FAST("fast", "Single demonstration set, no recovery, for quick runs",
            0.7, 2, 1, 0.5) {
        @Override
        public SynthesisSettings buildSettings() {
            return super.buildSettings().toBuilder()
                    .recoveryEnabled(false)
                    .parallelism(8)
                    .attemptMultiplier(3)
                    .diversityPairSample(100)
                    .build();
        }
    },

    EXPLORATORY("exploratory", "Favours diversity: higher temperature, diversity-weighted evaluation",
            0.75, 3, 2, 0.3) {
        @Override
        public SynthesisSettings buildSettings() {
            return super.buildSettings().toBuilder()
                    .temperature(1.0)
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final double acceptanceThreshold;
    private final int demonstrationCount;
    private final int candidateSets;
    private final double faithfulnessWeight;

    SynthesisProfile(String name, String description, double acceptanceThreshold,
                     int demonstrationCount, int candidateSets, double faithfulnessWeight) {
        this.name = name;
        this.description = description;
        this.acceptanceThreshold = acceptanceThreshold;
        this.demonstrationCount = demonstrationCount;
        this.candidateSets = candidateSets;
        this.faithfulnessWeight = faithfulnessWeight;
    }

    /**
     * Creates SynthesisSettings based on this profile's values.
     */
    public SynthesisSettings buildSettings() {
        return SynthesisSettings.builder()
                .profileName(name)
                .profileDescription(description)
                .acceptanceThreshold(acceptanceThreshold)
                .demonstrationCount(demonstrationCount)
                .candidateSets(candidateSets)
                .faithfulnessWeight(faithfulnessWeight)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static SynthesisProfile fromName(String name) {
        for (SynthesisProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown synthesis profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (SynthesisProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Synthesis Profiles:\n\n");
        for (SynthesisProfile profile : values()) {
            help.append(String.format("  %-14s %s\n", profile.getName(), profile.getDescription()));
        }
        help.append("\nUse --profile <name> to select a profile.\n");
        return help.toString();
    }
}
