package org.carball.gantry.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.PipelineException;

import java.time.Duration;

@Data
@Builder(toBuilder = true)
@Slf4j
public class SynthesisSettings {

    @Builder.Default
    private long seed = 42L;

    // Curation
    @Builder.Default
    private double acceptanceThreshold = 0.8;

    @Builder.Default
    private int maxTravelHours = 6;

    @Builder.Default
    private int minTravelMinutes = 30;

    @Builder.Default
    private boolean recoveryEnabled = true;

    // Demonstrations
    @Builder.Default
    private int demonstrationCount = 3;

    @Builder.Default
    private int candidateSets = 1;

    @Builder.Default
    private int feedbackPoolSize = 20;

    @Builder.Default
    private double feedbackThreshold = 0.95;

    // Generation loop
    @Builder.Default
    private int parallelism = 4;

    @Builder.Default
    private int maxAttemptsPerCondition = 5;

    @Builder.Default
    private int attemptMultiplier = 5;

    /** Zero disables the global timeout. */
    @Builder.Default
    private long globalTimeoutSeconds = 0;

    // Oracle
    @Builder.Default
    private long oracleTimeoutSeconds = 30;

    @Builder.Default
    private String model = "gpt-4";

    @Builder.Default
    private double temperature = 0.7;

    @Builder.Default
    private int maxTokens = 500;

    @ToString.Exclude
    private String apiKey;

    // Evaluation
    @Builder.Default
    private double faithfulnessWeight = 0.5;

    @Builder.Default
    private int diversityPairSample = 200;

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default balanced settings";

    /**
     * Creates default settings suitable for most runs.
     */
    public static SynthesisSettings defaults() {
        return SynthesisSettings.builder()
                .profileName("default")
                .profileDescription("Default balanced settings")
                .build();
    }

    public Duration maxTravel() {
        return Duration.ofHours(maxTravelHours);
    }

    public Duration minTravel() {
        return Duration.ofMinutes(minTravelMinutes);
    }

    public Duration oracleTimeout() {
        return Duration.ofSeconds(oracleTimeoutSeconds);
    }

    /**
     * Rejects settings the pipeline cannot run with and logs warnings for merely questionable ones.
     */
    public void validate() {
        if (acceptanceThreshold < 0 || acceptanceThreshold > 1) {
            throw PipelineException.configuration(
                    "Acceptance threshold must be within [0, 1], got " + acceptanceThreshold);
        }
        if (parallelism < 1) {
            throw PipelineException.configuration("Parallelism must be at least 1, got " + parallelism);
        }
        if (maxAttemptsPerCondition < 1 || attemptMultiplier < 1) {
            throw PipelineException.configuration(String.format(
                    "Attempt bounds must be positive (per condition %d, multiplier %d)",
                    maxAttemptsPerCondition, attemptMultiplier));
        }
        if (faithfulnessWeight < 0 || faithfulnessWeight > 1) {
            throw PipelineException.configuration(
                    "Faithfulness weight must be within [0, 1], got " + faithfulnessWeight);
        }
        if (minTravelMinutes <= 0 || maxTravelHours * 60L <= minTravelMinutes) {
            throw PipelineException.configuration(String.format(
                    "Travel window is empty (min %d minutes, max %d hours)", minTravelMinutes, maxTravelHours));
        }

        if (acceptanceThreshold < 0.5) {
            log.warn("Acceptance threshold ({}) is low; most generated records will be accepted", acceptanceThreshold);
        }
        if (demonstrationCount < 1) {
            log.warn("Demonstration count ({}) disables few-shot prompting", demonstrationCount);
        }
        if (candidateSets < 1) {
            log.warn("Candidate set count ({}) should be at least 1; using 1", candidateSets);
        }
        if (feedbackThreshold < acceptanceThreshold) {
            log.warn("Feedback threshold ({}) is below the acceptance threshold ({}); every accepted record feeds back",
                    feedbackThreshold, acceptanceThreshold);
        }
        if (temperature < 0 || temperature > 2) {
            log.warn("Temperature ({}) is outside the usual [0, 2] range", temperature);
        }
        if (oracleTimeoutSeconds <= 0) {
            log.warn("Oracle timeout ({}s) is not positive; every oracle call will time out", oracleTimeoutSeconds);
        }

        log.debug("Using settings - Threshold: {}, Parallelism: {}, Seed: {}, Profile: {}",
                acceptanceThreshold, parallelism, seed, profileName);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Profile: %s | Threshold: %.2f | Demos: %d x %d | Parallelism: %d | Seed: %d | Model: %s",
                profileName, acceptanceThreshold, demonstrationCount, Math.max(candidateSets, 1),
                parallelism, seed, model);
    }
}
