package org.carball.gantry.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public SynthesisSettings loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        SynthesisSettings.SynthesisSettingsBuilder builder = SynthesisSettings.defaults().toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        SynthesisSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    /**
     * Loads configuration from a specific profile.
     */
    public SynthesisSettings loadProfile(String profileName) {
        try {
            SynthesisProfile profile = SynthesisProfile.fromName(profileName);
            SynthesisSettings settings = profile.buildSettings();
            log.info("Loaded profile '{}': {}", profileName, settings.getConfigurationSummary());
            return settings;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads and applies profile, then overlays with other configuration sources.
     */
    public SynthesisSettings loadConfigurationWithProfile(String profileName, String[] args) {
        SynthesisSettings.SynthesisSettingsBuilder builder = loadProfile(profileName).toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        SynthesisSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded with profile '{}': {}", profileName, settings.getConfigurationSummary());
        return settings;
    }

    private void applyEnvironmentVariables(SynthesisSettings.SynthesisSettingsBuilder builder) {
        applyEnv("GANTRY_SEED", value -> builder.seed(Long.parseLong(value)));
        applyEnv("GANTRY_ACCEPTANCE_THRESHOLD", value -> builder.acceptanceThreshold(Double.parseDouble(value)));
        applyEnv("GANTRY_PARALLELISM", value -> builder.parallelism(Integer.parseInt(value)));
        applyEnv("GANTRY_DEMONSTRATIONS", value -> builder.demonstrationCount(Integer.parseInt(value)));
        applyEnv("GANTRY_CANDIDATE_SETS", value -> builder.candidateSets(Integer.parseInt(value)));
        applyEnv("GANTRY_GLOBAL_TIMEOUT_SECONDS", value -> builder.globalTimeoutSeconds(Long.parseLong(value)));
        applyEnv("GANTRY_ORACLE_TIMEOUT_SECONDS", value -> builder.oracleTimeoutSeconds(Long.parseLong(value)));
        applyEnv("GANTRY_MODEL", builder::model);
        applyEnv("OPENAI_API_KEY", builder::apiKey);
    }

    private void applyEnv(String name, Consumer<String> setter) {
        String value = environment.get(name);
        if (value == null || value.isBlank()) {
            return;
        }
        try {
            setter.accept(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", name, value);
        }
    }

    private void applyCLIArguments(SynthesisSettings.SynthesisSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--synthesis.seed":
                        builder.seed(Long.parseLong(value));
                        break;
                    case "--synthesis.threshold":
                        builder.acceptanceThreshold(Double.parseDouble(value));
                        break;
                    case "--synthesis.max-travel-hours":
                        builder.maxTravelHours(Integer.parseInt(value));
                        break;
                    case "--synthesis.min-travel-minutes":
                        builder.minTravelMinutes(Integer.parseInt(value));
                        break;
                    case "--synthesis.demonstrations":
                        builder.demonstrationCount(Integer.parseInt(value));
                        break;
                    case "--synthesis.candidate-sets":
                        builder.candidateSets(Integer.parseInt(value));
                        break;
                    case "--synthesis.parallelism":
                        builder.parallelism(Integer.parseInt(value));
                        break;
                    case "--synthesis.max-attempts":
                        builder.maxAttemptsPerCondition(Integer.parseInt(value));
                        break;
                    case "--synthesis.attempt-multiplier":
                        builder.attemptMultiplier(Integer.parseInt(value));
                        break;
                    case "--synthesis.global-timeout":
                        builder.globalTimeoutSeconds(Long.parseLong(value));
                        break;
                    case "--synthesis.oracle-timeout":
                        builder.oracleTimeoutSeconds(Long.parseLong(value));
                        break;
                    case "--synthesis.model":
                        builder.model(value);
                        break;
                    case "--synthesis.temperature":
                        builder.temperature(Double.parseDouble(value));
                        break;
                    case "--synthesis.faithfulness-weight":
                        builder.faithfulnessWeight(Double.parseDouble(value));
                        break;
                    case "--synthesis.recovery":
                        builder.recoveryEnabled(Boolean.parseBoolean(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for synthesis configuration options.
     */
    public static String getSynthesisHelp() {
        return """
            Synthesis Configuration Options:

            CLI Arguments:
              --synthesis.seed <num>                Random seed for reproducible runs
              --synthesis.threshold <num>           Acceptance threshold for the sample filter (0-1)
              --synthesis.max-travel-hours <num>    Longest plausible entrance-to-gantry travel time
              --synthesis.min-travel-minutes <num>  Shortest travel time used when repairing timestamps
              --synthesis.demonstrations <num>      Demonstrations per prompt
              --synthesis.candidate-sets <num>      Candidate demonstration sets to vote over
              --synthesis.parallelism <num>         Records decomposed concurrently
              --synthesis.max-attempts <num>        Rejections allowed per condition before it is skipped
              --synthesis.attempt-multiplier <num>  Global attempt bound as a multiple of the count
              --synthesis.global-timeout <sec>      Stop generating after this many seconds (0 = none)
              --synthesis.oracle-timeout <sec>      Timeout for a single oracle call
              --synthesis.model <name>              Chat model used by the oracle
              --synthesis.temperature <num>         Sampling temperature for the oracle
              --synthesis.faithfulness-weight <num> Weight of faithfulness in the direct evaluation
              --synthesis.recovery <true|false>     Re-score rejected records after enhancement

            Environment Variables:
              GANTRY_SEED                           Same as --synthesis.seed
              GANTRY_ACCEPTANCE_THRESHOLD           Same as --synthesis.threshold
              GANTRY_PARALLELISM                    Same as --synthesis.parallelism
              GANTRY_DEMONSTRATIONS                 Same as --synthesis.demonstrations
              GANTRY_CANDIDATE_SETS                 Same as --synthesis.candidate-sets
              GANTRY_GLOBAL_TIMEOUT_SECONDS         Same as --synthesis.global-timeout
              GANTRY_ORACLE_TIMEOUT_SECONDS         Same as --synthesis.oracle-timeout
              GANTRY_MODEL                          Same as --synthesis.model
              OPENAI_API_KEY                        OpenAI API key for the oracle

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Profile defaults or built-in defaults
            """;
    }
}
