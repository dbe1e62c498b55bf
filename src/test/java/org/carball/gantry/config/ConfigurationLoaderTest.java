package org.carball.gantry.config;

import org.carball.gantry.PipelineException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        SynthesisSettings settings = new ConfigurationLoader(Map.of()).loadConfiguration(new String[0]);

        // Then
        assertThat(settings.getSeed()).isEqualTo(42L);
        assertThat(settings.getAcceptanceThreshold()).isEqualTo(0.8);
        assertThat(settings.getProfileName()).isEqualTo("default");
    }

    @Test
    void shouldParseCLIArguments() {
        // Given
        String[] args = {
                "--training-file", "pool.json",
                "--synthesis.seed", "7",
                "--synthesis.threshold", "0.85",
                "--synthesis.demonstrations", "4",
                "--synthesis.candidate-sets", "3",
                "--synthesis.parallelism", "2",
                "--synthesis.max-attempts", "6",
                "--synthesis.attempt-multiplier", "4",
                "--synthesis.global-timeout", "120",
                "--synthesis.oracle-timeout", "10",
                "--synthesis.model", "gpt-4o-mini",
                "--synthesis.temperature", "0.2",
                "--synthesis.faithfulness-weight", "0.6",
                "--synthesis.max-travel-hours", "8",
                "--synthesis.min-travel-minutes", "20",
                "--synthesis.recovery", "false"
        };

        // When
        SynthesisSettings settings = new ConfigurationLoader(Map.of()).loadConfiguration(args);

        // Then
        assertThat(settings.getSeed()).isEqualTo(7L);
        assertThat(settings.getAcceptanceThreshold()).isEqualTo(0.85);
        assertThat(settings.getDemonstrationCount()).isEqualTo(4);
        assertThat(settings.getCandidateSets()).isEqualTo(3);
        assertThat(settings.getParallelism()).isEqualTo(2);
        assertThat(settings.getMaxAttemptsPerCondition()).isEqualTo(6);
        assertThat(settings.getAttemptMultiplier()).isEqualTo(4);
        assertThat(settings.getGlobalTimeoutSeconds()).isEqualTo(120);
        assertThat(settings.getOracleTimeoutSeconds()).isEqualTo(10);
        assertThat(settings.getModel()).isEqualTo("gpt-4o-mini");
        assertThat(settings.getTemperature()).isEqualTo(0.2);
        assertThat(settings.getFaithfulnessWeight()).isEqualTo(0.6);
        assertThat(settings.getMaxTravelHours()).isEqualTo(8);
        assertThat(settings.getMinTravelMinutes()).isEqualTo(20);
        assertThat(settings.isRecoveryEnabled()).isFalse();
    }

    @Test
    void shouldReadEnvironmentVariables() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of(
                "GANTRY_SEED", "99",
                "GANTRY_PARALLELISM", "6",
                "GANTRY_MODEL", "gpt-3.5-turbo",
                "OPENAI_API_KEY", "sk-test"));

        // When
        SynthesisSettings settings = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(settings.getSeed()).isEqualTo(99L);
        assertThat(settings.getParallelism()).isEqualTo(6);
        assertThat(settings.getModel()).isEqualTo("gpt-3.5-turbo");
        assertThat(settings.getApiKey()).isEqualTo("sk-test");
    }

    @Test
    void shouldPreferCLIOverEnvironment() {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of("GANTRY_SEED", "99"));

        SynthesisSettings settings = loader.loadConfiguration(new String[]{"--synthesis.seed", "5"});

        assertThat(settings.getSeed()).isEqualTo(5L);
    }

    @Test
    void shouldIgnoreInvalidNumbers() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of("GANTRY_PARALLELISM", "many"));

        // When
        SynthesisSettings settings = loader.loadConfiguration(new String[]{"--synthesis.threshold", "high"});

        // Then
        assertThat(settings.getParallelism()).isEqualTo(4);
        assertThat(settings.getAcceptanceThreshold()).isEqualTo(0.8);
    }

    @Test
    void shouldApplyProfileWithOverrides() {
        // Given
        String[] args = {"--synthesis.threshold", "0.95"};

        // When
        SynthesisSettings settings = new ConfigurationLoader(Map.of("GANTRY_DEMONSTRATIONS", "6"))
                .loadConfigurationWithProfile("strict", args);

        // Then - CLI > env vars > profile > defaults
        assertThat(settings.getAcceptanceThreshold()).isEqualTo(0.95);
        assertThat(settings.getDemonstrationCount()).isEqualTo(6);
        assertThat(settings.getCandidateSets()).isEqualTo(3);
        assertThat(settings.getMaxAttemptsPerCondition()).isEqualTo(8);
        assertThat(settings.getProfileName()).isEqualTo("strict");
    }

    @Test
    void shouldThrowExceptionForUnknownProfile() {
        assertThatThrownBy(() -> new ConfigurationLoader(Map.of()).loadProfile("nonexistent"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown synthesis profile: nonexistent");
    }

    @Test
    void shouldRejectInvalidOverride() {
        assertThatThrownBy(() -> new ConfigurationLoader(Map.of())
                .loadConfiguration(new String[]{"--synthesis.parallelism", "0"}))
                .isInstanceOf(PipelineException.class);
    }

    @Test
    void shouldDocumentEveryOption() {
        assertThat(ConfigurationLoader.getSynthesisHelp())
                .contains("--synthesis.seed")
                .contains("--synthesis.recovery")
                .contains("GANTRY_PARALLELISM")
                .contains("OPENAI_API_KEY");
    }
}
