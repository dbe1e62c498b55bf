package org.carball.gantry.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.gantry.FailureKind;
import org.carball.gantry.PipelineException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SynthesisSettingsTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(SynthesisSettings.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldCreateDefaultSettings() {
        // When
        SynthesisSettings settings = SynthesisSettings.defaults();

        // Then
        assertThat(settings.getSeed()).isEqualTo(42L);
        assertThat(settings.getAcceptanceThreshold()).isEqualTo(0.8);
        assertThat(settings.getDemonstrationCount()).isEqualTo(3);
        assertThat(settings.getCandidateSets()).isEqualTo(1);
        assertThat(settings.getParallelism()).isEqualTo(4);
        assertThat(settings.isRecoveryEnabled()).isTrue();
        assertThat(settings.maxTravel()).isEqualTo(Duration.ofHours(6));
        assertThat(settings.minTravel()).isEqualTo(Duration.ofMinutes(30));
        assertThat(settings.oracleTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.getProfileName()).isEqualTo("default");
    }

    @Test
    void shouldValidateDefaultsWithoutWarnings() {
        // When
        SynthesisSettings.defaults().validate();

        // Then
        List<ILoggingEvent> logs = logAppender.list;
        assertThat(logs).hasSize(1);
        assertThat(logs.get(0).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(logs.get(0).getFormattedMessage()).contains("Using settings");
    }

    @Test
    void shouldWarnAboutQuestionableSettings() {
        // Given
        SynthesisSettings settings = SynthesisSettings.builder()
                .acceptanceThreshold(0.4)
                .demonstrationCount(0)
                .temperature(2.5)
                .build();

        // When
        settings.validate();

        // Then
        List<ILoggingEvent> warnings = logAppender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .toList();
        assertThat(warnings).extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(message -> assertThat(message).contains("Acceptance threshold (0.4) is low"))
                .anySatisfy(message -> assertThat(message).contains("disables few-shot prompting"))
                .anySatisfy(message -> assertThat(message).contains("Temperature (2.5)"));
    }

    @Test
    void shouldRejectThresholdOutsideUnitInterval() {
        SynthesisSettings settings = SynthesisSettings.builder().acceptanceThreshold(1.5).build();

        assertThatThrownBy(settings::validate)
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("Acceptance threshold")
                .satisfies(e -> assertThat(((PipelineException) e).getKind()).isEqualTo(FailureKind.CONFIGURATION));
    }

    @Test
    void shouldRejectUnusableBounds() {
        assertThatThrownBy(() -> SynthesisSettings.builder().parallelism(0).build().validate())
                .isInstanceOf(PipelineException.class);
        assertThatThrownBy(() -> SynthesisSettings.builder().maxAttemptsPerCondition(0).build().validate())
                .isInstanceOf(PipelineException.class);
        assertThatThrownBy(() -> SynthesisSettings.builder().maxTravelHours(0).build().validate())
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("Travel window is empty");
    }

    @Test
    void shouldSummarizeConfigurationWithoutApiKey() {
        // Given
        SynthesisSettings settings = SynthesisSettings.builder().apiKey("sk-secret").build();

        // When/Then
        assertThat(settings.getConfigurationSummary())
                .isEqualTo("Profile: default | Threshold: 0.80 | Demos: 3 x 1 | Parallelism: 4 | Seed: 42 | Model: gpt-4");
        assertThat(settings.toString()).doesNotContain("sk-secret");
    }
}
