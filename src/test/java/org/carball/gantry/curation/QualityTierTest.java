package org.carball.gantry.curation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class QualityTierTest {

    @Test
    void shouldKeepBothBoundariesInMediumTier() {
        assertThat(QualityTier.fromWeight(1.2)).isEqualTo(QualityTier.MEDIUM);
        assertThat(QualityTier.fromWeight(0.8)).isEqualTo(QualityTier.MEDIUM);
    }

    @Test
    void shouldSplitAroundBoundaries() {
        assertThat(QualityTier.fromWeight(1.21)).isEqualTo(QualityTier.HIGH);
        assertThat(QualityTier.fromWeight(0.79999)).isEqualTo(QualityTier.LOW);
        assertThat(QualityTier.fromWeight(0.0)).isEqualTo(QualityTier.LOW);
        assertThat(QualityTier.fromWeight(2.0)).isEqualTo(QualityTier.HIGH);
    }
}
