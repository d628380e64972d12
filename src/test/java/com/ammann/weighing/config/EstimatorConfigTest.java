/* (C)2026 */
package com.ammann.weighing.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EstimatorConfigTest {

    @Test
    void defaultsMatchProductTuning() {
        EstimatorConfig config = EstimatorConfig.defaults();

        assertThat(config.azRmsThreshold()).isEqualTo(0.35);
        assertThat(config.rollRmsThreshold()).isEqualTo(2.5);
        assertThat(config.pitchRmsThreshold()).isEqualTo(2.5);
        assertThat(config.azInstantThreshold()).isEqualTo(0.8);
        assertThat(config.rollInstantThreshold()).isEqualTo(6.0);
        assertThat(config.pitchInstantThreshold()).isEqualTo(6.0);
        assertThat(config.gravityFilterAlpha()).isEqualTo(0.92);
        assertThat(config.sampleMassDefault()).isEqualTo(150.0);
        assertThat(config.scaleSampleRateHz()).isEqualTo(5.0);
        assertThat(config.liveWindowSeconds()).isEqualTo(5.0);
        assertThat(config.uncertaintyK()).isEqualTo(2.0);
        assertThat(config.standardGravity()).isEqualTo(9.80665);
        assertThat(config.trimFraction()).isEqualTo(0.10);
    }

    @Test
    void derivedIntervals() {
        EstimatorConfig config = EstimatorConfig.defaults();

        assertThat(config.liveWindowMillis()).isEqualTo(5_000L);
        assertThat(config.scaleSampleIntervalMillis()).isEqualTo(200.0);
    }

    @ParameterizedTest
    @CsvSource({
            "0.89,false",
            "0.90,true",
            "0.95,true",
            "0.98,true",
            "0.99,false"
    })
    void recommendedAlphaRange(double alpha, boolean expected) {
        assertThat(EstimatorConfig.defaults().withGravityFilterAlpha(alpha).isGravityAlphaInRecommendedRange())
                .isEqualTo(expected);
    }

    @Test
    void rejectsStructurallyInvalidValues() {
        assertThatThrownBy(() -> new EstimatorConfig(
                0.35, 2.5, 2.5, 0.8, 6.0, 6.0, 0.92, 150, 0, 5, 2.0, 9.80665, 0.1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("scaleSampleRateHz");
        assertThatThrownBy(() -> new EstimatorConfig(
                0.35, 2.5, 2.5, 0.8, 6.0, 6.0, 0.92, 150, 5, 5, 2.0, 9.80665, 0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("trimFraction");
    }
}
