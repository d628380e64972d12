/* (C)2026 */
package com.ammann.weighing.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.weighing.dto.ConfigOverrideDTO;
import com.ammann.weighing.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EstimatorConfigRegistryTest {

    private EstimatorConfigRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new EstimatorConfigRegistry();
        registry.init();
    }

    private static ConfigOverrideDTO alphaAndTrim(Double alpha, Double trim) {
        return new ConfigOverrideDTO(
                null, null, null, null, null, null, alpha, null, null, null, null, null, trim);
    }

    @Test
    void startsWithDefaultsWithoutStartupConfig() {
        assertThat(registry.current()).isEqualTo(EstimatorConfig.defaults());
    }

    @Test
    void partialUpdateKeepsOtherFields() {
        EstimatorConfig before = registry.current();

        EstimatorConfig updated = registry.update(alphaAndTrim(0.95, null));

        assertThat(updated.gravityFilterAlpha()).isEqualTo(0.95);
        assertThat(updated.trimFraction()).isEqualTo(before.trimFraction());
        assertThat(updated.azRmsThreshold()).isEqualTo(before.azRmsThreshold());
        assertThat(registry.current()).isSameAs(updated);
    }

    @Test
    void invalidUpdateLeavesSnapshotUntouched() {
        EstimatorConfig before = registry.current();

        assertThatThrownBy(() -> registry.update(alphaAndTrim(null, 0.6)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("trimFraction");
        assertThat(registry.current()).isSameAs(before);
    }

    @Test
    void resetRestoresStartupSnapshot() {
        EstimatorConfig startup = EstimatorConfig.defaults().withGravityFilterAlpha(0.9);
        registry.startupConfig = startup;
        registry.init();
        registry.update(alphaAndTrim(0.97, 0.2));

        assertThat(registry.reset()).isSameAs(startup);
    }
}
