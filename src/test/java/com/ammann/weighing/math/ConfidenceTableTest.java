/* (C)2026 */
package com.ammann.weighing.math;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ConfidenceTableTest {

    @ParameterizedTest
    @CsvSource({
            "2,12.706",
            "3,4.303",
            "5,2.776",
            "11,2.228",
            "13,2.179",
            "31,2.042",
            "101,1.960",
            "500,1.960"
    })
    void returnsTabulatedValues(int n, double expected) {
        assertThat(ConfidenceTable.kFromN(n)).isCloseTo(expected, within(1e-9));
    }

    @Test
    void fallsBackToTwoForSingleOrNoSample() {
        assertThat(ConfidenceTable.kFromN(1)).isEqualTo(2.0);
        assertThat(ConfidenceTable.kFromN(0)).isEqualTo(2.0);
    }

    @Test
    void interpolatesBetweenTabulatedDegreesOfFreedom() {
        // df = 11 lies halfway between 10 (2.228) and 12 (2.179)
        assertThat(ConfidenceTable.kFromN(12)).isCloseTo(2.2035, within(1e-9));
        // df = 65 lies halfway between 30 (2.042) and 100 (1.960)
        assertThat(ConfidenceTable.kFromN(66)).isCloseTo(2.001, within(1e-9));
    }

    @Test
    void isMonotonicallyNonIncreasingFromTwoSamples() {
        double previous = Double.MAX_VALUE;
        for (int n = 2; n <= 150; n++) {
            double k = ConfidenceTable.kFromN(n);
            assertThat(k).isLessThanOrEqualTo(previous).isGreaterThanOrEqualTo(1.96);
            previous = k;
        }
    }

    @Test
    void effectiveNIsTheSmallerCount() {
        assertThat(ConfidenceTable.effectiveN(8, 3)).isEqualTo(3);
        assertThat(ConfidenceTable.effectiveN(2, 9)).isEqualTo(2);
    }
}
