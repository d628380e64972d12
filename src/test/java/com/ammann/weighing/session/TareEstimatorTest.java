/* (C)2026 */
package com.ammann.weighing.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.weighing.enumeration.TareMethod;
import com.ammann.weighing.exception.ValidationException;
import com.ammann.weighing.model.TareEstimate;
import com.ammann.weighing.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TareEstimatorTest {

    private TareEstimator estimator;

    @BeforeEach
    void setUp() {
        estimator = new TareEstimator(new MutableClock(0L));
    }

    @Test
    void noSamplesGiveZeroEstimate() {
        assertThat(estimator.estimate()).isEqualTo(TareEstimate.NONE);
    }

    @Test
    void singleSampleHasNoUncertainty() {
        estimator.addTareSample(10.0);

        TareEstimate estimate = estimator.estimate();

        assertThat(estimate.count()).isEqualTo(1);
        assertThat(estimate.biasMedian()).isEqualTo(10.0);
        assertThat(estimate.tareUncertainty95()).isZero();
        assertThat(estimate.tareSigma()).isZero();
    }

    @Test
    void halfRangeEstimatorUsesMedianAndSpread() {
        estimator.addTareSample(10.0);
        estimator.addTareSample(14.0);
        estimator.addTareSample(12.0);

        TareEstimate estimate = estimator.estimate();

        assertThat(estimate.biasMedian()).isEqualTo(12.0);
        assertThat(estimate.tareUncertainty95()).isEqualTo(2.0);
        assertThat(estimate.tareSigma()).isEqualTo(1.0);
        assertThat(estimate.method()).isEqualTo(TareMethod.HALF_RANGE);
    }

    @Test
    void zeroReadingIsAccepted() {
        estimator.addTareSample(0.0);

        assertThat(estimator.count()).isEqualTo(1);
    }

    @Test
    void rejectsNegativeAndNaNReadings() {
        assertThatThrownBy(() -> estimator.addTareSample(-0.1)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> estimator.addTareSample(Double.NaN)).isInstanceOf(ValidationException.class);
        assertThat(estimator.count()).isZero();
    }

    @Test
    void removeOutOfRangeIsNoOp() {
        estimator.addTareSample(1.0);
        estimator.addTareSample(2.0);

        estimator.removeTareSample(5);
        estimator.removeTareSample(-1);
        assertThat(estimator.count()).isEqualTo(2);

        estimator.removeTareSample(0);
        assertThat(estimator.samples()).singleElement().extracting(s -> s.reading()).isEqualTo(2.0);
    }

    @Test
    void manualEstimateIsTaggedUserEntered() {
        TareEstimate estimate = TareEstimator.manualEstimate(1.5, 0.4);

        assertThat(estimate.count()).isZero();
        assertThat(estimate.biasMedian()).isEqualTo(1.5);
        assertThat(estimate.tareSigma()).isEqualTo(0.2);
        assertThat(estimate.method()).isEqualTo(TareMethod.USER_ENTERED);
        assertThatThrownBy(() -> TareEstimator.manualEstimate(1.0, -1.0))
                .isInstanceOf(ValidationException.class);
    }
}
