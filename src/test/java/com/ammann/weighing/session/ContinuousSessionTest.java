/* (C)2026 */
package com.ammann.weighing.session;

import static com.ammann.weighing.support.TestDataFactory.processed;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.weighing.config.EstimatorConfig;
import com.ammann.weighing.model.SessionData;
import com.ammann.weighing.model.SessionProgress;
import com.ammann.weighing.model.SessionSample;
import com.ammann.weighing.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContinuousSessionTest {

    private MutableClock clock;
    private double scaleValue;
    private ContinuousSession session;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(10_000L);
        scaleValue = 100.0;
        session = new ContinuousSession(() -> scaleValue, EstimatorConfig.defaults(), clock);
    }

    @Test
    void samplesAreIgnoredWhileIdle() {
        session.addSample(processed(0.0, 0.0, 0.0, 1L));

        assertThat(session.progress()).isEqualTo(SessionProgress.IDLE);
        assertThat(session.stop().isEmpty()).isTrue();
    }

    @Test
    void scaleIsPolledAtConfiguredCadenceAndHeldBetweenPolls() {
        session.start();

        session.addSample(processed(0.0, 0.0, 0.0, 1L));
        scaleValue = 200.0;
        clock.advance(100);
        session.addSample(processed(0.0, 0.0, 0.0, 2L));
        clock.advance(100);
        session.addSample(processed(0.0, 0.0, 0.0, 3L));

        SessionData data = session.stop();
        assertThat(data.samples())
                .extracting(SessionSample::scaleReading)
                .containsExactly(100.0, 100.0, 200.0);
    }

    @Test
    void flagsSamplesAgainstInstantaneousThresholds() {
        session.start();

        session.addSample(processed(0.5, 5.0, -5.0, 1L));
        session.addSample(processed(0.9, 0.0, 0.0, 2L));
        session.addSample(processed(0.0, -6.5, 0.0, 3L));
        session.addSample(processed(0.0, 0.0, 6.0, 4L));

        SessionData data = session.stop();
        assertThat(data.samples())
                .extracting(SessionSample::good)
                .containsExactly(true, false, false, false);
        assertThat(data.percentGood()).isEqualTo(25.0);
    }

    @Test
    void stopSummarizesSession() {
        session.start();
        session.addSample(processed(3.0, 4.0, 0.0, 1L));
        session.addSample(processed(-3.0, -4.0, 0.0, 2L));
        clock.advance(2_500);

        SessionData data = session.stop();

        assertThat(data.rmsVerticalAcceleration()).isCloseTo(3.0, within(1e-12));
        assertThat(data.rmsRoll()).isCloseTo(4.0, within(1e-12));
        assertThat(data.rmsPitch()).isZero();
        assertThat(data.durationSeconds()).isEqualTo(2.5);
        assertThat(data.startTime()).isEqualTo(10_000L);
        assertThat(session.isActive()).isFalse();
    }

    @Test
    void progressTracksElapsedTimeAndCounts() {
        session.start();
        session.addSample(processed(0.0, 0.0, 0.0, 1L));
        session.addSample(processed(2.0, 0.0, 0.0, 2L));
        clock.advance(1_500);

        SessionProgress progress = session.progress();

        assertThat(progress.active()).isTrue();
        assertThat(progress.elapsedSeconds()).isEqualTo(1.5);
        assertThat(progress.sampleCount()).isEqualTo(2);
        assertThat(progress.goodCount()).isEqualTo(1);
    }

    @Test
    void resetDropsSamplesButKeepsSessionRunning() {
        session.start();
        session.addSample(processed(0.0, 0.0, 0.0, 1L));

        session.reset();

        assertThat(session.isActive()).isTrue();
        assertThat(session.progress().sampleCount()).isZero();
    }

    @Test
    void secondStartWhileActiveIsIgnored() {
        session.start();
        session.addSample(processed(0.0, 0.0, 0.0, 1L));

        session.start();

        assertThat(session.progress().sampleCount()).isEqualTo(1);
    }

    @Test
    void runningSessionKeepsConfigurationItStartedWith() {
        EstimatorConfig loose = new EstimatorConfig(
                0.35, 2.5, 2.5, 2.0, 6.0, 6.0, 0.92, 150, 5, 5, 2.0, EstimatorConfig.STANDARD_GRAVITY, 0.1);
        session.start();

        session.updateConfig(loose);
        session.addSample(processed(1.0, 0.0, 0.0, 1L));
        SessionData first = session.stop();

        session.start();
        session.addSample(processed(1.0, 0.0, 0.0, 2L));
        SessionData second = session.stop();

        assertThat(first.samples().get(0).good()).isFalse();
        assertThat(second.samples().get(0).good()).isTrue();
        assertThat(session.activeConfig()).isSameAs(loose);
    }
}
