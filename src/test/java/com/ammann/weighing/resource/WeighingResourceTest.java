/* (C)2026 */
package com.ammann.weighing.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.weighing.config.ConfigTestSupport;
import com.ammann.weighing.dto.ManualTareRequestDTO;
import com.ammann.weighing.dto.MeasurementRequestDTO;
import com.ammann.weighing.dto.ReadingRequestDTO;
import com.ammann.weighing.enumeration.TareMethod;
import com.ammann.weighing.exception.ValidationException;
import com.ammann.weighing.model.LiveMetrics;
import com.ammann.weighing.model.ManualMeasurement;
import com.ammann.weighing.model.RatioResult;
import com.ammann.weighing.model.SessionResult;
import com.ammann.weighing.model.TareEstimate;
import com.ammann.weighing.service.ManualWeighingService;
import com.ammann.weighing.service.MotionMeasurementService;
import com.ammann.weighing.service.ServiceTestSupport;
import com.ammann.weighing.support.MutableClock;
import jakarta.ws.rs.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WeighingResourceTest {

    private MotionMeasurementService motionService;
    private WeighingResource resource;

    @BeforeEach
    void setUp() {
        ManualWeighingService weighingService =
                ServiceTestSupport.manualService(ConfigTestSupport.defaultRegistry(), null, new MutableClock(0L));

        motionService = mock(MotionMeasurementService.class);

        resource = new WeighingResource();
        resource.weighingService = weighingService;
        resource.motionService = motionService;
    }

    private void weigh(String kind, double... readings) {
        resource.startSession(kind);
        for (double r : readings) {
            resource.addMeasurement(kind, new MeasurementRequestDTO(r, null, null));
        }
        resource.stopSession(kind);
    }

    @Test
    void tareEndpointsMaintainEstimate() {
        resource.addTareSample(new ReadingRequestDTO(1.0));
        TareEstimate afterSecond = (TareEstimate) resource.addTareSample(new ReadingRequestDTO(3.0)).getEntity();
        TareEstimate afterRemove = (TareEstimate) resource.removeTareSample(0).getEntity();

        assertThat(afterSecond.biasMedian()).isEqualTo(2.0);
        assertThat(afterRemove.biasMedian()).isEqualTo(3.0);

        TareEstimate manual = (TareEstimate) resource.enterManualTare(new ManualTareRequestDTO(0.5, null)).getEntity();
        assertThat(manual.method()).isEqualTo(TareMethod.USER_ENTERED);
        assertThat(manual.tareUncertainty95()).isZero();

        assertThat(resource.clearManualTare().getStatus()).isEqualTo(204);
        assertThat(resource.clearTareSamples().getStatus()).isEqualTo(204);
        assertThat(resource.getTareEstimate().getEntity()).isEqualTo(TareEstimate.NONE);
    }

    @Test
    void sessionKindIsCaseInsensitive() {
        resource.enterManualTare(new ManualTareRequestDTO(2.0, 0.2));

        TareEstimate locked = (TareEstimate) resource.startSession("Base").getEntity();
        ManualMeasurement measurement = (ManualMeasurement) resource
                .addMeasurement("BASE", new MeasurementRequestDTO(102.0, null, null))
                .getEntity();

        assertThat(locked.biasMedian()).isEqualTo(2.0);
        assertThat(measurement.correctedValue()).isEqualTo(100.0);
    }

    @Test
    void unknownKindIsValidationError() {
        assertThatThrownBy(() -> resource.startSession("middle"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("kind");
    }

    @Test
    void liveQualityIsAttachedOnRequest() {
        when(motionService.latestMetrics())
                .thenReturn(new LiveMetrics(0.0, 0.0, 0.0, 0.1, 0.5, 0.4, 50.0, true, 0.9));
        resource.startSession("final");

        ManualMeasurement measurement = (ManualMeasurement) resource
                .addMeasurement("final", new MeasurementRequestDTO(80.0, true, null))
                .getEntity();

        assertThat(measurement.hasQuality()).isTrue();
        assertThat(measurement.quality().qualityScore()).isEqualTo(0.9);
        assertThat(measurement.quality().rmsRoll()).isEqualTo(0.5);
    }

    @Test
    void resultAndRatioAreNotFoundUntilAvailable() {
        assertThatThrownBy(() -> resource.getSessionResult("base")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> resource.getRatio()).isInstanceOf(NotFoundException.class);

        weigh("base", 100.0, 101.0, 99.0);
        weigh("final", 90.0, 91.0, 89.0);

        SessionResult base = (SessionResult) resource.getSessionResult("base").getEntity();
        RatioResult ratio = (RatioResult) resource.getRatio().getEntity();

        assertThat(base.fixedValue()).isEqualTo(100.0);
        assertThat(ratio.base()).isEqualTo(base);
        assertThat(ratio.percent()).isGreaterThan(9.9).isLessThan(10.1);
    }

    @Test
    void removeMeasurementReturnsNoContent() {
        resource.startSession("base");
        resource.addMeasurement("base", new MeasurementRequestDTO(10.0, null, null));

        assertThat(resource.removeMeasurement("base", 0).getStatus()).isEqualTo(204);
        assertThat(resource.removeMeasurement("base", 7).getStatus()).isEqualTo(204);
    }
}
