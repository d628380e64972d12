/* (C)2026 */
package com.ammann.weighing.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.weighing.model.QualitySnapshot;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Set;
import org.junit.jupiter.api.Test;

@QuarkusTest
class MeasurementRequestValidationTest {

    @Inject
    Validator validator;

    @Test
    void acceptsQualityScoreInsideUnitInterval() {
        MeasurementRequestDTO request = new MeasurementRequestDTO(100.0, null, new QualitySnapshot(1.0, 0.1, 0.2, 0.3));

        assertThat(validator.validate(request)).isEmpty();
    }

    @Test
    void rejectsQualityScoreAboveOne() {
        MeasurementRequestDTO request = new MeasurementRequestDTO(100.0, null, new QualitySnapshot(5.0, 0.1, 0.2, 0.3));

        Set<ConstraintViolation<MeasurementRequestDTO>> violations = validator.validate(request);

        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
                .containsExactly("quality.qualityScore");
    }

    @Test
    void rejectsNegativeQualityScoreAndRms() {
        MeasurementRequestDTO request = new MeasurementRequestDTO(100.0, null, new QualitySnapshot(-0.5, -1.0, 0.2, 0.3));

        Set<ConstraintViolation<MeasurementRequestDTO>> violations = validator.validate(request);

        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
                .containsExactlyInAnyOrder("quality.qualityScore", "quality.rmsVerticalAcceleration");
    }

    @Test
    void requiresReading() {
        MeasurementRequestDTO request = new MeasurementRequestDTO(null, null, null);

        assertThat(validator.validate(request)).extracting(v -> v.getPropertyPath().toString())
                .containsExactly("reading");
    }
}
