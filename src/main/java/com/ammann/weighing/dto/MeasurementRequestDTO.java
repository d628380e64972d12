/* (C)2026 */
package com.ammann.weighing.dto;

import com.ammann.weighing.model.QualitySnapshot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Manual measurement capture.
 *
 * <p>An explicit {@code quality} snapshot wins over {@code attachLiveQuality}, which takes the
 * current live metrics of the orientation estimator.
 */
@Schema(description = "Manual scale reading with optional motion quality snapshot")
public record MeasurementRequestDTO(
        @NotNull @Schema(description = "Raw scale reading (g)", example = "151.8", required = true) Double reading,
        @Schema(description = "Attach the current live motion quality") Boolean attachLiveQuality,
        @Valid @Schema(description = "Explicit motion quality snapshot") QualitySnapshot quality) {

    public boolean wantsLiveQuality() {
        return quality == null && Boolean.TRUE.equals(attachLiveQuality);
    }
}
