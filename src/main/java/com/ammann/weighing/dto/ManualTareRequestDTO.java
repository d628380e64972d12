/* (C)2026 */
package com.ammann.weighing.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * User-entered tare that overrides the sample-based estimate.
 */
@Schema(description = "User-entered tare bias and 95% uncertainty")
public record ManualTareRequestDTO(
        @NotNull @Schema(description = "Tare bias (g)", example = "1.2", required = true) Double bias,
        @PositiveOrZero @Schema(description = "95% tare uncertainty (g); 0 when omitted", example = "0.5")
                Double tareUncertainty95) {

    public double tareUncertainty95OrZero() {
        return tareUncertainty95 != null ? tareUncertainty95 : 0.0;
    }
}
