/* (C)2026 */
package com.ammann.weighing.dto;

import com.ammann.weighing.config.EstimatorConfig;
import com.ammann.weighing.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Partial configuration update. Absent fields keep their current value.
 */
@Schema(description = "Partial estimator configuration overwrite; omitted fields are left unchanged")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfigOverrideDTO(
        @Schema(description = "RMS gate on vertical acceleration (m/s²)", example = "0.35") Double azRmsThreshold,
        @Schema(description = "RMS gate on roll (deg)", example = "2.5") Double rollRmsThreshold,
        @Schema(description = "RMS gate on pitch (deg)", example = "2.5") Double pitchRmsThreshold,
        @Schema(description = "Per-sample gate on |a_z| (m/s²)", example = "0.8") Double azInstantThreshold,
        @Schema(description = "Per-sample gate on |roll| (deg)", example = "6.0") Double rollInstantThreshold,
        @Schema(description = "Per-sample gate on |pitch| (deg)", example = "6.0") Double pitchInstantThreshold,
        @Schema(description = "Gravity filter coefficient, 0.90-0.98 recommended", example = "0.92") Double gravityFilterAlpha,
        @Schema(description = "Nominal sample mass (g)", example = "150") Double sampleMassDefault,
        @Schema(description = "Scale polling cadence (Hz)", example = "5") Double scaleSampleRateHz,
        @Schema(description = "Live metrics window (s)", example = "5") Double liveWindowSeconds,
        @Schema(description = "Motion uncertainty excursion factor", example = "2.0") Double uncertaintyK,
        @Schema(description = "Standard gravity (m/s²)", example = "9.80665") Double standardGravity,
        @Schema(description = "Share trimmed from each end by the robust means", example = "0.10") Double trimFraction) {

    /**
     * Merges this overwrite onto {@code base}.
     *
     * @throws ValidationException if a value is not finite or the merged snapshot is invalid
     */
    public EstimatorConfig applyTo(EstimatorConfig base) {
        try {
            return new EstimatorConfig(
                    pick("azRmsThreshold", azRmsThreshold, base.azRmsThreshold()),
                    pick("rollRmsThreshold", rollRmsThreshold, base.rollRmsThreshold()),
                    pick("pitchRmsThreshold", pitchRmsThreshold, base.pitchRmsThreshold()),
                    pick("azInstantThreshold", azInstantThreshold, base.azInstantThreshold()),
                    pick("rollInstantThreshold", rollInstantThreshold, base.rollInstantThreshold()),
                    pick("pitchInstantThreshold", pitchInstantThreshold, base.pitchInstantThreshold()),
                    pick("gravityFilterAlpha", gravityFilterAlpha, base.gravityFilterAlpha()),
                    pick("sampleMassDefault", sampleMassDefault, base.sampleMassDefault()),
                    pick("scaleSampleRateHz", scaleSampleRateHz, base.scaleSampleRateHz()),
                    pick("liveWindowSeconds", liveWindowSeconds, base.liveWindowSeconds()),
                    pick("uncertaintyK", uncertaintyK, base.uncertaintyK()),
                    pick("standardGravity", standardGravity, base.standardGravity()),
                    pick("trimFraction", trimFraction, base.trimFraction()));
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidConfiguration(e);
        }
    }

    public boolean isEmpty() {
        return azRmsThreshold == null && rollRmsThreshold == null && pitchRmsThreshold == null
                && azInstantThreshold == null && rollInstantThreshold == null && pitchInstantThreshold == null
                && gravityFilterAlpha == null && sampleMassDefault == null && scaleSampleRateHz == null
                && liveWindowSeconds == null && uncertaintyK == null && standardGravity == null
                && trimFraction == null;
    }

    private static double pick(String name, Double override, double current) {
        if (override == null) {
            return current;
        }
        if (!Double.isFinite(override)) {
            throw ValidationException.invalidParameter(name, override, "finite number");
        }
        return override;
    }
}
