/* (C)2026 */
package com.ammann.weighing.dto;

import jakarta.validation.constraints.NotNull;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Single scale value in grams, used for live scale updates and tare readings.
 */
@Schema(description = "Scale reading in grams")
public record ReadingRequestDTO(
        @NotNull @Schema(description = "Reading (g)", example = "152.4", required = true) Double reading) {}
