/* (C)2026 */
package com.ammann.weighing.dto;

import com.ammann.weighing.model.RawInertialSample;
import com.ammann.weighing.model.Vector3;
import java.util.Optional;
import java.util.OptionalDouble;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One device-motion event as delivered by the sensor collaborator.
 *
 * @param accelerationIncludingGravity acceleration in m/s², null if the sensor was silent
 * @param rotationRate                 rotation rate, carried through but not evaluated
 * @param intervalMs                   interval reported by the device, optional
 * @param timestamp                    capture time in monotonic ms; server clock when absent
 */
@Schema(description = "Raw inertial sample")
public record InertialSampleRequestDTO(
        @Schema(description = "Acceleration including gravity (m/s²); omit when the sensor reported nothing")
                Vector3 accelerationIncludingGravity,
        @Schema(description = "Rotation rate (deg/s)") Vector3 rotationRate,
        @Schema(description = "Device-reported sampling interval (ms)") Double intervalMs,
        @Schema(description = "Capture timestamp (ms)") Long timestamp) {

    public RawInertialSample toRawSample(long fallbackTimestamp) {
        return new RawInertialSample(
                Optional.ofNullable(accelerationIncludingGravity),
                Optional.ofNullable(rotationRate),
                intervalMs != null ? OptionalDouble.of(intervalMs) : OptionalDouble.empty(),
                timestamp != null ? timestamp : fallbackTimestamp);
    }
}
