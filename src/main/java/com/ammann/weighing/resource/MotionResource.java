/* (C)2026 */
package com.ammann.weighing.resource;

import com.ammann.weighing.dto.InertialSampleRequestDTO;
import com.ammann.weighing.dto.ReadingRequestDTO;
import com.ammann.weighing.model.LiveMetrics;
import com.ammann.weighing.model.MeasurementResult;
import com.ammann.weighing.model.OrientationUpdate;
import com.ammann.weighing.model.SessionProgress;
import com.ammann.weighing.properties.ApiProperties;
import com.ammann.weighing.service.MotionMeasurementService;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Clock;
import java.util.Optional;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for the inertial stream, the live scale value and the continuous session.
 *
 * <p>The sensor collaborator posts raw samples as they arrive; the scale collaborator
 * keeps the live reading current. A continuous session samples both between start and stop.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Motion API", description = "Inertial processing and continuous weighing sessions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class MotionResource {

    private static final Logger LOG = Logger.getLogger(MotionResource.class);

    @Inject
    MotionMeasurementService motionService;

    @Inject
    Clock clock;

    @POST
    @Path(ApiProperties.Imu.SAMPLES)
    @Operation(
            summary = "Ingest inertial sample",
            description = "Processes one raw accelerometer sample and returns the derived vertical acceleration, roll, pitch and live metrics"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Sample processed",
                    content = @Content(schema = @Schema(implementation = OrientationUpdate.class))),
            @APIResponse(responseCode = "204", description = "Sample ignored (sensor silent) or used to seed the gravity estimate"),
            @APIResponse(responseCode = "400", description = "Malformed sample")
    })
    public Response ingestSample(@NotNull InertialSampleRequestDTO request) {
        Optional<OrientationUpdate> update = motionService.ingest(request.toRawSample(clock.millis()));
        return update.map(u -> Response.ok(u).build())
                .orElseGet(() -> Response.noContent().build());
    }

    @GET
    @Path(ApiProperties.Imu.METRICS)
    @Operation(summary = "Live motion metrics", description = "Most recent live metrics of the orientation estimator")
    @APIResponse(responseCode = "200", description = "Current metrics",
            content = @Content(schema = @Schema(implementation = LiveMetrics.class)))
    public Response getLiveMetrics() {
        return Response.ok(motionService.latestMetrics()).build();
    }

    @POST
    @Path(ApiProperties.Imu.RESET)
    @Operation(summary = "Reset orientation estimator", description = "Clears the metric windows and re-arms gravity seeding")
    @APIResponse(responseCode = "204", description = "Estimator reset")
    public Response resetEstimator() {
        motionService.resetEstimator();
        return Response.noContent().build();
    }

    @PUT
    @Path(ApiProperties.Scale.READING)
    @Operation(summary = "Update live scale reading", description = "Sets the value polled by a running continuous session")
    @APIResponses({
            @APIResponse(responseCode = "204", description = "Reading stored"),
            @APIResponse(responseCode = "400", description = "Missing reading")
    })
    public Response updateScaleReading(@Valid @NotNull ReadingRequestDTO request) {
        motionService.updateScaleReading(request.reading());
        return Response.noContent().build();
    }

    @POST
    @Path(ApiProperties.Continuous.START)
    @Operation(summary = "Start continuous session", description = "Starts collecting inertial samples and scale readings; ignored when already running")
    @APIResponse(responseCode = "200", description = "Session running",
            content = @Content(schema = @Schema(implementation = SessionProgress.class)))
    public Response startContinuousSession() {
        motionService.startSession();
        return Response.ok(motionService.progress()).build();
    }

    @GET
    @Path(ApiProperties.Continuous.PROGRESS)
    @Operation(summary = "Continuous session progress", description = "Elapsed time, sample count and good-sample count")
    @APIResponse(responseCode = "200", description = "Progress",
            content = @Content(schema = @Schema(implementation = SessionProgress.class)))
    public Response getContinuousProgress() {
        return Response.ok(motionService.progress()).build();
    }

    @POST
    @Path(ApiProperties.Continuous.RESET)
    @Operation(summary = "Reset continuous session data", description = "Drops collected samples without stopping the session")
    @APIResponse(responseCode = "200", description = "Progress after reset",
            content = @Content(schema = @Schema(implementation = SessionProgress.class)))
    public Response resetContinuousSession() {
        motionService.resetSession();
        return Response.ok(motionService.progress()).build();
    }

    @POST
    @Path(ApiProperties.Continuous.STOP)
    @Operation(
            summary = "Stop continuous session",
            description = "Stops the session and computes the fixed measurement with its 95% error band"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Result computed",
                    content = @Content(schema = @Schema(implementation = MeasurementResult.class))),
            @APIResponse(responseCode = "400", description = "No session running or invalid bias")
    })
    public Response stopContinuousSession(
            @Parameter(description = "Tare bias in grams (default: 0)")
            @QueryParam("bias") @DefaultValue("0") double bias,
            @Parameter(description = "Apply vertical-acceleration correction (default: true)")
            @QueryParam("motionCorrection") @DefaultValue("true") boolean motionCorrection) {

        LOG.debugf("Continuous stop request: bias=%.3f, motionCorrection=%s", bias, motionCorrection);

        MeasurementResult result = motionService.stopSession(bias, motionCorrection);
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Continuous.RESULT)
    @Operation(summary = "Last continuous result", description = "Result of the most recently stopped continuous session")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Result available",
                    content = @Content(schema = @Schema(implementation = MeasurementResult.class))),
            @APIResponse(responseCode = "404", description = "No session has been completed yet")
    })
    public Response getContinuousResult() {
        MeasurementResult result = motionService.lastResult()
                .orElseThrow(() -> new NotFoundException("No continuous session result available"));
        return Response.ok(result).build();
    }
}
