/* (C)2026 */
package com.ammann.weighing.resource;

import com.ammann.weighing.dto.ManualTareRequestDTO;
import com.ammann.weighing.dto.MeasurementRequestDTO;
import com.ammann.weighing.dto.ReadingRequestDTO;
import com.ammann.weighing.enumeration.SessionKind;
import com.ammann.weighing.exception.ValidationException;
import com.ammann.weighing.model.ManualMeasurement;
import com.ammann.weighing.model.QualitySnapshot;
import com.ammann.weighing.model.RatioResult;
import com.ammann.weighing.model.SessionResult;
import com.ammann.weighing.model.TareEstimate;
import com.ammann.weighing.properties.ApiProperties;
import com.ammann.weighing.service.ManualWeighingService;
import com.ammann.weighing.service.MotionMeasurementService;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for tare handling, manual base/final sessions and their ratio.
 *
 * <p>Session kinds are addressed by path as {@code base} or {@code final}
 * (case-insensitive).
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Weighing API", description = "Tare, manual weighing sessions and base/final ratio")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class WeighingResource {

    private static final Logger LOG = Logger.getLogger(WeighingResource.class);

    @Inject
    ManualWeighingService weighingService;

    @Inject
    MotionMeasurementService motionService;

    // Tare

    @POST
    @Path(ApiProperties.Tare.SAMPLES)
    @Operation(summary = "Add tare reading", description = "Adds a zero-load reading and returns the updated tare estimate")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Reading added",
                    content = @Content(schema = @Schema(implementation = TareEstimate.class))),
            @APIResponse(responseCode = "400", description = "Reading missing, NaN or negative")
    })
    public Response addTareSample(@Valid @NotNull ReadingRequestDTO request) {
        return Response.ok(weighingService.addTareSample(request.reading())).build();
    }

    @DELETE
    @Path(ApiProperties.Tare.SAMPLE)
    @Operation(summary = "Remove tare reading", description = "Removes the tare reading at the given index; out-of-range indices are ignored")
    @APIResponse(responseCode = "200", description = "Updated tare estimate",
            content = @Content(schema = @Schema(implementation = TareEstimate.class)))
    public Response removeTareSample(
            @Parameter(description = "Zero-based reading index")
            @PathParam("index") int index) {
        return Response.ok(weighingService.removeTareSample(index)).build();
    }

    @DELETE
    @Path(ApiProperties.Tare.SAMPLES)
    @Operation(summary = "Clear tare readings")
    @APIResponse(responseCode = "204", description = "All tare readings removed")
    public Response clearTareSamples() {
        weighingService.clearTareSamples();
        return Response.noContent().build();
    }

    @GET
    @Path(ApiProperties.Tare.ESTIMATE)
    @Operation(summary = "Current tare estimate", description = "User-entered tare when present, otherwise the half-range estimate of the readings")
    @APIResponse(responseCode = "200", description = "Tare estimate",
            content = @Content(schema = @Schema(implementation = TareEstimate.class)))
    public Response getTareEstimate() {
        return Response.ok(weighingService.tareEstimate()).build();
    }

    @PUT
    @Path(ApiProperties.Tare.MANUAL)
    @Operation(summary = "Enter tare manually", description = "Overrides the sample-based tare estimate")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Tare stored",
                    content = @Content(schema = @Schema(implementation = TareEstimate.class))),
            @APIResponse(responseCode = "400", description = "Invalid bias or uncertainty")
    })
    public Response enterManualTare(@Valid @NotNull ManualTareRequestDTO request) {
        TareEstimate tare = weighingService.enterManualTare(request.bias(), request.tareUncertainty95OrZero());
        return Response.ok(tare).build();
    }

    @DELETE
    @Path(ApiProperties.Tare.MANUAL)
    @Operation(summary = "Clear manual tare", description = "Falls back to the sample-based tare estimate")
    @APIResponse(responseCode = "204", description = "Manual tare cleared")
    public Response clearManualTare() {
        weighingService.clearManualTare();
        return Response.noContent().build();
    }

    // Manual sessions

    @POST
    @Path(ApiProperties.Manual.START)
    @Operation(summary = "Start manual session", description = "Starts the base or final session and locks the current tare")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Session started; body is the locked tare",
                    content = @Content(schema = @Schema(implementation = TareEstimate.class))),
            @APIResponse(responseCode = "400", description = "Unknown session kind")
    })
    public Response startSession(
            @Parameter(description = "Session kind: base or final")
            @PathParam("kind") String kind) {
        return Response.ok(weighingService.startSession(parseKind(kind))).build();
    }

    @POST
    @Path(ApiProperties.Manual.MEASUREMENTS)
    @Operation(summary = "Add manual measurement", description = "Records a scale reading corrected by the locked tare")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Measurement stored",
                    content = @Content(schema = @Schema(implementation = ManualMeasurement.class))),
            @APIResponse(responseCode = "400", description = "Session not active or invalid reading")
    })
    public Response addMeasurement(
            @Parameter(description = "Session kind: base or final")
            @PathParam("kind") String kind,
            @Valid @NotNull MeasurementRequestDTO request) {

        SessionKind sessionKind = parseKind(kind);
        QualitySnapshot quality = request.wantsLiveQuality()
                ? QualitySnapshot.from(motionService.latestMetrics())
                : request.quality();

        ManualMeasurement measurement = weighingService.addMeasurement(sessionKind, request.reading(), quality);
        LOG.debugf("Manual %s measurement: %.3f g -> %.3f g", sessionKind, measurement.scaleReading(),
                measurement.correctedValue());
        return Response.ok(measurement).build();
    }

    @DELETE
    @Path(ApiProperties.Manual.MEASUREMENT)
    @Operation(summary = "Remove manual measurement", description = "Out-of-range indices are ignored")
    @APIResponse(responseCode = "204", description = "Measurement removed")
    public Response removeMeasurement(
            @Parameter(description = "Session kind: base or final")
            @PathParam("kind") String kind,
            @Parameter(description = "Zero-based measurement index")
            @PathParam("index") int index) {
        weighingService.removeMeasurement(parseKind(kind), index);
        return Response.noContent().build();
    }

    @POST
    @Path(ApiProperties.Manual.STOP)
    @Operation(summary = "Stop manual session", description = "Stops the session and computes its result")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Result computed",
                    content = @Content(schema = @Schema(implementation = SessionResult.class))),
            @APIResponse(responseCode = "400", description = "Session not active or unknown kind")
    })
    public Response stopSession(
            @Parameter(description = "Session kind: base or final")
            @PathParam("kind") String kind) {
        return Response.ok(weighingService.stopSession(parseKind(kind))).build();
    }

    @GET
    @Path(ApiProperties.Manual.RESULT)
    @Operation(summary = "Manual session result", description = "Result of the last completed session of the given kind")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Result available",
                    content = @Content(schema = @Schema(implementation = SessionResult.class))),
            @APIResponse(responseCode = "404", description = "Session not completed yet")
    })
    public Response getSessionResult(
            @Parameter(description = "Session kind: base or final")
            @PathParam("kind") String kind) {
        SessionKind sessionKind = parseKind(kind);
        SessionResult result = weighingService.sessionResult(sessionKind)
                .orElseThrow(() -> new NotFoundException("No result for " + sessionKind + " session"));
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Manual.RATIO)
    @Operation(
            summary = "Base/final ratio",
            description = "Relative change (Wbase - Wfinal) / Wbase with propagated 95% uncertainty"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Ratio computed",
                    content = @Content(schema = @Schema(implementation = RatioResult.class))),
            @APIResponse(responseCode = "404", description = "Base or final session not completed")
    })
    public Response getRatio() {
        RatioResult ratio = weighingService.ratio()
                .orElseThrow(() -> new NotFoundException("Both base and final sessions must be completed"));
        return Response.ok(ratio).build();
    }

    private static SessionKind parseKind(String kind) {
        try {
            return SessionKind.fromValue(kind);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter("kind", kind, "base or final");
        }
    }
}
