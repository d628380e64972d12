/* (C)2026 */
package com.ammann.weighing.resource;

import com.ammann.weighing.config.EstimatorConfig;
import com.ammann.weighing.config.EstimatorConfigRegistry;
import com.ammann.weighing.dto.ConfigOverrideDTO;
import com.ammann.weighing.properties.ApiProperties;
import jakarta.inject.Inject;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Read and hot-swap the estimator configuration. Running sessions keep the snapshot they
 * started with.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Configuration API", description = "Estimator thresholds and coefficients")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigurationResource {

    @Inject
    EstimatorConfigRegistry configRegistry;

    @GET
    @Path(ApiProperties.Config.BASE)
    @Operation(summary = "Current configuration")
    @APIResponse(responseCode = "200", description = "Configuration in force",
            content = @Content(schema = @Schema(implementation = EstimatorConfig.class)))
    public Response getConfig() {
        return Response.ok(configRegistry.current()).build();
    }

    @PATCH
    @Path(ApiProperties.Config.BASE)
    @Operation(summary = "Update configuration", description = "Overwrites the given fields and keeps the others")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Updated configuration",
                    content = @Content(schema = @Schema(implementation = EstimatorConfig.class))),
            @APIResponse(responseCode = "400", description = "Merged configuration invalid")
    })
    public Response updateConfig(@NotNull ConfigOverrideDTO overrides) {
        if (overrides.isEmpty()) {
            return Response.ok(configRegistry.current()).build();
        }
        return Response.ok(configRegistry.update(overrides)).build();
    }

    @POST
    @Path(ApiProperties.Config.RESET)
    @Operation(summary = "Reset configuration", description = "Restores the values the application started with")
    @APIResponse(responseCode = "200", description = "Startup configuration",
            content = @Content(schema = @Schema(implementation = EstimatorConfig.class)))
    public Response resetConfig() {
        return Response.ok(configRegistry.reset()).build();
    }
}
