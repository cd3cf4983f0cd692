package com.ammann.qkd.resource;

import com.ammann.qkd.config.SimulationDefaults;
import com.ammann.qkd.dto.BatchSimulationRequestDTO;
import com.ammann.qkd.dto.BatchSimulationResultDTO;
import com.ammann.qkd.dto.SimulationRequestDTO;
import com.ammann.qkd.dto.SimulationResponseDTO;
import com.ammann.qkd.model.BatchSummary;
import com.ammann.qkd.model.SimulationConfig;
import com.ammann.qkd.model.SimulationResult;
import com.ammann.qkd.properties.ApiProperties;
import com.ammann.qkd.service.QuantumChannelSimulationService;
import com.ammann.qkd.service.SimulationBatchService;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
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
import org.jboss.logging.Logger;

/**
 * REST resource for running quantum channel simulations.
 *
 * <p>Accepts partially filled parameter sets, completes them with the configured defaults and
 * runs the simulation pipeline. Invalid parameters are answered with HTTP 400 naming the
 * rejecting pipeline component; runs without detections succeed with DEGENERATE statistics.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Simulation API", description = "Decoy-state QKD channel simulation and clock recovery")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SimulationResource {

    private static final Logger LOG = Logger.getLogger(SimulationResource.class);

    @Inject
    QuantumChannelSimulationService simulationService;

    @Inject
    SimulationBatchService batchService;

    @Inject
    SimulationDefaults defaults;

    @POST
    @Path(ApiProperties.Simulations.BASE)
    @Operation(
            summary = "Run Simulation",
            description = "Simulates one block of signal and decoy pulses through the channel, recovers the clock offset by cross-correlation and computes count statistics and QBER"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Simulation completed",
                    content = @Content(schema = @Schema(implementation = SimulationResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid simulation parameters"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response runSimulation(SimulationRequestDTO request) {

        SimulationConfig config = defaults.resolve(request);
        LOG.debugf("Simulation request resolved to %s", config);

        SimulationResult result = simulationService.runSimulation(config);

        LOG.infof("Simulation completed in %.2fms: peak offset %d, sync=%s",
                result.durationNanos() / 1_000_000.0, result.correlation().peakOffset(),
                result.statistics().syncSuccess());
        return Response.ok(SimulationResponseDTO.from(result)).build();
    }

    @POST
    @Path(ApiProperties.Simulations.BATCH)
    @Operation(
            summary = "Run Simulation Batch",
            description = "Runs independent simulations of one configuration in parallel, each with its own derived seed, and aggregates synchronisation rate and QBER"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Batch completed",
                    content = @Content(schema = @Schema(implementation = BatchSimulationResultDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid simulation parameters or run count"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response runBatch(@Valid @NotNull BatchSimulationRequestDTO request) {

        SimulationConfig config = defaults.resolve(request.simulation());
        LOG.debugf("Batch request: %d runs, base seed %s", request.runs(), request.baseSeed());

        BatchSummary summary = batchService.runBatch(config, request.runs(), request.baseSeed());

        return Response.ok(BatchSimulationResultDTO.from(summary)).build();
    }

    @GET
    @Path(ApiProperties.Simulations.DEFAULTS)
    @Operation(
            summary = "Default Parameters",
            description = "Returns the parameter values used for every field a simulation request omits"
    )
    @APIResponse(responseCode = "200", description = "Configured defaults",
            content = @Content(schema = @Schema(implementation = SimulationRequestDTO.class)))
    public Response getDefaults() {
        return Response.ok(defaults.asRequest()).build();
    }
}
