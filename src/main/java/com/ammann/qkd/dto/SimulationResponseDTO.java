package com.ammann.qkd.dto;

import com.ammann.qkd.model.SimulationResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Result of one simulation run including the raw series for plotting.
 */
@Schema(description = "Simulation run result")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimulationResponseDTO(
        @Schema(description = "Seed of the run's random stream")
        Long seed,

        @Schema(description = "True clock offset the channel applied, in bins")
        Integer trueOffset,

        @Schema(description = "Timing recovery result")
        CorrelationResultDTO correlation,

        @Schema(description = "Detection statistics")
        SimulationStatisticsDTO statistics,

        @Schema(description = "Candidate offsets in bins (x axis of the correlation series)")
        int[] timePoints,

        @Schema(description = "Correlation value per candidate offset")
        double[] crossCorrelation,

        @Schema(description = "Detections per receiver time bin")
        int[] counts,

        @Schema(description = "Processing time in milliseconds")
        Double processingTimeMs
) {
    public static SimulationResponseDTO from(SimulationResult result) {
        return new SimulationResponseDTO(
                result.seed(),
                result.config().trueOffset(),
                CorrelationResultDTO.from(result.correlation()),
                SimulationStatisticsDTO.from(result.statistics()),
                result.timePoints(),
                result.correlationValues(),
                result.counts(),
                result.durationNanos() / 1_000_000.0);
    }
}
