package com.ammann.qkd.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request for several independent runs of one configuration.
 */
@Schema(description = "Batch of independent simulation runs")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchSimulationRequestDTO(
        @Schema(description = "Parameters shared by every run; the processing seed is ignored")
        SimulationRequestDTO simulation,

        @Schema(description = "Number of runs")
        @NotNull
        @Min(1)
        Integer runs,

        @Schema(description = "Seed every run seed is derived from; omitted for a fresh one")
        Long baseSeed
) {}
