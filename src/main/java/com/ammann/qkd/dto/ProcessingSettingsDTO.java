package com.ammann.qkd.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Processing parameters of a simulation request.
 */
@Schema(description = "Processing parameters")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingSettingsDTO(
        @Schema(description = "Number of transmitted pulses")
        Integer blockSize,

        @Schema(description = "Largest clock offset magnitude searched, in bins")
        Integer maxOffset,

        @Schema(description = "Noise-floor standard deviations the correlation peak must exceed")
        Double confidenceThreshold,

        @Schema(description = "Seed of the random stream; omitted for a fresh seed")
        Long seed
) {}
