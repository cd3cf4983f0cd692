package com.ammann.qkd.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Receiver parameters of a simulation request.
 *
 * <p>The dark-count level is given either per time bin ({@code darkCountRate}) or as a detector
 * rate in counts per second ({@code darkCountRateCps}); the per-bin value wins when both are set.
 */
@Schema(description = "Receiver (Bob) parameters")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BobSettingsDTO(
        @Schema(description = "Mean dark counts per time bin")
        Double darkCountRate,

        @Schema(description = "Detector dark-count rate in counts per second")
        Double darkCountRateCps,

        @Schema(description = "Time bin width in picoseconds")
        Double timeBinWidthPs
) {}
