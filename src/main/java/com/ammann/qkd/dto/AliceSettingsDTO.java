package com.ammann.qkd.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Sender parameters of a simulation request. Null fields take the configured defaults.
 */
@Schema(description = "Sender (Alice) parameters")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AliceSettingsDTO(
        @Schema(description = "Mean photon number of signal pulses")
        Double signalPower,

        @Schema(description = "Mean photon number of decoy pulses")
        Double decoyPower,

        @Schema(description = "Probability of sending a signal pulse, in [0, 1]")
        Double signalProbability
) {}
