package com.ammann.qkd.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Parameters of one simulation run, grouped by sender, receiver, channel and processing.
 * Any group or field may be omitted.
 */
@Schema(description = "Simulation parameters")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimulationRequestDTO(
        @Schema(description = "Sender parameters")
        AliceSettingsDTO alice,

        @Schema(description = "Receiver parameters")
        BobSettingsDTO bob,

        @Schema(description = "Channel parameters")
        ChannelSettingsDTO channel,

        @Schema(description = "Processing parameters")
        ProcessingSettingsDTO processing
) {
    public static SimulationRequestDTO empty() {
        return new SimulationRequestDTO(null, null, null, null);
    }
}
