package com.ammann.qkd.dto;

import com.ammann.qkd.enumeration.LossModel;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Channel parameters of a simulation request.
 *
 * <p>Loss is given either as a probability or as an attenuation in dB; the probability wins when
 * both are set.
 */
@Schema(description = "Channel parameters")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelSettingsDTO(
        @Schema(description = "Probability that a pulse is lost, in [0, 1]")
        Double lossProbability,

        @Schema(description = "Channel attenuation in dB")
        Double lossDb,

        @Schema(description = "True receiver clock offset in bins")
        Integer trueOffset,

        @Schema(description = "Arrival jitter standard deviation in bins")
        Double jitterStd,

        @Schema(description = "Per-pulse survival model")
        LossModel lossModel
) {}
