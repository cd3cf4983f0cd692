package com.ammann.qkd.dto;

import com.ammann.qkd.model.CorrelationResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Outcome of the clock offset search.
 */
@Schema(description = "Cross-correlation timing recovery result")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CorrelationResultDTO(
        @Schema(description = "Recovered clock offset in bins")
        Integer peakOffset,

        @Schema(description = "Correlation value at the recovered offset")
        Double peakValue,

        @Schema(description = "Whether the peak cleared the confidence threshold")
        Boolean syncSuccess,

        @Schema(description = "Mean correlation over all other offsets")
        Double noiseFloorMean,

        @Schema(description = "Standard deviation of the correlation over all other offsets")
        Double noiseFloorStd,

        @Schema(description = "Peak excess over the noise floor in standard deviations")
        Double peakSignificance
) {
    public static CorrelationResultDTO from(CorrelationResult result) {
        return new CorrelationResultDTO(
                result.peakOffset(),
                result.peakValue(),
                result.syncSuccess(),
                result.noiseFloorMean(),
                result.noiseFloorStd(),
                result.peakSignificance());
    }
}
