package com.ammann.qkd.dto;

import com.ammann.qkd.model.BatchRunSummary;
import com.ammann.qkd.model.BatchSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Aggregated outcome of a batch of runs.
 */
@Schema(description = "Batch simulation summary")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchSimulationResultDTO(
        @Schema(description = "Number of runs")
        Integer runs,

        @Schema(description = "Seed every run seed was derived from")
        Long baseSeed,

        @Schema(description = "Fraction of runs that synchronised")
        Double syncSuccessRate,

        @Schema(description = "Mean QBER over runs with detections")
        Double meanQber,

        @Schema(description = "Standard deviation of the QBER over runs with detections")
        Double qberStd,

        @Schema(description = "Mean detections per run")
        Double meanTotalCounts,

        @Schema(description = "Mean absolute difference between recovered and true offset, in bins")
        Double meanAbsoluteOffsetError,

        @Schema(description = "Runs without any detection")
        Integer degenerateRuns,

        @Schema(description = "Per-run outcomes in run order")
        List<BatchRunSummary> results
) {
    public static BatchSimulationResultDTO from(BatchSummary summary) {
        return new BatchSimulationResultDTO(
                summary.runs(),
                summary.baseSeed(),
                summary.syncSuccessRate(),
                summary.meanQber(),
                summary.qberStd(),
                summary.meanTotalCounts(),
                summary.meanAbsoluteOffsetError(),
                summary.degenerateRuns(),
                summary.results());
    }
}
