package com.ammann.qkd.dto;

import com.ammann.qkd.enumeration.StatisticsStatus;
import com.ammann.qkd.model.SimulationStatistics;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Count and error summary of a run.
 */
@Schema(description = "Detection statistics of a simulation run")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimulationStatisticsDTO(
        @Schema(description = "Detections of any origin")
        Long totalCounts,

        @Schema(description = "Detections per picosecond of observation time")
        Double meanCountRate,

        @Schema(description = "Quantum bit error rate, in [0, 1]")
        Double qber,

        @Schema(description = "Whether the clock offset was recovered")
        Boolean syncSuccess,

        @Schema(description = "Detections caused by signal pulses")
        Long signalCounts,

        @Schema(description = "Detections caused by decoy pulses")
        Long decoyCounts,

        @Schema(description = "Dark counts")
        Long darkCounts,

        @Schema(description = "Signal detections per picosecond")
        Double signalRate,

        @Schema(description = "Decoy detections per picosecond")
        Double decoyRate,

        @Schema(description = "DEGENERATE when nothing was detected")
        StatisticsStatus status
) {
    public static SimulationStatisticsDTO from(SimulationStatistics statistics) {
        return new SimulationStatisticsDTO(
                statistics.totalCounts(),
                statistics.meanCountRate(),
                statistics.qber(),
                statistics.syncSuccess(),
                statistics.signalCounts(),
                statistics.decoyCounts(),
                statistics.darkCounts(),
                statistics.signalRate(),
                statistics.decoyRate(),
                statistics.status());
    }
}
