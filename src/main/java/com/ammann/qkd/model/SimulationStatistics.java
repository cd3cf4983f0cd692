package com.ammann.qkd.model;

import com.ammann.qkd.enumeration.StatisticsStatus;

/**
 * Read-only count summary of one run.
 *
 * @param totalCounts   detections of any origin
 * @param meanCountRate detections per picosecond of observation time
 * @param qber          fraction of detections inconsistent with the aligned transmitted state
 * @param syncSuccess   copied from the correlation result
 * @param signalCounts  detections caused by signal pulses
 * @param decoyCounts   detections caused by decoy pulses
 * @param darkCounts    dark counts
 * @param errorCounts   detections counted as errors in the QBER
 * @param signalRate    signal detections per picosecond
 * @param decoyRate     decoy detections per picosecond
 * @param status        DEGENERATE when nothing was detected
 */
public record SimulationStatistics(
        long totalCounts,
        double meanCountRate,
        double qber,
        boolean syncSuccess,
        long signalCounts,
        long decoyCounts,
        long darkCounts,
        long errorCounts,
        double signalRate,
        double decoyRate,
        StatisticsStatus status
) {
    public static SimulationStatistics degenerate(boolean syncSuccess)
    {
        return new SimulationStatistics(0, 0.0, 0.0, syncSuccess, 0, 0, 0, 0, 0.0, 0.0,
                StatisticsStatus.DEGENERATE);
    }

    public boolean isDegenerate()
    {
        return status == StatisticsStatus.DEGENERATE;
    }
}
