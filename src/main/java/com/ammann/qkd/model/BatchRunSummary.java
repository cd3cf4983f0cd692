package com.ammann.qkd.model;

import com.ammann.qkd.enumeration.StatisticsStatus;

/**
 * Condensed outcome of one run inside a batch.
 */
public record BatchRunSummary(
        int runIndex,
        long seed,
        int peakOffset,
        boolean syncSuccess,
        long totalCounts,
        double qber,
        StatisticsStatus status
) {
    public static BatchRunSummary of(int runIndex, SimulationResult result)
    {
        return new BatchRunSummary(
                runIndex,
                result.seed(),
                result.correlation().peakOffset(),
                result.statistics().syncSuccess(),
                result.statistics().totalCounts(),
                result.statistics().qber(),
                result.statistics().status());
    }
}
