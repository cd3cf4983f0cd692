package com.ammann.qkd.model;

import java.util.List;

/**
 * Aggregate over independent runs of one configuration.
 *
 * @param runs                    number of runs
 * @param baseSeed                seed every run seed was derived from
 * @param syncSuccessRate         fraction of runs that synchronised
 * @param meanQber                mean QBER over non-degenerate runs, 0 if there are none
 * @param qberStd                 population standard deviation of that QBER
 * @param meanTotalCounts         mean detections per run
 * @param meanAbsoluteOffsetError mean of |recovered - true offset|
 * @param degenerateRuns          runs without any detection
 * @param results                 per-run summaries in run order
 */
public record BatchSummary(
        int runs,
        long baseSeed,
        double syncSuccessRate,
        double meanQber,
        double qberStd,
        double meanTotalCounts,
        double meanAbsoluteOffsetError,
        int degenerateRuns,
        List<BatchRunSummary> results
) {
    public BatchSummary {
        results = List.copyOf(results);
    }
}
