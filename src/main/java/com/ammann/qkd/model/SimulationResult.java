package com.ammann.qkd.model;

/**
 * Everything a run hands to its consumers: the recovered timing, the statistics and the raw
 * series behind them.
 *
 * @param config      configuration the run used
 * @param seed        seed of the run's random stream, for reproduction
 * @param correlation correlation over the searched offsets
 * @param statistics  count and error summary
 * @param reference   transmitted signal pattern
 * @param detected    receiver count series per time bin
 * @param durationNanos wall-clock duration of the run
 */
public record SimulationResult(
        SimulationConfig config,
        long seed,
        CorrelationResult correlation,
        SimulationStatistics statistics,
        Histogram reference,
        Histogram detected,
        long durationNanos
) {
    /** Candidate offsets in bins, the x axis of the correlation series. */
    public int[] timePoints()
    {
        return correlation.offsets();
    }

    public double[] correlationValues()
    {
        return correlation.correlationValues();
    }

    public int[] counts()
    {
        return detected.toArray();
    }

    /** Recovered minus true offset; 0 when the clock was recovered exactly. */
    public int offsetError()
    {
        return correlation.peakOffset() - config.trueOffset();
    }
}
