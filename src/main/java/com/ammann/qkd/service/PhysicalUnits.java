package com.ammann.qkd.service;

import com.ammann.qkd.exception.InvalidParameterException;

/**
 * Conversions from laboratory units to the per-pulse and per-bin quantities the pipeline uses.
 */
public final class PhysicalUnits
{
    private static final String COMPONENT = "PhysicalUnits";
    private static final double PICOSECONDS_PER_SECOND = 1e12;

    private PhysicalUnits() {}

    /**
     * Converts a channel attenuation in dB into the probability that a pulse is lost.
     *
     * @param attenuationDb attenuation, at least 0
     * @return {@code 1 - 10^(-dB / 10)}
     */
    public static double lossProbabilityFromDb(double attenuationDb)
    {
        if (!(attenuationDb >= 0) || Double.isInfinite(attenuationDb)) {
            throw InvalidParameterException.of(COMPONENT, "lossDb", attenuationDb, "finite value >= 0");
        }
        return 1.0 - Math.pow(10.0, -attenuationDb / 10.0);
    }

    /**
     * Converts a detector dark-count rate into the mean number of dark counts per time bin.
     *
     * @param countsPerSecond dark-count rate in counts per second, at least 0
     * @param binWidthPs      time bin width in picoseconds, positive
     * @return {@code 1 - exp(-rate * binWidth)}, the probability of at least one dark count in a bin
     */
    public static double darkCountsPerBin(double countsPerSecond, double binWidthPs)
    {
        if (!(countsPerSecond >= 0) || Double.isInfinite(countsPerSecond)) {
            throw InvalidParameterException.of(COMPONENT, "darkCountRateCps", countsPerSecond, "finite value >= 0");
        }
        if (!(binWidthPs > 0) || Double.isInfinite(binWidthPs)) {
            throw InvalidParameterException.of(COMPONENT, "timeBinWidthPs", binWidthPs, "finite value > 0");
        }
        return -Math.expm1(-countsPerSecond * binWidthPs / PICOSECONDS_PER_SECOND);
    }
}
